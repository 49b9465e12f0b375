package net.cloudtolocalllm.relay.auth;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.cloudtolocalllm.relay.config.RelayConfig;

@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class AuthSettings {
    private static final int DEFAULT_KEY_TTL_SECONDS = 600;
    private static final int DEFAULT_SKEW_SECONDS = 60;
    private static final int DEFAULT_REFRESH_COOLDOWN_SECONDS = 60;

    /**
     * Expected {@code iss}; null accepts any issuer.
     */
    private final String issuer;
    private final String audience;
    private final Duration clockSkew;
    private final Duration keyTtl;
    private final Duration refreshCooldown;
    private final Set<String> requiredScopes;

    public static AuthSettings fromConfig(RelayConfig.AuthConfig auth) {
        if (auth == null) {
            throw new IllegalArgumentException("auth config is required");
        }
        return new AuthSettings(
                auth.issuer == null || auth.issuer.isBlank() ? null : auth.issuer.trim(),
                auth.audience.trim(),
                Duration.ofSeconds(auth.clockSkewSeconds == null ? DEFAULT_SKEW_SECONDS : auth.clockSkewSeconds),
                Duration.ofSeconds(auth.keyTtlSeconds == null ? DEFAULT_KEY_TTL_SECONDS : auth.keyTtlSeconds),
                Duration.ofSeconds(auth.refreshCooldownSeconds == null
                        ? DEFAULT_REFRESH_COOLDOWN_SECONDS : auth.refreshCooldownSeconds),
                auth.requiredScopes == null ? Set.of() : Set.copyOf(new LinkedHashSet<>(auth.requiredScopes))
        );
    }
}

package net.cloudtolocalllm.relay.auth;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import lombok.NonNull;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Verified identity extracted from a bearer token.
 */
@Value
@Accessors(fluent = true)
public class Claims {
    @NonNull
    String subject;
    String issuer;
    @NonNull
    List<String> audience;
    @NonNull
    Instant expiresAt;
    Instant issuedAt;
    @NonNull
    Set<String> scopes;

    public String userId() {
        return subject;
    }

    public boolean hasScope(String scope) {
        return scopes.contains(scope);
    }

    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }
}

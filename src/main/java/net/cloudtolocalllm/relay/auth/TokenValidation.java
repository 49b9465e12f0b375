package net.cloudtolocalllm.relay.auth;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;

/**
 * Result of {@link TokenValidator#validate(String)}: claims when valid, an error otherwise.
 */
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class TokenValidation {
    public final Claims claims;
    public final AuthError error;
    public final String message;

    public static TokenValidation ok(Claims claims) {
        return new TokenValidation(claims, null, null);
    }

    public static TokenValidation error(AuthError error, String message) {
        return new TokenValidation(null, error, message);
    }

    public boolean isOk() {
        return claims != null;
    }
}

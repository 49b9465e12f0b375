package net.cloudtolocalllm.relay.auth;

/**
 * Why a bearer token was rejected. {@link #code()} is the stable identifier sent to clients.
 */
public enum AuthError {
    EXPIRED("TOKEN_EXPIRED"),
    NOT_YET_VALID("TOKEN_NOT_ACTIVE"),
    BAD_SIGNATURE("INVALID_SIGNATURE"),
    WRONG_AUDIENCE("INVALID_AUDIENCE"),
    WRONG_ISSUER("INVALID_ISSUER"),
    MISSING_SCOPE("INSUFFICIENT_SCOPE"),
    MALFORMED("MALFORMED_TOKEN");

    private final String code;

    AuthError(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}

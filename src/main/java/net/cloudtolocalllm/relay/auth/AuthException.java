package net.cloudtolocalllm.relay.auth;

/**
 * A request was refused because its bearer token is missing or invalid.
 */
public class AuthException extends Exception {
    private final AuthError error;

    public AuthException(AuthError error, String message) {
        super(message);
        this.error = error;
    }

    public static AuthException from(TokenValidation validation) {
        return new AuthException(validation.error, validation.message);
    }

    public AuthError error() {
        return error;
    }
}

package net.cloudtolocalllm.relay.auth;

/**
 * Produces log-safe stand-ins for bearer tokens.
 */
public final class TokenRedactor {
    private static final String REDACTED = "REDACTED";
    private static final int TAIL = 4;

    private TokenRedactor() {
    }

    /**
     * @return {@code null} for null, empty for empty, otherwise {@code REDACTED}
     */
    public static String redact(String token) {
        if (token == null) {
            return null;
        }
        if (token.isEmpty()) {
            return "";
        }
        return REDACTED;
    }

    /**
     * Keeps the last few characters of the signature so operators can tell tokens apart.
     */
    public static String fingerprint(String token) {
        if (token == null || token.length() <= TAIL * 4) {
            return redact(token);
        }
        return REDACTED + "..." + token.substring(token.length() - TAIL);
    }
}

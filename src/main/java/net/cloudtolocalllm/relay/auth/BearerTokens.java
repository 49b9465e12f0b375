package net.cloudtolocalllm.relay.auth;

/**
 * Extracts tokens from {@code Authorization: Bearer ...} headers.
 */
public final class BearerTokens {
    private static final String PREFIX = "bearer ";

    private BearerTokens() {
    }

    /**
     * @return the token, or null when the header is absent or not a bearer credential
     */
    public static String extract(String authorizationHeader) {
        if (authorizationHeader == null) {
            return null;
        }
        String value = authorizationHeader.trim();
        if (value.length() <= PREFIX.length() || !value.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            return null;
        }
        String token = value.substring(PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    public static String header(String token) {
        return "Bearer " + token;
    }
}

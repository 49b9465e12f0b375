package net.cloudtolocalllm.relay.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * One-way hash of a user id, used for resource names and log lines instead of the raw id.
 */
public final class UserIdHash {
    public static final int SHORT_LENGTH = 12;

    private UserIdHash() {
    }

    /**
     * Lowercase hex SHA-256 of the user id.
     */
    public static String hash(String userId) {
        if (userId == null || userId.isEmpty()) {
            throw new IllegalArgumentException("userId is required");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(userId.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * First {@value #SHORT_LENGTH} hex characters of {@link #hash(String)}.
     */
    public static String shortHash(String userId) {
        return hash(userId).substring(0, SHORT_LENGTH);
    }
}

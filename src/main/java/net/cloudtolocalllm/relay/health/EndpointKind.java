package net.cloudtolocalllm.relay.health;

import java.util.Locale;

/**
 * Where inference traffic can be sent, in routing priority order.
 */
public enum EndpointKind {
    LOCAL_INFERENCE("local", "/api/version"),
    CLOUD_RELAY("cloud", "/health"),
    TUNNEL("tunnel", "/health");

    private final String wireName;
    private final String defaultHealthPath;

    EndpointKind(String wireName, String defaultHealthPath) {
        this.wireName = wireName;
        this.defaultHealthPath = defaultHealthPath;
    }

    /**
     * Name used in config files and IPC payloads.
     */
    public String wireName() {
        return wireName;
    }

    public String defaultHealthPath() {
        return defaultHealthPath;
    }

    public boolean isRemote() {
        return this != LOCAL_INFERENCE;
    }

    public static EndpointKind fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("endpoint kind is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EndpointKind kind : values()) {
            if (kind.wireName.equals(normalized) || kind.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unknown endpoint kind: " + value);
    }
}

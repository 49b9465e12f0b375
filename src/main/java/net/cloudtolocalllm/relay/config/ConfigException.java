package net.cloudtolocalllm.relay.config;

/**
 * Raised when the relay configuration cannot be loaded or fails validation.
 */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}

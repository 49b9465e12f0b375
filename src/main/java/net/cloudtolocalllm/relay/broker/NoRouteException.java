package net.cloudtolocalllm.relay.broker;

/**
 * No endpoint can serve the request right now.
 */
public class NoRouteException extends Exception {
    public NoRouteException(String message) {
        super(message);
    }

    public NoRouteException(String message, Throwable cause) {
        super(message, cause);
    }
}

package net.cloudtolocalllm.relay.http;

/**
 * Receives newline-delimited records from a streaming response, on the channel's event loop.
 */
@FunctionalInterface
public interface LineListener {
    void onLine(String line);
}

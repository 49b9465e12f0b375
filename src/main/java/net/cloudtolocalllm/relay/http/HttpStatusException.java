package net.cloudtolocalllm.relay.http;

import java.io.IOException;

/**
 * Upstream answered with a non-2xx status.
 */
public class HttpStatusException extends IOException {
    private final int status;

    public HttpStatusException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int status() {
        return status;
    }
}

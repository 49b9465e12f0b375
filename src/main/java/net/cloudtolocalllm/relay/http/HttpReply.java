package net.cloudtolocalllm.relay.http;

import java.nio.charset.StandardCharsets;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Fully buffered HTTP response.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class HttpReply {
    private final int status;
    private final byte[] body;

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public String bodyText() {
        return new String(body, StandardCharsets.UTF_8);
    }
}

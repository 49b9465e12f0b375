package net.cloudtolocalllm.relay.auth;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import io.netty.handler.codec.http.HttpMethod;
import net.cloudtolocalllm.relay.http.HttpEndpointClient;
import net.cloudtolocalllm.relay.http.HttpReply;
import net.cloudtolocalllm.relay.http.HttpTarget;

/**
 * Downloads the key set from the identity provider's JWKS URL.
 */
public final class HttpJwksSource implements JwksSource {
    private final HttpEndpointClient client;
    private final HttpTarget target;
    private final int timeoutMs;

    public HttpJwksSource(HttpEndpointClient client, String jwksUri, int timeoutMs) {
        this.client = Objects.requireNonNull(client, "client");
        this.target = HttpTarget.parse(jwksUri);
        this.timeoutMs = timeoutMs;
    }

    @Override
    public String fetch() throws IOException {
        HttpReply reply;
        try {
            reply = client.send(target, HttpMethod.GET, "", Map.of(), null, timeoutMs)
                    .get(timeoutMs + 1000L, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted while fetching JWKS", e);
        } catch (ExecutionException | TimeoutException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new IOException("failed to fetch JWKS from " + target + ": " + cause.getMessage(), cause);
        }
        if (!reply.isSuccess()) {
            throw new IOException("JWKS endpoint " + target + " answered status " + reply.status());
        }
        return reply.bodyText();
    }
}

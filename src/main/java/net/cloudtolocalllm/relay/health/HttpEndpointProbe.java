package net.cloudtolocalllm.relay.health;

import java.net.ConnectException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.timeout.ReadTimeoutException;
import net.cloudtolocalllm.relay.http.HttpEndpointClient;
import net.cloudtolocalllm.relay.http.HttpReply;

/**
 * Probes an endpoint with {@code GET <healthPath>}: {@code /api/version} on local inference,
 * {@code /health} on relays and tunnels.
 */
public final class HttpEndpointProbe implements EndpointProbe {
    private final HttpEndpointClient client;

    public HttpEndpointProbe(HttpEndpointClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public CompletableFuture<ProbeResult> probe(ConnectionEndpoint endpoint, int timeoutMs) {
        long startedAt = System.nanoTime();
        return client.send(endpoint.target(), HttpMethod.GET, endpoint.healthPath(),
                        endpoint.probeHeaders(), null, timeoutMs)
                .handle((reply, error) -> {
                    long latencyMs = (System.nanoTime() - startedAt) / 1_000_000L;
                    if (error != null) {
                        return classify(unwrap(error), timeoutMs);
                    }
                    return fromReply(reply, latencyMs);
                });
    }

    private static ProbeResult fromReply(HttpReply reply, long latencyMs) {
        if (!reply.isSuccess()) {
            return ProbeResult.failed(ProbeFailure.PROTOCOL_ERROR, "status " + reply.status());
        }
        return ProbeResult.ok(latencyMs);
    }

    static ProbeResult classify(Throwable error, int timeoutMs) {
        if (error instanceof TimeoutException
                || error instanceof ConnectTimeoutException
                || error instanceof ReadTimeoutException) {
            return ProbeResult.timeout(timeoutMs);
        }
        if (error instanceof ConnectException) {
            return ProbeResult.refused(error.getMessage());
        }
        return ProbeResult.failed(ProbeFailure.PROTOCOL_ERROR,
                error.getClass().getSimpleName() + (error.getMessage() == null ? "" : ": " + error.getMessage()));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}

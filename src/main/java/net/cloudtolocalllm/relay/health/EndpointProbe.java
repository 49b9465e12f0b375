package net.cloudtolocalllm.relay.health;

import java.util.concurrent.CompletableFuture;

/**
 * Measures one endpoint. Implementations complete with a failed {@link ProbeResult} instead of
 * completing exceptionally whenever they can.
 */
public interface EndpointProbe extends AutoCloseable {
    CompletableFuture<ProbeResult> probe(ConnectionEndpoint endpoint, int timeoutMs);

    @Override
    default void close() {
    }
}

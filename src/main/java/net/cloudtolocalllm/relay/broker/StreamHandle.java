package net.cloudtolocalllm.relay.broker;

import java.util.concurrent.CompletableFuture;

import net.cloudtolocalllm.relay.health.EndpointKind;
import net.cloudtolocalllm.relay.http.StreamCall;
import net.cloudtolocalllm.relay.supervisor.StreamLease;

/**
 * A dispatched stream. Cancel it when the client goes away.
 */
public final class StreamHandle {
    private final EndpointKind route;
    private final StreamCall call;
    private final StreamLease lease;

    StreamHandle(EndpointKind route, StreamCall call, StreamLease lease) {
        this.route = route;
        this.call = call;
        this.lease = lease;
    }

    public EndpointKind route() {
        return route;
    }

    public CompletableFuture<Void> completion() {
        return call.completion();
    }

    public boolean isCancelled() {
        return call.isCancelled();
    }

    /**
     * Stop forwarding. A cancelled stream does not count as proxy activity.
     */
    public void cancel() {
        if (lease != null) {
            lease.cancel();
        }
        call.cancel();
    }
}

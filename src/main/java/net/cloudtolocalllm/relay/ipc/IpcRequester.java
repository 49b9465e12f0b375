package net.cloudtolocalllm.relay.ipc;

import java.util.concurrent.CompletableFuture;

@FunctionalInterface
public interface IpcRequester {
    /**
     * Send a request and complete with its correlated response, or fail with {@link IpcTimeoutException}.
     */
    CompletableFuture<IpcMessage> request(IpcMessage message);
}

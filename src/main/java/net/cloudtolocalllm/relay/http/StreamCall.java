package net.cloudtolocalllm.relay.http;

import java.util.concurrent.CompletableFuture;

import io.netty.channel.Channel;

/**
 * Handle on an in-flight streaming request.
 * <p>
 * {@link #completion()} finishes normally after the last chunk, exceptionally on upstream failure,
 * and is cancelled by {@link #cancel()}.
 */
public final class StreamCall {
    private final CompletableFuture<Void> completion;
    private volatile Channel channel;

    StreamCall(CompletableFuture<Void> completion) {
        this.completion = completion;
    }

    void attach(Channel channel) {
        this.channel = channel;
        if (completion.isDone()) {
            channel.close();
        }
    }

    public CompletableFuture<Void> completion() {
        return completion;
    }

    /**
     * Abort the request and close the upstream connection. Safe to call more than once.
     */
    public void cancel() {
        completion.cancel(false);
        Channel current = channel;
        if (current != null) {
            current.close();
        }
    }

    public boolean isCancelled() {
        return completion.isCancelled();
    }
}

package net.cloudtolocalllm.relay.broker;

/**
 * Receives one streamed response. Exactly one of {@link #onComplete()} or {@link #onError(Throwable)}
 * is called, after the last chunk.
 */
public interface StreamSink {
    void onChunk(ChatChunk chunk);

    void onComplete();

    /**
     * @param error a {@link java.util.concurrent.CancellationException} when the stream was cancelled
     */
    void onError(Throwable error);
}

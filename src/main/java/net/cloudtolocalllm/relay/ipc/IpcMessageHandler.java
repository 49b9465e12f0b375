package net.cloudtolocalllm.relay.ipc;

import java.time.Instant;
import java.util.Map;

/**
 * Handles inbound requests on an IPC connection.
 * <p>
 * A returned message is sent back as the correlated response. When the handler returns null and the
 * request asked for an ack, a plain {@code ack} is sent instead. A thrown exception becomes an
 * {@code error} response. Returning {@link #DEFERRED} sends nothing; the handler then owns the
 * response and writes it through the session later.
 */
@FunctionalInterface
public interface IpcMessageHandler {
    IpcMessageHandler NOOP = (session, message) -> null;

    /** Marker reply: the handler answers asynchronously. Compared by identity. */
    IpcMessage DEFERRED = new IpcMessage(IpcMessageType.ACK, "deferred", Instant.EPOCH, Map.of(), false, null, null);

    IpcMessage handle(IpcSession session, IpcMessage message) throws Exception;
}

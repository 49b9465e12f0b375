package net.cloudtolocalllm.relay.daemon;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import net.cloudtolocalllm.relay.auth.AuthException;
import net.cloudtolocalllm.relay.auth.TokenRedactor;
import net.cloudtolocalllm.relay.auth.TokenValidation;
import net.cloudtolocalllm.relay.auth.TokenValidator;
import net.cloudtolocalllm.relay.broker.ChatChunk;
import net.cloudtolocalllm.relay.broker.ConnectionBroker;
import net.cloudtolocalllm.relay.broker.NoRouteException;
import net.cloudtolocalllm.relay.broker.StreamDispatcher;
import net.cloudtolocalllm.relay.broker.StreamHandle;
import net.cloudtolocalllm.relay.broker.StreamRequest;
import net.cloudtolocalllm.relay.broker.StreamSink;
import net.cloudtolocalllm.relay.health.HealthMonitor;
import net.cloudtolocalllm.relay.health.QualityScore;
import net.cloudtolocalllm.relay.ipc.IpcMessage;
import net.cloudtolocalllm.relay.ipc.IpcMessageHandler;
import net.cloudtolocalllm.relay.ipc.IpcMessages;
import net.cloudtolocalllm.relay.ipc.IpcSession;

/**
 * Answers the chat client and the tray on the daemon's IPC listeners.
 * <p>
 * A {@code stream_request} is acknowledged as soon as it is accepted; its output follows as
 * {@code stream_chunk} messages and, on failure, one uncorrelated {@code error}. A request carrying a
 * token that fails validation is refused outright and never falls back to the local endpoint.
 */
public final class DaemonIpcHandler implements IpcMessageHandler {
    static final String SERVICE_NAME = "daemon";
    static final String LOCAL_USER = "local";

    private final ConnectionBroker broker;
    private final HealthMonitor monitor;
    private final TokenValidator validator;
    private final StreamDispatcher dispatcher;
    private final Executor streamExecutor;
    private final Runnable shutdown;

    public DaemonIpcHandler(ConnectionBroker broker,
                            HealthMonitor monitor,
                            TokenValidator validator,
                            StreamDispatcher dispatcher,
                            Executor streamExecutor,
                            Runnable shutdown) {
        this.broker = Objects.requireNonNull(broker, "broker");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.streamExecutor = Objects.requireNonNull(streamExecutor, "streamExecutor");
        this.shutdown = shutdown == null ? () -> { } : shutdown;
    }

    @Override
    public IpcMessage handle(IpcSession session, IpcMessage message) {
        switch (message.type()) {
            case HEALTH_CHECK:
                return IpcMessages.healthReply(message, SERVICE_NAME, healthStatus(broker.bestAvailableQuality()));
            case STATUS_REPORT:
                System.out.println("IPC status from " + session.remoteAddress() + ": " + message.payload());
                return null;
            case SERVICE_CONTROL:
                return serviceControl(message);
            case STREAM_REQUEST:
                return streamRequest(session, message);
            case WINDOW_CONTROL:
                return IpcMessages.error(message, "UNSUPPORTED", "the daemon has no window");
            default:
                return IpcMessages.error(message, "UNSUPPORTED", "unexpected " + message.type().wireName());
        }
    }

    static String healthStatus(QualityScore best) {
        if (best.isAtLeast(QualityScore.GOOD)) {
            return IpcMessages.STATUS_OK;
        }
        return best.isReachable() ? IpcMessages.STATUS_DEGRADED : IpcMessages.STATUS_DOWN;
    }

    private IpcMessage serviceControl(IpcMessage message) {
        String action = message.payloadString("action");
        if ("restart".equals(action) || "reprobe".equals(action)) {
            monitor.probeAll();
            return IpcMessages.ack(message);
        }
        if ("quit".equals(action) || "stop".equals(action)) {
            System.out.println("Shutdown requested over IPC");
            streamExecutor.execute(shutdown);
            return IpcMessages.ack(message);
        }
        return IpcMessages.error(message, "UNKNOWN_ACTION", "unknown service action: " + action);
    }

    private IpcMessage streamRequest(IpcSession session, IpcMessage message) {
        String model = message.payloadString("model");
        String text = message.payloadString("message");
        if (model == null || model.isBlank() || text == null) {
            return IpcMessages.error(message, "BAD_REQUEST", "model and message are required");
        }
        String token = message.payloadString("token");
        try {
            streamExecutor.execute(() -> admitStream(session, message, model, text, token));
        } catch (RejectedExecutionException e) {
            return IpcMessages.error(message, "BUSY", "daemon is shutting down");
        }
        return IpcMessageHandler.DEFERRED;
    }

    // Runs off the event loop: validation may block on a JWKS fetch.
    private void admitStream(IpcSession session, IpcMessage message, String model, String text, String token) {
        StreamRequest request;
        if (token == null || token.isBlank()) {
            request = StreamRequest.anonymous(LOCAL_USER, model, text);
        } else {
            TokenValidation validation = validator.validate(token);
            if (!validation.isOk()) {
                System.err.println("IPC stream request with token " + TokenRedactor.fingerprint(token)
                        + " rejected: " + validation.error.code());
                session.send(IpcMessages.error(message, validation.error.code(), validation.message));
                return;
            }
            request = StreamRequest.authenticated(token, validation.claims, model, text);
        }
        // Queued before the dispatch, so the ack precedes every chunk.
        session.send(IpcMessages.ack(message));
        runStream(session, message.id(), request);
    }

    private void runStream(IpcSession session, String requestId, StreamRequest request) {
        AtomicBoolean doneSent = new AtomicBoolean(false);
        AtomicReference<StreamHandle> started = new AtomicReference<>();
        Runnable cancelOnClose = () -> {
            StreamHandle handle = started.get();
            if (handle != null) {
                handle.cancel();
            }
        };
        StreamSink sink = new StreamSink() {
            @Override
            public void onChunk(ChatChunk chunk) {
                if (chunk.done()) {
                    doneSent.set(true);
                }
                session.send(IpcMessages.streamChunk(requestId, chunk.text(), chunk.done()));
            }

            @Override
            public void onComplete() {
                session.removeCloseHook(cancelOnClose);
                if (doneSent.compareAndSet(false, true)) {
                    session.send(IpcMessages.streamChunk(requestId, "", true));
                }
            }

            @Override
            public void onError(Throwable error) {
                session.removeCloseHook(cancelOnClose);
                if (error instanceof CancellationException) {
                    return;
                }
                session.send(IpcMessages.streamError(requestId, "STREAM_FAILED", error.getMessage()));
            }
        };
        session.onClose(cancelOnClose);
        try {
            StreamHandle handle = dispatcher.dispatch(request, sink);
            started.set(handle);
            if (!session.isOpen()) {
                handle.cancel();
            }
        } catch (AuthException e) {
            session.removeCloseHook(cancelOnClose);
            session.send(IpcMessages.streamError(requestId, e.error().code(), e.getMessage()));
        } catch (NoRouteException e) {
            session.removeCloseHook(cancelOnClose);
            session.send(IpcMessages.streamError(requestId, "NO_ROUTE", e.getMessage()));
        } catch (RuntimeException e) {
            session.removeCloseHook(cancelOnClose);
            System.err.println("Stream " + requestId + " failed to start: " + e.getMessage());
            session.send(IpcMessages.streamError(requestId, "STREAM_FAILED", e.getMessage()));
        }
    }
}

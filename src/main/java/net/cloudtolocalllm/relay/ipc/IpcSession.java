package net.cloudtolocalllm.relay.ipc;

import java.net.SocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.util.concurrent.ScheduledFuture;

/**
 * One live IPC connection and the requests still waiting for their response on it.
 */
public final class IpcSession {
    private final Channel channel;
    private final Duration ackTimeout;
    private final Consumer<IpcSession> onAckTimeout;
    private final Map<String, CompletableFuture<IpcMessage>> pending = new ConcurrentHashMap<>();
    private final List<Runnable> closeHooks = new CopyOnWriteArrayList<>();

    IpcSession(Channel channel, Duration ackTimeout, Consumer<IpcSession> onAckTimeout) {
        this.channel = channel;
        this.ackTimeout = ackTimeout;
        this.onAckTimeout = onAckTimeout;
    }

    public SocketAddress remoteAddress() {
        return channel.remoteAddress();
    }

    public boolean isOpen() {
        return channel.isActive();
    }

    public CompletableFuture<Void> send(IpcMessage message) {
        CompletableFuture<Void> written = new CompletableFuture<>();
        channel.writeAndFlush(message).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                written.complete(null);
            } else {
                written.completeExceptionally(future.cause());
            }
        });
        return written;
    }

    /**
     * Send {@code message} and wait for the message carrying the same id.
     * <p>
     * Fails with {@link IpcTimeoutException} after the ack timeout or when the connection closes.
     */
    public CompletableFuture<IpcMessage> request(IpcMessage message) {
        CompletableFuture<IpcMessage> response = new CompletableFuture<>();
        if (pending.putIfAbsent(message.id(), response) != null) {
            response.completeExceptionally(new IllegalStateException("duplicate request id " + message.id()));
            return response;
        }
        ScheduledFuture<?> timeout = channel.eventLoop().schedule(() -> {
            if (pending.remove(message.id(), response) && response.completeExceptionally(new IpcTimeoutException(
                    "no response to " + message.type().wireName() + " " + message.id()
                            + " within " + ackTimeout.toMillis() + "ms"))) {
                onAckTimeout.accept(this);
            }
        }, ackTimeout.toMillis(), TimeUnit.MILLISECONDS);
        response.whenComplete((reply, error) -> timeout.cancel(false));
        send(message).whenComplete((ignored, error) -> {
            if (error != null && pending.remove(message.id(), response)) {
                response.completeExceptionally(error);
            }
        });
        return response;
    }

    /**
     * Run when the connection closes, for example to cancel streams started by this peer. Runs at once
     * if the connection is already closed. Hooks for work that ends earlier must be removed with
     * {@link #removeCloseHook(Runnable)}.
     */
    public void onClose(Runnable hook) {
        if (!channel.isOpen()) {
            hook.run();
            return;
        }
        closeHooks.add(hook);
    }

    public void removeCloseHook(Runnable hook) {
        closeHooks.remove(hook);
    }

    public void close() {
        channel.close();
    }

    boolean completePending(IpcMessage message) {
        CompletableFuture<IpcMessage> response = pending.remove(message.id());
        if (response == null) {
            return false;
        }
        response.complete(message);
        return true;
    }

    void closed() {
        for (Map.Entry<String, CompletableFuture<IpcMessage>> entry : pending.entrySet()) {
            if (pending.remove(entry.getKey(), entry.getValue())) {
                entry.getValue().completeExceptionally(new IpcTimeoutException("peer disconnected"));
            }
        }
        for (Runnable hook : closeHooks) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                System.err.println("IPC close hook failed: " + e.getMessage());
            }
        }
        closeHooks.clear();
    }

    int pendingRequests() {
        return pending.size();
    }

    public int closeHookCount() {
        return closeHooks.size();
    }
}

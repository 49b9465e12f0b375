package net.cloudtolocalllm.relay.ipc;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import net.cloudtolocalllm.relay.util.DaemonThreads;

/**
 * Keeps one IPC connection to a peer, reconnecting with backoff for as long as it runs.
 * <p>
 * A request that times out marks the peer {@link PeerState#UNREACHABLE} and drops the connection,
 * which starts a fresh reconnect cycle.
 */
public final class IpcClient implements IpcRequester, AutoCloseable {
    private static final int CONNECT_TIMEOUT_MS = 2000;

    private final String name;
    private final InetSocketAddress remote;
    private final IpcSettings settings;
    private final IpcMessageHandler handler;
    private final PeerStateListener stateListener;
    private final AtomicReference<PeerState> state = new AtomicReference<>(PeerState.UNREACHABLE);
    private final AtomicReference<IpcSession> session = new AtomicReference<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private EventLoopGroup group;
    private Bootstrap bootstrap;
    private int failedAttempts;

    public IpcClient(String name,
                     InetSocketAddress remote,
                     IpcSettings settings,
                     IpcMessageHandler handler,
                     PeerStateListener stateListener) {
        this.name = Objects.requireNonNull(name, "name");
        this.remote = Objects.requireNonNull(remote, "remote");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.handler = handler == null ? IpcMessageHandler.NOOP : handler;
        this.stateListener = stateListener == null ? PeerStateListener.NOOP : stateListener;
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        group = new NioEventLoopGroup(1, DaemonThreads.named("ctl-ipc-client-" + name));
        bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new IpcChannelInitializer(settings, handler, this::onAckTimeout,
                        new IpcInboundHandler.SessionCallbacks() {
                            @Override
                            public void opened(IpcSession opened) {
                                onConnected(opened);
                            }

                            @Override
                            public void closed(IpcSession closed) {
                                onDisconnected(closed);
                            }
                        }));
        setState(PeerState.CONNECTING);
        connect();
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        IpcSession current = session.getAndSet(null);
        if (current != null) {
            current.close();
        }
        if (group != null) {
            group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        }
        setState(PeerState.UNREACHABLE);
    }

    @Override
    public void close() {
        stop();
    }

    public PeerState state() {
        return state.get();
    }

    public boolean isConnected() {
        return state.get() == PeerState.CONNECTED;
    }

    @Override
    public CompletableFuture<IpcMessage> request(IpcMessage message) {
        IpcSession current = session.get();
        if (current == null || !current.isOpen()) {
            return CompletableFuture.failedFuture(new IpcTimeoutException(name + " peer is not connected"));
        }
        return current.request(message);
    }

    /**
     * Fire-and-forget send.
     *
     * @return false when the peer is not connected
     */
    public boolean send(IpcMessage message) {
        IpcSession current = session.get();
        if (current == null || !current.isOpen()) {
            return false;
        }
        current.send(message);
        return true;
    }

    private void connect() {
        if (!running.get()) {
            return;
        }
        bootstrap.connect(remote).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                setState(PeerState.UNREACHABLE);
                scheduleReconnect();
            }
        });
    }

    private void scheduleReconnect() {
        if (!running.get()) {
            return;
        }
        Duration delay = settings.reconnectDelay(failedAttempts++);
        group.schedule(this::connect, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void onConnected(IpcSession opened) {
        failedAttempts = 0;
        session.set(opened);
        setState(PeerState.CONNECTED);
    }

    private void onDisconnected(IpcSession closed) {
        session.compareAndSet(closed, null);
        setState(PeerState.UNREACHABLE);
        scheduleReconnect();
    }

    private void onAckTimeout(IpcSession timedOut) {
        System.err.println("IPC peer " + name + " did not answer in time; reconnecting");
        setState(PeerState.UNREACHABLE);
        timedOut.close();
    }

    private void setState(PeerState next) {
        PeerState previous = state.getAndSet(next);
        if (previous == next) {
            return;
        }
        try {
            stateListener.onStateChange(name, next);
        } catch (RuntimeException e) {
            System.err.println("Peer state listener failed: " + e.getMessage());
        }
    }
}

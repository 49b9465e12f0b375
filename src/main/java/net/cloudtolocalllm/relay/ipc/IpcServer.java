package net.cloudtolocalllm.relay.ipc;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import net.cloudtolocalllm.relay.util.DaemonThreads;

/**
 * Accepts IPC connections from one peer kind (chat or tray) on a loopback port.
 */
public final class IpcServer implements IpcBroadcaster, AutoCloseable {
    private final String name;
    private final InetSocketAddress bindAddress;
    private final IpcSettings settings;
    private final IpcMessageHandler handler;
    private final List<IpcSession> sessions = new CopyOnWriteArrayList<>();
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public IpcServer(String name, InetSocketAddress bindAddress, IpcSettings settings, IpcMessageHandler handler) {
        this.name = Objects.requireNonNull(name, "name");
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.handler = handler == null ? IpcMessageHandler.NOOP : handler;
    }

    public void start() {
        if (serverChannel != null) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1, DaemonThreads.named("ctl-ipc-" + name + "-boss"));
        workerGroup = new NioEventLoopGroup(2, DaemonThreads.named("ctl-ipc-" + name));
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new IpcChannelInitializer(settings, handler, IpcSession::close,
                        new IpcInboundHandler.SessionCallbacks() {
                            @Override
                            public void opened(IpcSession session) {
                                sessions.add(session);
                            }

                            @Override
                            public void closed(IpcSession session) {
                                sessions.remove(session);
                            }
                        }));
        try {
            serverChannel = bootstrap.bind(bindAddress).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            throw new IllegalStateException("Interrupted while binding IPC " + name, e);
        } catch (RuntimeException e) {
            stop();
            throw new IllegalStateException("Failed to bind IPC " + name + " on " + bindAddress, e);
        }
        System.out.println("IPC " + name + " listening on " + localAddress());
    }

    public void stop() {
        if (serverChannel != null) {
            serverChannel.close().awaitUninterruptibly(2, TimeUnit.SECONDS);
            serverChannel = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
            bossGroup = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
            workerGroup = null;
        }
    }

    @Override
    public void close() {
        stop();
    }

    public InetSocketAddress localAddress() {
        Channel channel = serverChannel;
        return channel == null ? bindAddress : (InetSocketAddress) channel.localAddress();
    }

    public List<IpcSession> sessions() {
        return List.copyOf(sessions);
    }

    @Override
    public int broadcast(IpcMessage message) {
        int sent = 0;
        for (IpcSession session : sessions) {
            if (session.isOpen()) {
                session.send(message);
                sent++;
            }
        }
        return sent;
    }
}

package net.cloudtolocalllm.relay.gateway;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import net.cloudtolocalllm.relay.auth.TokenValidator;
import net.cloudtolocalllm.relay.broker.ConnectionBroker;
import net.cloudtolocalllm.relay.broker.StreamDispatcher;
import net.cloudtolocalllm.relay.config.RelayConfig;
import net.cloudtolocalllm.relay.supervisor.ProxySupervisor;
import net.cloudtolocalllm.relay.util.DaemonThreads;
import net.cloudtolocalllm.relay.util.ListenAddress;

/**
 * HTTP listener through which remote clients stream chat over their own proxy.
 */
public final class GatewayServer {
    private static final int DEFAULT_MAX_REQUEST_BYTES = 256 * 1024;
    private static final int DEFAULT_WORKER_THREADS = 16;

    private final ListenAddress listen;
    private final int maxRequestBytes;
    private final int workerThreads;
    private final TokenValidator validator;
    private final ConnectionBroker broker;
    private final ProxySupervisor supervisor;
    private final StreamDispatcher dispatcher;
    private EventLoopGroup bossGroup;
    private EventLoopGroup ioGroup;
    private EventExecutorGroup blockingGroup;
    private Channel channel;

    public GatewayServer(RelayConfig.GatewayConfig gateway,
                         TokenValidator validator,
                         ConnectionBroker broker,
                         ProxySupervisor supervisor,
                         StreamDispatcher dispatcher) {
        Objects.requireNonNull(gateway, "gateway");
        this.listen = ListenAddress.parse(gateway.listen);
        this.maxRequestBytes = gateway.maxRequestBytes == null ? DEFAULT_MAX_REQUEST_BYTES : gateway.maxRequestBytes;
        this.workerThreads = gateway.workerThreads == null ? DEFAULT_WORKER_THREADS : gateway.workerThreads;
        this.validator = Objects.requireNonNull(validator, "validator");
        this.broker = Objects.requireNonNull(broker, "broker");
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    /**
     * Bind the gateway listener.
     */
    public void start() {
        if (channel != null) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1, DaemonThreads.named("ctl-gateway-boss"));
        ioGroup = new NioEventLoopGroup(0, DaemonThreads.named("ctl-gateway-io"));
        blockingGroup = new DefaultEventExecutorGroup(workerThreads, DaemonThreads.named("ctl-gateway-worker"));
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, ioGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new GatewayChannelInitializer(maxRequestBytes, blockingGroup,
                        validator, broker, supervisor, dispatcher));
        InetSocketAddress address = listen.toSocketAddress();
        try {
            channel = bootstrap.bind(address).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            throw new IllegalStateException("Gateway bind interrupted", e);
        }
        System.out.println("Gateway listening on " + address.getHostString() + ":" + address.getPort());
    }

    /**
     * Stop the listener; open streams are cut when their connections close.
     */
    public void stop() {
        if (channel != null) {
            channel.close();
            channel = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
            bossGroup = null;
        }
        if (ioGroup != null) {
            ioGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
            ioGroup = null;
        }
        if (blockingGroup != null) {
            blockingGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
            blockingGroup = null;
        }
    }

    public InetSocketAddress localAddress() {
        Channel current = channel;
        return current == null ? listen.toSocketAddress() : (InetSocketAddress) current.localAddress();
    }
}

package net.cloudtolocalllm.relay.gateway;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.EventExecutorGroup;
import net.cloudtolocalllm.relay.auth.TokenValidator;
import net.cloudtolocalllm.relay.broker.ConnectionBroker;
import net.cloudtolocalllm.relay.broker.StreamDispatcher;
import net.cloudtolocalllm.relay.supervisor.ProxySupervisor;

/**
 * Bodies larger than {@code maxRequestBytes} are answered with 413 by the aggregator.
 */
final class GatewayChannelInitializer extends ChannelInitializer<SocketChannel> {
    private final int maxRequestBytes;
    private final EventExecutorGroup blockingGroup;
    private final TokenValidator validator;
    private final ConnectionBroker broker;
    private final ProxySupervisor supervisor;
    private final StreamDispatcher dispatcher;

    GatewayChannelInitializer(int maxRequestBytes,
                              EventExecutorGroup blockingGroup,
                              TokenValidator validator,
                              ConnectionBroker broker,
                              ProxySupervisor supervisor,
                              StreamDispatcher dispatcher) {
        this.maxRequestBytes = maxRequestBytes;
        this.blockingGroup = blockingGroup;
        this.validator = validator;
        this.broker = broker;
        this.supervisor = supervisor;
        this.dispatcher = dispatcher;
    }

    @Override
    protected void initChannel(SocketChannel channel) {
        channel.pipeline()
                .addLast("codec", new HttpServerCodec())
                .addLast("aggregator", new HttpObjectAggregator(maxRequestBytes))
                .addLast(blockingGroup, "handler", new GatewayHandler(validator, broker, supervisor, dispatcher));
    }
}

package net.cloudtolocalllm.relay.ipc;

import java.util.function.Consumer;

import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;

/**
 * Frames are a 4-byte big-endian length followed by that many bytes of UTF-8 JSON.
 */
final class IpcChannelInitializer extends ChannelInitializer<Channel> {
    private static final int LENGTH_FIELD_BYTES = 4;
    private static final IpcMessageCodec CODEC = new IpcMessageCodec();

    private final IpcSettings settings;
    private final IpcMessageHandler handler;
    private final Consumer<IpcSession> onAckTimeout;
    private final IpcInboundHandler.SessionCallbacks callbacks;

    IpcChannelInitializer(IpcSettings settings, IpcMessageHandler handler, Consumer<IpcSession> onAckTimeout,
                          IpcInboundHandler.SessionCallbacks callbacks) {
        this.settings = settings;
        this.handler = handler;
        this.onAckTimeout = onAckTimeout;
        this.callbacks = callbacks;
    }

    @Override
    protected void initChannel(Channel channel) {
        ChannelPipeline pipeline = channel.pipeline();
        pipeline.addLast("frameDecoder", new LengthFieldBasedFrameDecoder(
                settings.maxFrameBytes(), 0, LENGTH_FIELD_BYTES, 0, LENGTH_FIELD_BYTES));
        pipeline.addLast("framePrepender", new LengthFieldPrepender(LENGTH_FIELD_BYTES));
        pipeline.addLast("codec", CODEC);
        pipeline.addLast("handler", new IpcInboundHandler(handler, settings.ackTimeout(), onAckTimeout, callbacks));
    }
}

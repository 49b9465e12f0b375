package net.cloudtolocalllm.relay.ipc;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufInputStream;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageCodec;

/**
 * Converts length-delimited frames to {@link IpcMessage} and back.
 * <p>
 * Frames that are not valid messages are logged and dropped; the connection stays open.
 */
@ChannelHandler.Sharable
public final class IpcMessageCodec extends MessageToMessageCodec<ByteBuf, IpcMessage> {
    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    @Override
    protected void encode(ChannelHandlerContext ctx, IpcMessage msg, List<Object> out) throws IOException {
        out.add(Unpooled.wrappedBuffer(MAPPER.writeValueAsBytes(msg)));
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf msg, List<Object> out) {
        IpcMessage message;
        try (InputStream in = new ByteBufInputStream(msg)) {
            message = MAPPER.readValue(in, IpcMessage.class);
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Dropping malformed IPC frame from " + ctx.channel().remoteAddress() + ": " + e.getMessage());
            return;
        }
        if (message == null || !message.isWellFormed()) {
            System.err.println("Dropping IPC frame without type or id from " + ctx.channel().remoteAddress());
            return;
        }
        out.add(message);
    }
}

package net.cloudtolocalllm.relay.ipc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

class IpcMessageCodecTest {
    @Test
    void encodesSnakeCaseJson() {
        EmbeddedChannel channel = new EmbeddedChannel(new IpcMessageCodec());
        IpcMessage message = IpcMessages.streamRequest("llama3.2", "hi", null);

        assertTrue(channel.writeOutbound(message));
        ByteBuf frame = channel.readOutbound();
        String json = frame.toString(StandardCharsets.UTF_8);
        frame.release();

        assertTrue(json.contains("\"type\":\"stream_request\""));
        assertTrue(json.contains("\"ack_required\":true"));
        assertTrue(json.contains("\"id\":\"" + message.id() + "\""));
        assertFalse(json.contains("\"token\""));
        assertFalse(json.contains("\"source\""));
    }

    @Test
    void decodesMessagesFromPeers() {
        EmbeddedChannel channel = new EmbeddedChannel(new IpcMessageCodec());
        String json = "{\"type\":\"service_control\",\"id\":\"m-1\",\"timestamp\":\"2026-01-01T00:00:00Z\","
                + "\"payload\":{\"action\":\"restart\",\"service\":\"daemon\"},\"ack_required\":true,"
                + "\"extra\":\"ignored\"}";

        assertTrue(channel.writeInbound(Unpooled.copiedBuffer(json, StandardCharsets.UTF_8)));
        IpcMessage message = channel.readInbound();

        assertEquals(IpcMessageType.SERVICE_CONTROL, message.type());
        assertEquals("m-1", message.id());
        assertEquals("restart", message.payloadString("action"));
        assertTrue(message.ackRequired());
    }

    @Test
    void dropsMalformedFramesAndKeepsTheConnection() {
        EmbeddedChannel channel = new EmbeddedChannel(new IpcMessageCodec());

        assertFalse(channel.writeInbound(Unpooled.copiedBuffer("{not json", StandardCharsets.UTF_8)));
        assertFalse(channel.writeInbound(Unpooled.copiedBuffer("{\"type\":\"ack\"}", StandardCharsets.UTF_8)));
        assertFalse(channel.writeInbound(Unpooled.copiedBuffer("{\"type\":\"teleport\",\"id\":\"x\"}",
                StandardCharsets.UTF_8)));

        assertNull(channel.readInbound());
        assertTrue(channel.isOpen());
    }

    @Test
    void toStringNeverShowsThePayload() {
        IpcMessage message = IpcMessages.streamRequest("m", "hi", "secret.token.value");
        assertFalse(message.toString().contains("secret"));
    }
}

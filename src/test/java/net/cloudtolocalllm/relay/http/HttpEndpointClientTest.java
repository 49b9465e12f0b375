package net.cloudtolocalllm.relay.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import io.netty.handler.codec.TooLongFrameException;
import net.cloudtolocalllm.relay.support.FakeUpstream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class HttpEndpointClientTest {
    private static final byte[] BODY = "{}".getBytes(StandardCharsets.UTF_8);

    private final HttpEndpointClient client = new HttpEndpointClient();
    private final List<String> lines = new CopyOnWriteArrayList<>();
    private FakeUpstream upstream;

    @AfterEach
    void tearDown() {
        if (upstream != null) {
            upstream.close();
        }
        client.close();
    }

    @Test
    void streamsEachNonBlankLine() throws Exception {
        upstream = FakeUpstream.start("{\"a\":1}", "", "  {\"b\":2}  ");

        StreamCall call = client.stream(upstream.target(), "/api/chat", Map.of(), BODY, 2000, lines::add);
        call.completion().get(5, TimeUnit.SECONDS);

        assertEquals(List.of("{\"a\":1}", "{\"b\":2}"), lines);
    }

    @Test
    void lineWithoutTerminatorPastTheCapFailsTheStream() throws Exception {
        upstream = FakeUpstream.start("{\"ok\":true}", "x".repeat(HttpEndpointClient.MAX_LINE_BYTES + 16));

        StreamCall call = client.stream(upstream.target(), "/api/chat", Map.of(), BODY, 2000, lines::add);
        ExecutionException failure = assertThrows(ExecutionException.class,
                () -> call.completion().get(10, TimeUnit.SECONDS));

        assertInstanceOf(TooLongFrameException.class, failure.getCause());
        assertEquals(List.of("{\"ok\":true}"), lines);
    }

    @Test
    void errorStatusFailsWithHttpStatusException() throws Exception {
        upstream = FakeUpstream.start();
        upstream.respondWith(503, "{\"error\":\"busy\"}");

        StreamCall call = client.stream(upstream.target(), "/api/chat", Map.of(), BODY, 2000, lines::add);
        ExecutionException failure = assertThrows(ExecutionException.class,
                () -> call.completion().get(5, TimeUnit.SECONDS));

        assertInstanceOf(HttpStatusException.class, failure.getCause());
        assertTrue(lines.isEmpty());
    }
}

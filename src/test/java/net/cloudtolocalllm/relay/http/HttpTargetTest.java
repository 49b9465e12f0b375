package net.cloudtolocalllm.relay.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class HttpTargetTest {
    @Test
    void parsesDefaultPorts() {
        HttpTarget plain = HttpTarget.parse("http://localhost");
        HttpTarget secure = HttpTarget.parse("https://api.example.test/");

        assertEquals(80, plain.port());
        assertFalse(plain.secure());
        assertEquals(443, secure.port());
        assertTrue(secure.secure());
        assertEquals("api.example.test", secure.hostHeader());
    }

    @Test
    void joinsBasePathAndRequestPath() {
        HttpTarget target = HttpTarget.parse("http://127.0.0.1:11434/ollama//");

        assertEquals("/ollama/api/chat", target.requestUri("/api/chat"));
        assertEquals("/ollama/api/chat", target.requestUri("api/chat"));
        assertEquals("/ollama", target.requestUri(""));
        assertEquals("127.0.0.1:11434", target.hostHeader());
        assertEquals("http://127.0.0.1:11434/ollama", target.toString());
    }

    @Test
    void emptyBasePathMapsToRoot() {
        assertEquals("/", HttpTarget.parse("http://localhost:8080").requestUri(null));
    }

    @Test
    void rejectsUnsupportedUrls() {
        assertThrows(IllegalArgumentException.class, () -> HttpTarget.parse("ws://localhost:8080"));
        assertThrows(IllegalArgumentException.class, () -> HttpTarget.parse("http:///nohost"));
        assertThrows(IllegalArgumentException.class, () -> HttpTarget.parse(" "));
    }
}

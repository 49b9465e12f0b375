package net.cloudtolocalllm.relay.broker;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.cloudtolocalllm.relay.http.HttpEndpointClient;
import net.cloudtolocalllm.relay.http.HttpTarget;
import net.cloudtolocalllm.relay.http.StreamCall;

/**
 * Streams chat completions from an Ollama compatible endpoint.
 * <p>
 * The upstream answers with newline-delimited JSON; each line becomes one {@link ChatChunk}. A line
 * carrying an {@code error} field fails the stream.
 */
public final class InferenceClient {
    public static final String LOCAL_CHAT_PATH = "/api/chat";
    public static final String RELAY_CHAT_PATH = "/api/ollama/api/chat";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpEndpointClient http;
    private final int connectTimeoutMs;

    public InferenceClient(HttpEndpointClient http, int connectTimeoutMs) {
        this.http = Objects.requireNonNull(http, "http");
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public StreamCall chat(HttpTarget target,
                           String path,
                           Map<String, String> headers,
                           String model,
                           String message,
                           Consumer<ChatChunk> onChunk) {
        byte[] body;
        try {
            body = requestBody(model, message);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode chat request", e);
        }
        return http.stream(target, path, headers, body, connectTimeoutMs, line -> {
            ChatChunk chunk;
            try {
                chunk = parseLine(line);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            onChunk.accept(chunk);
        });
    }

    static byte[] requestBody(String model, String message) throws JsonProcessingException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", List.of(Map.of("role", "user", "content", message)));
        body.put("stream", true);
        return MAPPER.writeValueAsBytes(body);
    }

    static ChatChunk parseLine(String line) throws IOException {
        JsonNode node = MAPPER.readTree(line);
        if (node == null || !node.isObject()) {
            throw new IOException("unexpected stream record: " + line);
        }
        if (node.hasNonNull("error")) {
            throw new IOException("upstream error: " + node.get("error").asText());
        }
        String text;
        if (node.path("message").hasNonNull("content")) {
            text = node.path("message").get("content").asText();
        } else {
            text = node.path("response").asText("");
        }
        return new ChatChunk(text, node.path("done").asBoolean(false));
    }
}

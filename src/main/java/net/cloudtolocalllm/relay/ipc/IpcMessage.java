package net.cloudtolocalllm.relay.ipc;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Envelope exchanged between the desktop processes. Serialized as snake_case JSON.
 */
@Getter
@Accessors(fluent = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IpcMessage {
    @JsonProperty("type")
    private final IpcMessageType type;
    @JsonProperty("id")
    private final String id;
    @JsonProperty("timestamp")
    private final Instant timestamp;
    @JsonProperty("payload")
    private final Map<String, Object> payload;
    @JsonProperty("ack_required")
    private final boolean ackRequired;
    @JsonProperty("source")
    private final String source;
    @JsonProperty("target")
    private final String target;

    @JsonCreator
    public IpcMessage(@JsonProperty("type") IpcMessageType type,
                      @JsonProperty("id") String id,
                      @JsonProperty("timestamp") Instant timestamp,
                      @JsonProperty("payload") Map<String, Object> payload,
                      @JsonProperty("ack_required") boolean ackRequired,
                      @JsonProperty("source") String source,
                      @JsonProperty("target") String target) {
        this.type = type;
        this.id = id;
        this.timestamp = timestamp;
        this.payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.ackRequired = ackRequired;
        this.source = source;
        this.target = target;
    }

    public static IpcMessage create(IpcMessageType type, Map<String, Object> payload, boolean ackRequired) {
        return new IpcMessage(type, UUID.randomUUID().toString(), Instant.now(), payload, ackRequired, null, null);
    }

    /**
     * A response correlated to {@code request}: same id, never itself acknowledged.
     */
    public static IpcMessage replyTo(IpcMessage request, IpcMessageType type, Map<String, Object> payload) {
        return new IpcMessage(type, request.id(), Instant.now(), payload, false, request.target(), request.source());
    }

    public IpcMessage withRoute(String source, String target) {
        return new IpcMessage(type, id, timestamp, payload, ackRequired, source, target);
    }

    public String payloadString(String key) {
        Object value = payload.get(key);
        return value == null ? null : value.toString();
    }

    public boolean payloadBoolean(String key) {
        Object value = payload.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    /**
     * Omits the payload, which may hold a bearer token.
     */
    @Override
    public String toString() {
        return "IpcMessage{type=" + (type == null ? null : type.wireName()) + ", id=" + id
                + ", ackRequired=" + ackRequired + "}";
    }

    boolean isWellFormed() {
        return type != null && id != null && !id.isBlank();
    }
}

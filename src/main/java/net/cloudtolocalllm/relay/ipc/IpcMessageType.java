package net.cloudtolocalllm.relay.ipc;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum IpcMessageType {
    HEALTH_CHECK,
    STATUS_REPORT,
    WINDOW_CONTROL,
    SERVICE_CONTROL,
    STREAM_REQUEST,
    STREAM_CHUNK,
    ACK,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IpcMessageType fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("message type is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

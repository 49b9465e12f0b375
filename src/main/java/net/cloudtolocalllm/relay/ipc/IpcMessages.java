package net.cloudtolocalllm.relay.ipc;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builders for the message types the relay sends and answers.
 */
public final class IpcMessages {
    public static final String STATUS_OK = "ok";
    public static final String STATUS_DEGRADED = "degraded";
    public static final String STATUS_DOWN = "down";

    private IpcMessages() {
    }

    public static IpcMessage healthCheck(String service) {
        return IpcMessage.create(IpcMessageType.HEALTH_CHECK, Map.of("service", service), true);
    }

    public static IpcMessage healthReply(IpcMessage request, String service, String status) {
        return IpcMessage.replyTo(request, IpcMessageType.HEALTH_CHECK, Map.of("service", service, "status", status));
    }

    public static IpcMessage statusReport(String route, String quality, String status) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("route", route);
        payload.put("quality", quality);
        payload.put("status", status);
        return IpcMessage.create(IpcMessageType.STATUS_REPORT, payload, false);
    }

    public static IpcMessage windowControl(String action) {
        return IpcMessage.create(IpcMessageType.WINDOW_CONTROL, Map.of("action", action), true);
    }

    public static IpcMessage serviceControl(String action, String service) {
        return IpcMessage.create(IpcMessageType.SERVICE_CONTROL, Map.of("action", action, "service", service), true);
    }

    /**
     * @param token bearer token, or null for an anonymous local request
     */
    public static IpcMessage streamRequest(String model, String message, String token) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("message", message);
        if (token != null) {
            payload.put("token", token);
        }
        return IpcMessage.create(IpcMessageType.STREAM_REQUEST, payload, true);
    }

    /**
     * Chunks carry their own ids; {@code request_id} ties them to the stream request.
     */
    public static IpcMessage streamChunk(String requestId, String text, boolean done) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("request_id", requestId);
        payload.put("text", text);
        payload.put("done", done);
        return IpcMessage.create(IpcMessageType.STREAM_CHUNK, payload, false);
    }

    public static IpcMessage ack(IpcMessage request) {
        return IpcMessage.replyTo(request, IpcMessageType.ACK, Map.of("original_id", request.id()));
    }

    public static IpcMessage error(IpcMessage request, String code, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("original_id", request.id());
        payload.put("code", code);
        payload.put("message", message == null ? code : message);
        return IpcMessage.replyTo(request, IpcMessageType.ERROR, payload);
    }

    /**
     * Uncorrelated error about an earlier stream, sent after its ack.
     */
    public static IpcMessage streamError(String requestId, String code, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("request_id", requestId);
        payload.put("code", code);
        payload.put("message", message == null ? code : message);
        return IpcMessage.create(IpcMessageType.ERROR, payload, false);
    }
}

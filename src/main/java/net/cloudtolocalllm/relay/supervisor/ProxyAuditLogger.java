package net.cloudtolocalllm.relay.supervisor;

/**
 * Writes one {@code proxy_event} line per lifecycle change.
 */
public final class ProxyAuditLogger implements ProxyEventListener {
    public static final ProxyAuditLogger INSTANCE = new ProxyAuditLogger();

    private ProxyAuditLogger() {
    }

    @Override
    public void onEvent(ProxyEvent event) {
        StringBuilder builder = new StringBuilder("proxy_event");
        append(builder, "type", event.type());
        append(builder, "instanceId", event.instanceId());
        append(builder, "userHash", event.userHash());
        append(builder, "namespace", event.networkNamespace());
        append(builder, "state", event.state());
        append(builder, "inFlight", event.inFlightStreams());
        append(builder, "reason", event.reason());
        append(builder, "timestamp", event.timestamp());
        System.out.println(builder);
    }

    private void append(StringBuilder builder, String key, Object value) {
        if (value == null) {
            return;
        }
        builder.append(' ').append(key).append('=').append(value);
    }
}

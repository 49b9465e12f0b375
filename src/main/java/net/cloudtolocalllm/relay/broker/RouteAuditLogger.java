package net.cloudtolocalllm.relay.broker;

/**
 * Writes one {@code route_event} line per routing change.
 */
public final class RouteAuditLogger implements RouteEventListener {
    public static final RouteAuditLogger INSTANCE = new RouteAuditLogger();

    private RouteAuditLogger() {
    }

    @Override
    public void onRouteChange(RouteEvent event) {
        StringBuilder builder = new StringBuilder("route_event");
        append(builder, "userHash", event.userHash());
        append(builder, "from", event.previousStatus());
        append(builder, "to", event.status());
        append(builder, "previousEndpoint", event.previousKind() == null ? null : event.previousKind().wireName());
        append(builder, "endpoint", event.activeKind() == null ? null : event.activeKind().wireName());
        append(builder, "quality", event.quality().wireName());
        append(builder, "failovers", event.failoverCount());
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

package net.cloudtolocalllm.relay.broker;

import net.cloudtolocalllm.relay.health.EndpointKind;

/**
 * Routing state of one user session.
 * <p>
 * {@link #REEVALUATING} keeps serving the active endpoint while a better candidate waits for
 * enough confirming probes.
 */
public enum RouteStatus {
    UNROUTED,
    LOCAL_ACTIVE,
    CLOUD_ACTIVE,
    TUNNEL_ACTIVE,
    REEVALUATING,
    ALL_UNAVAILABLE;

    public static RouteStatus activeFor(EndpointKind kind) {
        switch (kind) {
            case LOCAL_INFERENCE:
                return LOCAL_ACTIVE;
            case CLOUD_RELAY:
                return CLOUD_ACTIVE;
            case TUNNEL:
                return TUNNEL_ACTIVE;
            default:
                throw new IllegalArgumentException("unknown endpoint kind: " + kind);
        }
    }
}

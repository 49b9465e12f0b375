package net.cloudtolocalllm.relay.broker;

import lombok.Value;
import lombok.experimental.Accessors;
import net.cloudtolocalllm.relay.health.EndpointKind;

/**
 * Output of {@link RoutePolicy#decide}: where the session routes now and which switch is pending.
 */
@Value
@Accessors(fluent = true)
public class RouteDecision {
    EndpointKind activeKind;
    RouteStatus status;
    EndpointKind pendingCandidate;
    int pendingConfirmations;
    long pendingProbeSequence;

    static RouteDecision settled(EndpointKind kind) {
        if (kind == null) {
            return new RouteDecision(null, RouteStatus.ALL_UNAVAILABLE, null, 0, 0);
        }
        return new RouteDecision(kind, RouteStatus.activeFor(kind), null, 0, 0);
    }
}

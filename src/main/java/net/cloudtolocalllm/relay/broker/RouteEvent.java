package net.cloudtolocalllm.relay.broker;

import java.time.Instant;

import lombok.Value;
import lombok.experimental.Accessors;
import net.cloudtolocalllm.relay.health.EndpointKind;
import net.cloudtolocalllm.relay.health.QualityScore;

/**
 * A session's routing status changed.
 */
@Value
@Accessors(fluent = true)
public class RouteEvent {
    Instant timestamp;
    String userHash;
    RouteStatus previousStatus;
    RouteStatus status;
    EndpointKind previousKind;
    EndpointKind activeKind;
    /**
     * Quality of the newly active endpoint; UNAVAILABLE when nothing is routed.
     */
    QualityScore quality;
    int failoverCount;

    public boolean endpointChanged() {
        return previousKind != activeKind;
    }
}

package net.cloudtolocalllm.relay.broker;

import java.time.Instant;

import lombok.Value;
import lombok.experimental.Accessors;
import net.cloudtolocalllm.relay.health.EndpointKind;

@Value
@Accessors(fluent = true)
public class RouteSnapshot {
    String userId;
    RouteStatus status;
    EndpointKind activeKind;
    int failoverCount;
    Instant lastFailoverAt;
    Instant lastActivityAt;
}

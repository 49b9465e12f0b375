package net.cloudtolocalllm.relay.supervisor;

import java.time.Instant;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Lifecycle change of a proxy instance, for audit logging. Carries the user hash, never the user id.
 */
@Value
@Accessors(fluent = true)
public class ProxyEvent {
    ProxyEventType type;
    Instant timestamp;
    String instanceId;
    String userHash;
    String networkNamespace;
    ProxyState state;
    int inFlightStreams;
    String reason;

    public static ProxyEvent from(ProxyEventType type, ProxyInstance instance, Instant timestamp, String reason) {
        return new ProxyEvent(
                type,
                timestamp,
                instance.instanceId(),
                instance.userHash(),
                instance.networkNamespace(),
                instance.state(),
                instance.inFlightStreams(),
                reason
        );
    }
}

package net.cloudtolocalllm.relay.supervisor;

import java.time.Instant;

import lombok.Value;
import lombok.experimental.Accessors;

@Value
@Accessors(fluent = true)
public class ProxyStatus {
    String instanceId;
    String userHash;
    ProxyState state;
    Instant createdAt;
    Instant lastActivityAt;
    int inFlightStreams;
    boolean healthy;

    static ProxyStatus of(ProxyInstance instance, boolean healthy) {
        return new ProxyStatus(
                instance.instanceId(),
                instance.userHash(),
                instance.state(),
                instance.createdAt(),
                instance.lastActivityAt(),
                instance.inFlightStreams(),
                healthy
        );
    }
}

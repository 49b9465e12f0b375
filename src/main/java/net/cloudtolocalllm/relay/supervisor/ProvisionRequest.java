package net.cloudtolocalllm.relay.supervisor;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * What a backend needs to bring up one isolated proxy.
 */
@Value
@Accessors(fluent = true)
public class ProvisionRequest {
    String instanceId;
    String ownerUserId;
    String userHash;
    String networkNamespace;
}

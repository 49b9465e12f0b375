package net.cloudtolocalllm.relay.supervisor;

import lombok.Value;
import lombok.experimental.Accessors;
import net.cloudtolocalllm.relay.http.HttpTarget;

/**
 * Handles a backend returns for a ready proxy.
 */
@Value
@Accessors(fluent = true)
public class ProvisionedResources {
    /**
     * Backend specific identifier, for example a container name.
     */
    String handle;
    /**
     * Where streams for this instance are sent; null means straight to the routed endpoint.
     */
    HttpTarget forwardTarget;
}

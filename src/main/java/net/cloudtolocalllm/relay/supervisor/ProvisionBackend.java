package net.cloudtolocalllm.relay.supervisor;

import java.time.Duration;

/**
 * Creates and destroys the isolated resources behind a proxy instance.
 */
public interface ProvisionBackend {
    /**
     * Create the instance's network and proxy and wait until it is ready.
     *
     * @throws ProvisionException when resources are exhausted, the engine fails or the proxy is not
     *                            ready within {@code readyTimeout}
     */
    ProvisionedResources provision(ProvisionRequest request, Duration readyTimeout) throws ProvisionException;

    /**
     * Release everything {@link #provision} created. Called once per instance.
     */
    void terminate(ProxyInstance instance) throws ProvisionException;

    boolean healthCheck(ProxyInstance instance);
}

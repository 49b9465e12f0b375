package net.cloudtolocalllm.relay.supervisor;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps per-user namespaces as bookkeeping inside the relay process.
 * <p>
 * Used on the desktop and in tests. Streams go straight to the routed endpoint.
 */
public final class InProcessProvisionBackend implements ProvisionBackend {
    private final int maxInstances;
    private final Map<String, String> namespaceByInstance = new ConcurrentHashMap<>();

    public InProcessProvisionBackend(int maxInstances) {
        if (maxInstances <= 0) {
            throw new IllegalArgumentException("maxInstances must be > 0");
        }
        this.maxInstances = maxInstances;
    }

    @Override
    public synchronized ProvisionedResources provision(ProvisionRequest request, Duration readyTimeout)
            throws ProvisionException {
        if (namespaceByInstance.size() >= maxInstances) {
            throw new ProvisionException(ProvisionFailure.RESOURCE_EXHAUSTED,
                    "instance limit of " + maxInstances + " reached");
        }
        if (namespaceByInstance.putIfAbsent(request.instanceId(), request.networkNamespace()) != null) {
            throw new ProvisionException(ProvisionFailure.ENGINE_ERROR,
                    "instance " + request.instanceId() + " already exists");
        }
        return new ProvisionedResources(request.instanceId(), null);
    }

    @Override
    public synchronized void terminate(ProxyInstance instance) {
        namespaceByInstance.remove(instance.instanceId());
    }

    @Override
    public boolean healthCheck(ProxyInstance instance) {
        return namespaceByInstance.containsKey(instance.instanceId());
    }

    public int allocatedInstances() {
        return namespaceByInstance.size();
    }

    /**
     * Namespaces still held; a user's draining and active instance share one.
     */
    public Set<String> allocatedNamespaces() {
        return Set.copyOf(namespaceByInstance.values());
    }
}

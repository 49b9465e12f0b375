package net.cloudtolocalllm.relay.supervisor;

/**
 * Lifecycle of a per-user proxy instance. Transitions only move forward.
 */
public enum ProxyState {
    PROVISIONING,
    ACTIVE,
    DRAINING,
    TERMINATED;

    public String wireName() {
        return name().toLowerCase();
    }
}

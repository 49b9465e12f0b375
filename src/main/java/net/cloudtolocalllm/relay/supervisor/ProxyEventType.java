package net.cloudtolocalllm.relay.supervisor;

public enum ProxyEventType {
    PROVISIONING,
    ACTIVE,
    PROVISION_FAILED,
    DRAINING,
    TERMINATED,
    RELEASE_FAILED
}

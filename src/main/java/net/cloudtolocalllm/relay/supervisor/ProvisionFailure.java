package net.cloudtolocalllm.relay.supervisor;

public enum ProvisionFailure {
    RESOURCE_EXHAUSTED(true),
    ENGINE_ERROR(true),
    READY_TIMEOUT(true),
    DRAINING(true),
    UNAUTHORIZED(false);

    private final boolean retryable;

    ProvisionFailure(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}

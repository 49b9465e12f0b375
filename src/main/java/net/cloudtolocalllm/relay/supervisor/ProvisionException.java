package net.cloudtolocalllm.relay.supervisor;

/**
 * A proxy instance could not be created, reached or used.
 */
public class ProvisionException extends Exception {
    private final ProvisionFailure failure;

    public ProvisionException(ProvisionFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public ProvisionException(ProvisionFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public ProvisionFailure failure() {
        return failure;
    }
}

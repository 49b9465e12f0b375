package net.cloudtolocalllm.relay.ipc;

/**
 * A request got no correlated response in time, or the peer is not connected.
 */
public class IpcTimeoutException extends Exception {
    public IpcTimeoutException(String message) {
        super(message);
    }
}

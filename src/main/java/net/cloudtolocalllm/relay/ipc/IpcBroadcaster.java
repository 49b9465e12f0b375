package net.cloudtolocalllm.relay.ipc;

@FunctionalInterface
public interface IpcBroadcaster {
    /**
     * @return number of peers the message was written to
     */
    int broadcast(IpcMessage message);
}

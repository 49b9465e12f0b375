package net.cloudtolocalllm.relay.ipc;

@FunctionalInterface
public interface PeerStateListener {
    PeerStateListener NOOP = (peer, state) -> {
    };

    void onStateChange(String peer, PeerState state);
}

package net.cloudtolocalllm.relay.ipc;

public enum PeerState {
    CONNECTING,
    CONNECTED,
    UNREACHABLE
}

package net.cloudtolocalllm.relay.health;

public enum ProbeFailure {
    TIMEOUT,
    CONNECTION_REFUSED,
    PROTOCOL_ERROR
}

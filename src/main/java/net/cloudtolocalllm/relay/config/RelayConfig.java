package net.cloudtolocalllm.relay.config;

import java.util.List;

public class RelayConfig {
    public List<EndpointConfig> endpoints;
    public HealthConfig health;
    public BrokerConfig broker;
    public AuthConfig auth;
    public SupervisorConfig supervisor;
    public IpcConfig ipc;
    public GatewayConfig gateway;
    public TrayConfig tray;

    public static class EndpointConfig {
        /**
         * One of: local, cloud, tunnel.
         */
        public String kind;
        /**
         * Base URL, for example {@code http://localhost:11434}.
         */
        public String address;
        /**
         * Overrides the probe path derived from the endpoint kind.
         */
        public String healthPath;
        /**
         * Bearer token presented on health probes. Usually {@code env:} or {@code path:}.
         */
        public String token;
        public Boolean enabled;
    }

    public static class HealthConfig {
        public Integer probeTimeoutMs;
        public Integer activeIntervalSeconds;
        public Integer unavailableIntervalSeconds;
        public Integer excellentLatencyMs;
        public Integer goodLatencyMs;
        public Integer unavailableAfterFailures;
    }

    public static class BrokerConfig {
        public Integer debounceProbes;
        public Integer hysteresisTiers;
        public Integer sessionIdleMinutes;
    }

    public static class AuthConfig {
        public String issuer;
        public String audience;
        public String jwksUri;
        public Integer keyTtlSeconds;
        public Integer clockSkewSeconds;
        public Integer refreshCooldownSeconds;
        public List<String> requiredScopes;
    }

    public static class SupervisorConfig {
        /**
         * One of: docker, inprocess.
         */
        public String backend;
        public Integer idleTimeoutSeconds;
        public Integer reaperIntervalSeconds;
        public Integer drainGraceSeconds;
        public Integer readyTimeoutMs;
        public Integer provisionRetries;
        public List<Integer> provisionBackoffMs;
        public Integer maxInstances;
        public DockerConfig docker;
    }

    public static class DockerConfig {
        public String binary;
        public String image;
        public Integer memoryMb;
        public Double cpus;
        public String sharedNetwork;
        public Integer proxyPort;
        public Integer stopTimeoutSeconds;
        public Integer commandTimeoutMs;
    }

    public static class IpcConfig {
        public String chatListen;
        public String trayListen;
        public Integer ackTimeoutMs;
        public List<Integer> reconnectBackoffMs;
        public Integer maxFrameBytes;
    }

    public static class GatewayConfig {
        public Boolean enabled;
        public String listen;
        public Integer maxRequestBytes;
        public Integer workerThreads;
    }

    public static class TrayConfig {
        public List<String> daemonCommand;
        public String daemonAddress;
        public String chatAddress;
        public Integer healthIntervalSeconds;
        public Integer maxRestarts;
    }
}

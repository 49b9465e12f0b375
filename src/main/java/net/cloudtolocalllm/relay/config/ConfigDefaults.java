package net.cloudtolocalllm.relay.config;

/**
 * Default configuration template written when no config file exists.
 */
public final class ConfigDefaults {
    private static final String DEFAULT_YAML = """
            # Generated default relay config.
            # Cloud and tunnel endpoints may need a bearer token for health probes:
            #   token: env:CTL_RELAY_TOKEN
            endpoints:
              - kind: local
                address: http://localhost:11434
              - kind: cloud
                address: https://app.cloudtolocalllm.online
              - kind: tunnel
                address: http://127.0.0.1:8765
                enabled: false

            health:
              probeTimeoutMs: 5000
              activeIntervalSeconds: 15
              unavailableIntervalSeconds: 60
              excellentLatencyMs: 150
              goodLatencyMs: 500
              unavailableAfterFailures: 5

            broker:
              debounceProbes: 2
              hysteresisTiers: 1
              sessionIdleMinutes: 10

            auth:
              issuer: https://dev-xafu7oedkd5wlrbo.us.auth0.com/
              audience: https://api.cloudtolocalllm.online
              jwksUri: https://dev-xafu7oedkd5wlrbo.us.auth0.com/.well-known/jwks.json
              keyTtlSeconds: 600
              clockSkewSeconds: 60
              refreshCooldownSeconds: 60

            supervisor:
              backend: inprocess
              idleTimeoutSeconds: 600
              reaperIntervalSeconds: 60
              drainGraceSeconds: 30
              readyTimeoutMs: 30000
              provisionRetries: 3
              provisionBackoffMs: [1000, 2000, 4000]
              docker:
                binary: docker
                image: cloudtolocalllm-streaming-proxy:latest
                memoryMb: 512
                cpus: 0.5
                sharedNetwork: cloudtolocalllm-network
                proxyPort: 3001
                stopTimeoutSeconds: 10
                commandTimeoutMs: 20000

            ipc:
              chatListen: 127.0.0.1:8181
              trayListen: 127.0.0.1:8184
              ackTimeoutMs: 5000
              reconnectBackoffMs: [1000, 2000, 5000]
              maxFrameBytes: 1048576

            gateway:
              enabled: false
              listen: 127.0.0.1:8190
              maxRequestBytes: 262144
              workerThreads: 16

            tray:
              daemonCommand: [java, -jar, ctl-relay.jar, daemon]
              daemonAddress: 127.0.0.1:8184
              chatAddress: 127.0.0.1:8183
              healthIntervalSeconds: 10
              maxRestarts: 3
            """;

    private ConfigDefaults() {
    }

    /**
     * Render the default configuration template.
     */
    public static String defaultYaml() {
        return DEFAULT_YAML;
    }
}

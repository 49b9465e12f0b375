package net.cloudtolocalllm.relay.supervisor;

import java.time.Duration;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.cloudtolocalllm.relay.config.RelayConfig;

@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class DockerSettings {
    private final String binary;
    private final String image;
    private final int memoryMb;
    private final double cpus;
    /**
     * Network shared with the API so it can reach every proxy; null keeps proxies on their own network only.
     */
    private final String sharedNetwork;
    private final int proxyPort;
    private final int stopTimeoutSeconds;
    private final Duration commandTimeout;

    public static DockerSettings fromConfig(RelayConfig.DockerConfig docker) {
        RelayConfig.DockerConfig source = docker == null ? new RelayConfig.DockerConfig() : docker;
        return new DockerSettings(
                source.binary == null || source.binary.isBlank() ? "docker" : source.binary.trim(),
                source.image == null ? "cloudtolocalllm-streaming-proxy:latest" : source.image.trim(),
                source.memoryMb == null ? 512 : source.memoryMb,
                source.cpus == null ? 0.5 : source.cpus,
                source.sharedNetwork == null || source.sharedNetwork.isBlank() ? null : source.sharedNetwork.trim(),
                source.proxyPort == null ? 3001 : source.proxyPort,
                source.stopTimeoutSeconds == null ? 10 : source.stopTimeoutSeconds,
                Duration.ofMillis(source.commandTimeoutMs == null ? 20_000 : source.commandTimeoutMs)
        );
    }
}

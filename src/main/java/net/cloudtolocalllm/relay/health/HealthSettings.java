package net.cloudtolocalllm.relay.health;

import java.time.Duration;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.cloudtolocalllm.relay.config.RelayConfig;

@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class HealthSettings {
    public static final HealthSettings DEFAULT = new HealthSettings(
            5000, Duration.ofSeconds(15), Duration.ofSeconds(60), QualityThresholds.DEFAULT);

    private final int probeTimeoutMs;
    private final Duration activeInterval;
    private final Duration unavailableInterval;
    private final QualityThresholds thresholds;

    public static HealthSettings fromConfig(RelayConfig config) {
        RelayConfig.HealthConfig health = config == null ? null : config.health;
        if (health == null) {
            return DEFAULT;
        }
        return new HealthSettings(
                health.probeTimeoutMs == null ? DEFAULT.probeTimeoutMs : health.probeTimeoutMs,
                health.activeIntervalSeconds == null
                        ? DEFAULT.activeInterval : Duration.ofSeconds(health.activeIntervalSeconds),
                health.unavailableIntervalSeconds == null
                        ? DEFAULT.unavailableInterval : Duration.ofSeconds(health.unavailableIntervalSeconds),
                QualityThresholds.fromConfig(health)
        );
    }
}

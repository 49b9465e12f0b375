package net.cloudtolocalllm.relay.supervisor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.cloudtolocalllm.relay.config.RelayConfig;

@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class SupervisorSettings {
    private static final List<Duration> DEFAULT_BACKOFF = List.of(
            Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4));

    public static final SupervisorSettings DEFAULT = new SupervisorSettings(
            Duration.ofMinutes(10), Duration.ofSeconds(60), Duration.ofSeconds(30),
            Duration.ofSeconds(30), DEFAULT_BACKOFF, 1000);

    private final Duration idleTimeout;
    private final Duration reaperInterval;
    private final Duration drainGrace;
    private final Duration readyTimeout;
    /**
     * Pause before each provisioning retry; its size is the retry count.
     */
    private final List<Duration> provisionBackoff;
    private final int maxInstances;

    public static SupervisorSettings fromConfig(RelayConfig.SupervisorConfig supervisor) {
        if (supervisor == null) {
            return DEFAULT;
        }
        int retries = supervisor.provisionRetries == null ? DEFAULT_BACKOFF.size() : supervisor.provisionRetries;
        List<Duration> backoff = new ArrayList<>(retries);
        for (int i = 0; i < retries; i++) {
            backoff.add(backoffAt(supervisor.provisionBackoffMs, i));
        }
        return new SupervisorSettings(
                supervisor.idleTimeoutSeconds == null
                        ? DEFAULT.idleTimeout : Duration.ofSeconds(supervisor.idleTimeoutSeconds),
                supervisor.reaperIntervalSeconds == null
                        ? DEFAULT.reaperInterval : Duration.ofSeconds(supervisor.reaperIntervalSeconds),
                supervisor.drainGraceSeconds == null
                        ? DEFAULT.drainGrace : Duration.ofSeconds(supervisor.drainGraceSeconds),
                supervisor.readyTimeoutMs == null
                        ? DEFAULT.readyTimeout : Duration.ofMillis(supervisor.readyTimeoutMs),
                List.copyOf(backoff),
                supervisor.maxInstances == null ? DEFAULT.maxInstances : supervisor.maxInstances
        );
    }

    private static Duration backoffAt(List<Integer> configured, int index) {
        if (configured == null || configured.isEmpty()) {
            return DEFAULT_BACKOFF.get(Math.min(index, DEFAULT_BACKOFF.size() - 1));
        }
        return Duration.ofMillis(configured.get(Math.min(index, configured.size() - 1)));
    }
}

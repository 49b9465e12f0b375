package net.cloudtolocalllm.relay.health;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.cloudtolocalllm.relay.config.RelayConfig;

/**
 * Maps latency and failure streaks onto a {@link QualityScore}.
 * <ul>
 *     <li>Excellent: latency under {@code excellentLatencyMs}, no recent failure.</li>
 *     <li>Good: latency under {@code goodLatencyMs}, at most one failure.</li>
 *     <li>Degraded: reachable but slow, or 2 up to {@code unavailableAfterFailures - 1} failures.</li>
 *     <li>Unavailable: {@code unavailableAfterFailures} failures in a row, or a refused connection.</li>
 * </ul>
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class QualityThresholds {
    public static final QualityThresholds DEFAULT = new QualityThresholds(150, 500, 5);

    private final long excellentLatencyMs;
    private final long goodLatencyMs;
    private final int unavailableAfterFailures;

    public static QualityThresholds fromConfig(RelayConfig.HealthConfig health) {
        if (health == null) {
            return DEFAULT;
        }
        return new QualityThresholds(
                health.excellentLatencyMs == null ? DEFAULT.excellentLatencyMs : health.excellentLatencyMs,
                health.goodLatencyMs == null ? DEFAULT.goodLatencyMs : health.goodLatencyMs,
                health.unavailableAfterFailures == null ? DEFAULT.unavailableAfterFailures : health.unavailableAfterFailures
        );
    }

    /**
     * @param latencyMs latest successful latency, or null if the endpoint never answered
     */
    public QualityScore score(Long latencyMs, int consecutiveFailures, boolean refused) {
        if (refused || consecutiveFailures >= unavailableAfterFailures) {
            return QualityScore.UNAVAILABLE;
        }
        if (latencyMs == null || consecutiveFailures >= 2) {
            return QualityScore.DEGRADED;
        }
        if (consecutiveFailures == 0 && latencyMs < excellentLatencyMs) {
            return QualityScore.EXCELLENT;
        }
        if (latencyMs < goodLatencyMs) {
            return QualityScore.GOOD;
        }
        return QualityScore.DEGRADED;
    }
}

package net.cloudtolocalllm.relay.health;

import java.time.Instant;

import lombok.Value;
import lombok.experimental.Accessors;
import net.cloudtolocalllm.relay.http.HttpTarget;

/**
 * Immutable view of an endpoint's health at one instant.
 */
@Value
@Accessors(fluent = true)
public class EndpointSnapshot {
    EndpointKind kind;
    HttpTarget target;
    /**
     * Latency of the most recent successful probe, or null before the first success.
     */
    Long lastLatencyMs;
    Instant lastCheckedAt;
    /**
     * Number of probes recorded so far; tells a fresh probe from a re-read of the same one.
     */
    long probeSequence;
    int consecutiveFailures;
    QualityScore qualityScore;
    String lastError;

    public boolean isAtLeast(QualityScore score) {
        return qualityScore.isAtLeast(score);
    }
}

package net.cloudtolocalllm.relay.health;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

import net.cloudtolocalllm.relay.http.HttpTarget;

/**
 * One configured endpoint and its live health record.
 * <p>
 * Health fields are written only by {@link HealthMonitor}; everybody else reads them through
 * {@link #snapshot()}.
 */
public final class ConnectionEndpoint {
    private final EndpointKind kind;
    private final HttpTarget target;
    private final String healthPath;
    private final Map<String, String> probeHeaders;

    private Long lastLatencyMs;
    private Instant lastCheckedAt;
    private long probeSequence;
    private int consecutiveFailures;
    private QualityScore qualityScore = QualityScore.UNAVAILABLE;
    private String lastError = "not probed yet";

    public ConnectionEndpoint(EndpointKind kind, HttpTarget target, String healthPath, Map<String, String> probeHeaders) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.target = Objects.requireNonNull(target, "target");
        this.healthPath = healthPath == null || healthPath.isBlank() ? kind.defaultHealthPath() : healthPath;
        this.probeHeaders = probeHeaders == null ? Map.of() : Map.copyOf(probeHeaders);
    }

    public EndpointKind kind() {
        return kind;
    }

    public HttpTarget target() {
        return target;
    }

    public String healthPath() {
        return healthPath;
    }

    public Map<String, String> probeHeaders() {
        return probeHeaders;
    }

    public synchronized EndpointSnapshot snapshot() {
        return new EndpointSnapshot(kind, target, lastLatencyMs, lastCheckedAt,
                probeSequence, consecutiveFailures, qualityScore, lastError);
    }

    synchronized EndpointSnapshot apply(ProbeResult result, Instant checkedAt, QualityThresholds thresholds) {
        lastCheckedAt = checkedAt;
        probeSequence++;
        if (result.success()) {
            consecutiveFailures = 0;
            lastLatencyMs = result.latencyMs();
            lastError = null;
            qualityScore = thresholds.score(lastLatencyMs, 0, false);
        } else {
            consecutiveFailures++;
            lastError = result.failure() + (result.message() == null ? "" : ": " + result.message());
            qualityScore = thresholds.score(lastLatencyMs, consecutiveFailures,
                    result.failure() == ProbeFailure.CONNECTION_REFUSED);
        }
        return snapshot();
    }
}

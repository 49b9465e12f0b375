package net.cloudtolocalllm.relay.health;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Outcome of one health probe. Failures are values, never exceptions.
 */
@Getter
@Accessors(fluent = true)
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ProbeResult {
    private final boolean success;
    private final long latencyMs;
    private final ProbeFailure failure;
    private final String message;

    public static ProbeResult ok(long latencyMs) {
        return new ProbeResult(true, Math.max(0, latencyMs), null, null);
    }

    public static ProbeResult failed(ProbeFailure failure, String message) {
        return new ProbeResult(false, -1, failure, message);
    }

    public static ProbeResult timeout(long timeoutMs) {
        return failed(ProbeFailure.TIMEOUT, "no answer within " + timeoutMs + "ms");
    }

    public static ProbeResult refused(String message) {
        return failed(ProbeFailure.CONNECTION_REFUSED, message);
    }
}

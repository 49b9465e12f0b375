package net.cloudtolocalllm.relay.broker;

import java.util.Map;

import net.cloudtolocalllm.relay.config.RelayConfig;
import net.cloudtolocalllm.relay.health.EndpointKind;
import net.cloudtolocalllm.relay.health.EndpointSnapshot;
import net.cloudtolocalllm.relay.health.QualityScore;

/**
 * Pure routing decision: given a session's state and current endpoint health, where should it go.
 * <p>
 * Preference: local if Good or better, else cloud if Good or better, else the tunnel if reachable,
 * else whichever endpoint is still reachable. An active endpoint that becomes unavailable is left
 * at once. Otherwise a switch needs a candidate at least {@code hysteresisTiers} above the active
 * endpoint, confirmed by {@code debounceProbes} consecutive probes of that candidate.
 */
public final class RoutePolicy {
    public static final RoutePolicy DEFAULT = new RoutePolicy(2, 1);

    private final int debounceProbes;
    private final int hysteresisTiers;

    public RoutePolicy(int debounceProbes, int hysteresisTiers) {
        if (debounceProbes < 1 || hysteresisTiers < 0) {
            throw new IllegalArgumentException("debounceProbes must be >= 1 and hysteresisTiers >= 0");
        }
        this.debounceProbes = debounceProbes;
        this.hysteresisTiers = hysteresisTiers;
    }

    public static RoutePolicy fromConfig(RelayConfig.BrokerConfig broker) {
        if (broker == null) {
            return DEFAULT;
        }
        return new RoutePolicy(
                broker.debounceProbes == null ? DEFAULT.debounceProbes : broker.debounceProbes,
                broker.hysteresisTiers == null ? DEFAULT.hysteresisTiers : broker.hysteresisTiers
        );
    }

    public RouteDecision decide(RouteState state, Map<EndpointKind, EndpointSnapshot> health) {
        EndpointKind active = state.activeKind();
        EndpointKind preferred = preferred(health);
        if (active == null) {
            return RouteDecision.settled(preferred);
        }
        EndpointSnapshot current = health.get(active);
        if (current == null || !current.qualityScore().isReachable()) {
            return RouteDecision.settled(preferred);
        }
        if (preferred == null || preferred == active) {
            return RouteDecision.settled(active);
        }
        EndpointSnapshot candidate = health.get(preferred);
        if (candidate.qualityScore().tier() - current.qualityScore().tier() < hysteresisTiers) {
            return RouteDecision.settled(active);
        }
        int confirmations = 1;
        if (preferred == state.pendingCandidate()) {
            confirmations = state.pendingConfirmations();
            if (candidate.probeSequence() > state.pendingProbeSequence()) {
                confirmations++;
            }
        }
        if (confirmations >= debounceProbes) {
            return RouteDecision.settled(preferred);
        }
        return new RouteDecision(active, RouteStatus.REEVALUATING, preferred, confirmations, candidate.probeSequence());
    }

    /**
     * Endpoint a fresh session would pick, or null when nothing is reachable.
     */
    public EndpointKind preferred(Map<EndpointKind, EndpointSnapshot> health) {
        if (atLeast(health, EndpointKind.LOCAL_INFERENCE, QualityScore.GOOD)) {
            return EndpointKind.LOCAL_INFERENCE;
        }
        if (atLeast(health, EndpointKind.CLOUD_RELAY, QualityScore.GOOD)) {
            return EndpointKind.CLOUD_RELAY;
        }
        if (atLeast(health, EndpointKind.TUNNEL, QualityScore.DEGRADED)) {
            return EndpointKind.TUNNEL;
        }
        EndpointKind fallback = null;
        for (EndpointKind kind : EndpointKind.values()) {
            EndpointSnapshot snapshot = health.get(kind);
            if (snapshot != null && snapshot.qualityScore().isReachable()
                    && (fallback == null || snapshot.qualityScore().tier() > health.get(fallback).qualityScore().tier())) {
                fallback = kind;
            }
        }
        return fallback;
    }

    private static boolean atLeast(Map<EndpointKind, EndpointSnapshot> health, EndpointKind kind, QualityScore score) {
        EndpointSnapshot snapshot = health.get(kind);
        return snapshot != null && snapshot.isAtLeast(score);
    }
}

package net.cloudtolocalllm.relay.broker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

import net.cloudtolocalllm.relay.config.RelayConfig;
import net.cloudtolocalllm.relay.health.EndpointKind;
import net.cloudtolocalllm.relay.health.EndpointSnapshot;
import net.cloudtolocalllm.relay.health.QualityScore;
import org.junit.jupiter.api.Test;

class RoutePolicyTest {
    @Test
    void prefersLocalThenCloudThenTunnel() {
        RoutePolicy policy = RoutePolicy.DEFAULT;

        assertEquals(EndpointKind.LOCAL_INFERENCE, policy.preferred(health(
                QualityScore.GOOD, QualityScore.EXCELLENT, QualityScore.EXCELLENT)));
        assertEquals(EndpointKind.CLOUD_RELAY, policy.preferred(health(
                QualityScore.DEGRADED, QualityScore.GOOD, QualityScore.EXCELLENT)));
        assertEquals(EndpointKind.TUNNEL, policy.preferred(health(
                QualityScore.DEGRADED, QualityScore.DEGRADED, QualityScore.DEGRADED)));
    }

    @Test
    void fallsBackToBestReachable() {
        assertEquals(EndpointKind.CLOUD_RELAY, RoutePolicy.DEFAULT.preferred(health(
                QualityScore.UNAVAILABLE, QualityScore.DEGRADED, QualityScore.UNAVAILABLE)));
        assertNull(RoutePolicy.DEFAULT.preferred(health(
                QualityScore.UNAVAILABLE, QualityScore.UNAVAILABLE, QualityScore.UNAVAILABLE)));
    }

    @Test
    void freshSessionSettlesWithoutDebounce() {
        RouteDecision decision = RoutePolicy.DEFAULT.decide(new RouteState("u", Instant.EPOCH),
                health(QualityScore.EXCELLENT, QualityScore.GOOD, QualityScore.UNAVAILABLE));

        assertEquals(EndpointKind.LOCAL_INFERENCE, decision.activeKind());
        assertEquals(RouteStatus.LOCAL_ACTIVE, decision.status());
    }

    @Test
    void readsConfigAndRejectsNonsense() {
        RelayConfig.BrokerConfig broker = new RelayConfig.BrokerConfig();
        broker.debounceProbes = 3;
        RoutePolicy.fromConfig(broker);
        assertThrows(IllegalArgumentException.class, () -> new RoutePolicy(0, 1));
        assertThrows(IllegalArgumentException.class, () -> new RoutePolicy(2, -1));
    }

    private static Map<EndpointKind, EndpointSnapshot> health(QualityScore local, QualityScore cloud, QualityScore tunnel) {
        Map<EndpointKind, EndpointSnapshot> health = new EnumMap<>(EndpointKind.class);
        health.put(EndpointKind.LOCAL_INFERENCE, snapshot(EndpointKind.LOCAL_INFERENCE, local));
        health.put(EndpointKind.CLOUD_RELAY, snapshot(EndpointKind.CLOUD_RELAY, cloud));
        health.put(EndpointKind.TUNNEL, snapshot(EndpointKind.TUNNEL, tunnel));
        return health;
    }

    private static EndpointSnapshot snapshot(EndpointKind kind, QualityScore score) {
        return new EndpointSnapshot(kind, null, 10L, Instant.EPOCH, 1, 0, score, null);
    }
}

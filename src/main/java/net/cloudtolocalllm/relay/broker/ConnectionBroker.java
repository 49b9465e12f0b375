package net.cloudtolocalllm.relay.broker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

import net.cloudtolocalllm.relay.health.ConnectionEndpoint;
import net.cloudtolocalllm.relay.health.EndpointKind;
import net.cloudtolocalllm.relay.health.EndpointSnapshot;
import net.cloudtolocalllm.relay.health.HealthListener;
import net.cloudtolocalllm.relay.health.HealthMonitor;
import net.cloudtolocalllm.relay.health.QualityScore;
import net.cloudtolocalllm.relay.util.UserIdHash;

/**
 * Decides, per user session, which endpoint serves inference traffic.
 * <p>
 * Sessions are re-evaluated on every request and on every health update. Each session is guarded by
 * its own fair lock, so requests of one user are decided in arrival order while different users
 * never wait for each other.
 */
public final class ConnectionBroker implements HealthListener {
    private final HealthMonitor monitor;
    private final RoutePolicy policy;
    private final RouteEventListener listener;
    private final Clock clock;
    private final Map<String, RouteState> sessions = new ConcurrentHashMap<>();

    public ConnectionBroker(HealthMonitor monitor, RoutePolicy policy, RouteEventListener listener, Clock clock) {
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.listener = listener == null ? RouteEventListener.NOOP : listener;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Endpoint that should serve the user's next request.
     *
     * @throws NoRouteException when no endpoint is reachable
     */
    public ConnectionEndpoint resolveRoute(String userId) throws NoRouteException {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        RouteState state = sessions.computeIfAbsent(userId, id -> new RouteState(id, clock.instant()));
        EndpointKind kind;
        state.lock().lock();
        try {
            evaluate(state, monitor.snapshots());
            state.touch(clock.instant());
            kind = state.activeKind();
        } finally {
            state.lock().unlock();
        }
        if (kind == null) {
            throw new NoRouteException("no endpoint is reachable");
        }
        return monitor.endpoint(kind)
                .orElseThrow(() -> new NoRouteException("endpoint " + kind.wireName() + " is not configured"));
    }

    @Override
    public void onHealthUpdate(EndpointSnapshot snapshot) {
        Map<EndpointKind, EndpointSnapshot> health = monitor.snapshots();
        for (RouteState state : sessions.values()) {
            state.lock().lock();
            try {
                evaluate(state, health);
            } finally {
                state.lock().unlock();
            }
        }
    }

    public Optional<RouteSnapshot> routeStatus(String userId) {
        RouteState state = userId == null ? null : sessions.get(userId);
        if (state == null) {
            return Optional.empty();
        }
        state.lock().lock();
        try {
            return Optional.of(state.snapshot());
        } finally {
            state.lock().unlock();
        }
    }

    public List<RouteSnapshot> sessions() {
        List<RouteSnapshot> result = new ArrayList<>();
        for (String userId : sessions.keySet()) {
            routeStatus(userId).ifPresent(result::add);
        }
        return result;
    }

    public void forget(String userId) {
        if (userId != null) {
            sessions.remove(userId);
        }
    }

    /**
     * Drop sessions without traffic for {@code idleWindow}, unless {@code retain} holds for the user.
     *
     * @return number of sessions dropped
     */
    public int pruneIdle(Duration idleWindow, Predicate<String> retain) {
        Instant cutoff = clock.instant().minus(idleWindow);
        int removed = 0;
        for (RouteState state : new ArrayList<>(sessions.values())) {
            if (state.lastActivityAt().isBefore(cutoff) && !retain.test(state.userId())
                    && sessions.remove(state.userId(), state)) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Best quality currently available to a new session.
     */
    public QualityScore bestAvailableQuality() {
        Map<EndpointKind, EndpointSnapshot> health = monitor.snapshots();
        EndpointKind preferred = policy.preferred(health);
        return preferred == null ? QualityScore.UNAVAILABLE : health.get(preferred).qualityScore();
    }

    private void evaluate(RouteState state, Map<EndpointKind, EndpointSnapshot> health) {
        RouteStatus previousStatus = state.status();
        EndpointKind previousKind = state.activeKind();
        RouteDecision decision = policy.decide(state, health);
        state.apply(decision, clock.instant());
        if (previousStatus == state.status() && previousKind == state.activeKind()) {
            return;
        }
        EndpointSnapshot active = state.activeKind() == null ? null : health.get(state.activeKind());
        RouteEvent event = new RouteEvent(
                clock.instant(),
                UserIdHash.shortHash(state.userId()),
                previousStatus,
                state.status(),
                previousKind,
                state.activeKind(),
                active == null ? QualityScore.UNAVAILABLE : active.qualityScore(),
                state.failoverCount()
        );
        try {
            listener.onRouteChange(event);
        } catch (RuntimeException e) {
            System.err.println("Route listener failed: " + e.getMessage());
        }
    }
}

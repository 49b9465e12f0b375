package net.cloudtolocalllm.relay.health;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import net.cloudtolocalllm.relay.config.RelayConfig;
import net.cloudtolocalllm.relay.http.HttpTarget;
import net.cloudtolocalllm.relay.util.DaemonThreads;

/**
 * Owns the endpoint table and probes every endpoint on its own schedule.
 * <p>
 * This is the only writer of endpoint health. Probes run every {@code activeInterval}; an
 * unavailable endpoint backs off exponentially up to {@code unavailableInterval}.
 */
public final class HealthMonitor implements AutoCloseable {
    private final Map<EndpointKind, ConnectionEndpoint> endpoints;
    private final EndpointProbe probe;
    private final HealthSettings settings;
    private final Clock clock;
    private final List<HealthListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<EndpointKind, ScheduledFuture<?>> scheduled = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public HealthMonitor(Collection<ConnectionEndpoint> endpoints, EndpointProbe probe, HealthSettings settings, Clock clock) {
        Map<EndpointKind, ConnectionEndpoint> table = new EnumMap<>(EndpointKind.class);
        for (ConnectionEndpoint endpoint : endpoints) {
            if (table.putIfAbsent(endpoint.kind(), endpoint) != null) {
                throw new IllegalArgumentException("duplicate endpoint kind: " + endpoint.kind());
            }
        }
        this.endpoints = Collections.unmodifiableMap(table);
        this.probe = Objects.requireNonNull(probe, "probe");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(DaemonThreads.named("ctl-health-probe"));
    }

    /**
     * Build the endpoint table from {@code endpoints}, skipping disabled entries.
     */
    public static HealthMonitor fromConfig(RelayConfig config, EndpointProbe probe, Clock clock) {
        List<ConnectionEndpoint> endpoints = new ArrayList<>();
        if (config.endpoints != null) {
            for (RelayConfig.EndpointConfig entry : config.endpoints) {
                if (entry == null || Boolean.FALSE.equals(entry.enabled)) {
                    continue;
                }
                Map<String, String> headers = entry.token == null || entry.token.isBlank()
                        ? Map.of()
                        : Map.of("Authorization", "Bearer " + entry.token.trim());
                endpoints.add(new ConnectionEndpoint(
                        EndpointKind.fromWireName(entry.kind),
                        HttpTarget.parse(entry.address),
                        entry.healthPath,
                        headers
                ));
            }
        }
        return new HealthMonitor(endpoints, probe, HealthSettings.fromConfig(config), clock);
    }

    public void addListener(HealthListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void start() {
        if (stopped.get() || !started.compareAndSet(false, true)) {
            return;
        }
        for (ConnectionEndpoint endpoint : endpoints.values()) {
            schedule(endpoint, Duration.ZERO);
        }
    }

    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        for (ScheduledFuture<?> future : scheduled.values()) {
            future.cancel(false);
        }
        scheduled.clear();
        scheduler.shutdownNow();
        try {
            probe.close();
        } catch (Exception e) {
            System.err.println("Failed to stop endpoint probe: " + e.getMessage());
        }
    }

    @Override
    public void close() {
        stop();
    }

    public Optional<ConnectionEndpoint> endpoint(EndpointKind kind) {
        return Optional.ofNullable(endpoints.get(kind));
    }

    public Collection<ConnectionEndpoint> endpoints() {
        return endpoints.values();
    }

    /**
     * Current snapshot of every configured endpoint, keyed by kind.
     */
    public Map<EndpointKind, EndpointSnapshot> snapshots() {
        Map<EndpointKind, EndpointSnapshot> result = new EnumMap<>(EndpointKind.class);
        for (ConnectionEndpoint endpoint : endpoints.values()) {
            result.put(endpoint.kind(), endpoint.snapshot());
        }
        return result;
    }

    /**
     * Probe every endpoint once, outside the periodic schedule.
     */
    public CompletableFuture<Void> probeAll() {
        List<CompletableFuture<EndpointSnapshot>> pending = new ArrayList<>();
        for (ConnectionEndpoint endpoint : endpoints.values()) {
            pending.add(probeOnce(endpoint));
        }
        return CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]));
    }

    /**
     * Apply a probe outcome to the endpoint and notify listeners.
     */
    public EndpointSnapshot recordResult(EndpointKind kind, ProbeResult result) {
        ConnectionEndpoint endpoint = endpoints.get(kind);
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint not configured: " + kind);
        }
        EndpointSnapshot snapshot = endpoint.apply(result, clock.instant(), settings.thresholds());
        for (HealthListener listener : listeners) {
            try {
                listener.onHealthUpdate(snapshot);
            } catch (RuntimeException e) {
                System.err.println("Health listener failed for " + kind.wireName() + ": " + e.getMessage());
            }
        }
        return snapshot;
    }

    /**
     * Delay before the next probe of an endpoint in the given state.
     */
    Duration nextDelay(EndpointSnapshot snapshot) {
        Duration active = settings.activeInterval();
        if (snapshot.qualityScore().isReachable()) {
            return active;
        }
        int beyondThreshold = snapshot.consecutiveFailures() - settings.thresholds().unavailableAfterFailures() + 1;
        int exponent = Math.min(Math.max(1, beyondThreshold), 16);
        Duration backoff = active.multipliedBy(1L << exponent);
        Duration cap = settings.unavailableInterval();
        return backoff.compareTo(cap) > 0 ? cap : backoff;
    }

    private void schedule(ConnectionEndpoint endpoint, Duration delay) {
        if (stopped.get()) {
            return;
        }
        ScheduledFuture<?> future = scheduler.schedule(() -> probeOnce(endpoint)
                        .thenAccept(snapshot -> schedule(endpoint, nextDelay(snapshot))),
                delay.toMillis(), TimeUnit.MILLISECONDS);
        scheduled.put(endpoint.kind(), future);
    }

    private CompletableFuture<EndpointSnapshot> probeOnce(ConnectionEndpoint endpoint) {
        int timeoutMs = settings.probeTimeoutMs();
        CompletableFuture<ProbeResult> outcome;
        try {
            outcome = probe.probe(endpoint, timeoutMs);
        } catch (RuntimeException e) {
            outcome = CompletableFuture.completedFuture(
                    ProbeResult.failed(ProbeFailure.PROTOCOL_ERROR, e.getMessage()));
        }
        return outcome
                .completeOnTimeout(ProbeResult.timeout(timeoutMs), timeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(error -> ProbeResult.failed(ProbeFailure.PROTOCOL_ERROR, String.valueOf(error.getMessage())))
                .thenApply(result -> recordResult(endpoint.kind(), result));
    }
}

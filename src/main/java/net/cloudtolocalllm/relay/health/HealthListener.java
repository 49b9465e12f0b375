package net.cloudtolocalllm.relay.health;

/**
 * Notified after every recorded probe.
 */
@FunctionalInterface
public interface HealthListener {
    HealthListener NOOP = snapshot -> {
    };

    void onHealthUpdate(EndpointSnapshot snapshot);
}

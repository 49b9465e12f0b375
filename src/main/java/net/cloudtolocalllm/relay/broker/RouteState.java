package net.cloudtolocalllm.relay.broker;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

import net.cloudtolocalllm.relay.health.EndpointKind;

/**
 * Per-user routing record. Mutated only by {@link ConnectionBroker} while holding {@link #lock()}.
 */
public final class RouteState {
    private final String userId;
    private final ReentrantLock lock = new ReentrantLock(true);
    private RouteStatus status = RouteStatus.UNROUTED;
    private EndpointKind activeKind;
    private Instant lastFailoverAt;
    private int failoverCount;
    private EndpointKind pendingCandidate;
    private int pendingConfirmations;
    private long pendingProbeSequence;
    private volatile Instant lastActivityAt;

    RouteState(String userId, Instant createdAt) {
        this.userId = userId;
        this.lastActivityAt = createdAt;
    }

    public String userId() {
        return userId;
    }

    public RouteStatus status() {
        return status;
    }

    public EndpointKind activeKind() {
        return activeKind;
    }

    public Instant lastFailoverAt() {
        return lastFailoverAt;
    }

    public int failoverCount() {
        return failoverCount;
    }

    public EndpointKind pendingCandidate() {
        return pendingCandidate;
    }

    public int pendingConfirmations() {
        return pendingConfirmations;
    }

    public long pendingProbeSequence() {
        return pendingProbeSequence;
    }

    public Instant lastActivityAt() {
        return lastActivityAt;
    }

    ReentrantLock lock() {
        return lock;
    }

    void touch(Instant at) {
        lastActivityAt = at;
    }

    /**
     * Apply a decision. A change of active endpoint after the first one counts as a failover.
     */
    void apply(RouteDecision decision, Instant now) {
        if (activeKind != null && activeKind != decision.activeKind()) {
            failoverCount++;
            lastFailoverAt = now;
        }
        activeKind = decision.activeKind();
        status = decision.status();
        pendingCandidate = decision.pendingCandidate();
        pendingConfirmations = decision.pendingConfirmations();
        pendingProbeSequence = decision.pendingProbeSequence();
    }

    RouteSnapshot snapshot() {
        return new RouteSnapshot(userId, status, activeKind, failoverCount, lastFailoverAt, lastActivityAt);
    }
}

package net.cloudtolocalllm.relay.supervisor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import net.cloudtolocalllm.relay.auth.Claims;
import net.cloudtolocalllm.relay.util.DaemonThreads;
import net.cloudtolocalllm.relay.util.UserIdHash;

/**
 * Provisions, tracks and reclaims one isolated proxy per user.
 * <p>
 * At most one instance per user is {@link ProxyState#ACTIVE}; concurrent first requests for a user
 * wait on that user's lock and share the instance the first one created. A periodic reaper drains
 * instances idle longer than {@code idleTimeout} and terminates them once the drain grace has passed.
 * Streams still open at that point are force-closed first.
 */
public final class ProxySupervisor implements AutoCloseable {
    private final ProvisionBackend backend;
    private final SupervisorSettings settings;
    private final ProxyEventListener listener;
    private final Clock clock;
    private final Map<String, UserSlot> slots = new ConcurrentHashMap<>();
    private final Map<String, ProxyInstance> instances = new ConcurrentHashMap<>();
    private final AtomicLong streamSequence = new AtomicLong();
    private final AtomicLong instanceSequence = new AtomicLong();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> reaperTask;

    public ProxySupervisor(ProvisionBackend backend, SupervisorSettings settings, ProxyEventListener listener, Clock clock) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.listener = listener == null ? ProxyEventListener.NOOP : listener;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(DaemonThreads.named("ctl-proxy-reaper"));
    }

    public SupervisorSettings settings() {
        return settings;
    }

    public void start() {
        if (stopped.get() || !started.compareAndSet(false, true)) {
            return;
        }
        long intervalMs = settings.reaperInterval().toMillis();
        reaperTask = scheduler.scheduleAtFixedRate(this::reapSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Return the user's active instance, provisioning one first if needed. Either way the instance
     * counts as used now.
     *
     * @param claims proof that the caller holds a validated token for {@code userId}
     */
    public ProxyInstance ensureInstance(String userId, Claims claims) throws ProvisionException {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (stopped.get()) {
            throw new ProvisionException(ProvisionFailure.DRAINING, "supervisor is shutting down");
        }
        authorize(userId, claims);
        while (true) {
            UserSlot slot = slots.computeIfAbsent(userId, ignored -> new UserSlot());
            ProxyInstance current = slot.current.get();
            if (current != null && current.state() == ProxyState.ACTIVE) {
                current.touch(clock.instant());
                return current;
            }
            slot.lock.lock();
            try {
                if (slot.retired) {
                    continue;
                }
                current = slot.current.get();
                if (current != null && current.state() == ProxyState.ACTIVE) {
                    current.touch(clock.instant());
                    return current;
                }
                ProxyInstance instance = provision(userId);
                slot.current.set(instance);
                return instance;
            } finally {
                slot.lock.unlock();
            }
        }
    }

    /**
     * Open a stream on an active instance. Draining and terminated instances refuse new streams.
     */
    public StreamLease openStream(String instanceId) throws ProvisionException {
        ProxyInstance instance = instances.get(instanceId);
        if (instance == null) {
            throw new ProvisionException(ProvisionFailure.DRAINING, "instance " + instanceId + " no longer exists");
        }
        synchronized (instance) {
            if (instance.state() != ProxyState.ACTIVE) {
                throw new ProvisionException(ProvisionFailure.DRAINING,
                        "instance " + instanceId + " is " + instance.state().wireName());
            }
            StreamLease lease = new StreamLease(instanceId + "-s" + streamSequence.incrementAndGet(), instance, this);
            instance.addStream(lease);
            instance.touch(clock.instant());
            return lease;
        }
    }

    public void recordActivity(String instanceId) {
        ProxyInstance instance = instances.get(instanceId);
        if (instance == null) {
            return;
        }
        ProxyState state = instance.state();
        if (state == ProxyState.ACTIVE || state == ProxyState.DRAINING) {
            instance.touch(clock.instant());
        }
    }

    /**
     * One reaper cycle.
     *
     * @return number of instances drained or terminated
     */
    public int reapIdle() {
        Instant now = clock.instant();
        int changed = 0;
        for (ProxyInstance instance : new ArrayList<>(instances.values())) {
            if (instance.state() == ProxyState.ACTIVE
                    && Duration.between(instance.lastActivityAt(), now).compareTo(settings.idleTimeout()) > 0) {
                if (drain(instance, now, "idle")) {
                    changed++;
                }
            }
            if (instance.state() == ProxyState.DRAINING
                    && !now.isBefore(instance.drainingSince().plus(settings.drainGrace()))) {
                if (terminate(instance, "drain grace elapsed")) {
                    changed++;
                }
            }
        }
        return changed;
    }

    /**
     * User initiated teardown: open streams are cancelled and the instance is terminated now.
     *
     * @return true if an active instance was terminated
     */
    public boolean disconnect(String userId) {
        UserSlot slot = userId == null ? null : slots.get(userId);
        ProxyInstance instance = slot == null ? null : slot.current.get();
        if (instance == null) {
            return false;
        }
        if (!drain(instance, clock.instant(), "user disconnect")) {
            return false;
        }
        return terminate(instance, "user disconnect");
    }

    public Optional<ProxyInstance> activeInstance(String userId) {
        UserSlot slot = userId == null ? null : slots.get(userId);
        ProxyInstance instance = slot == null ? null : slot.current.get();
        if (instance == null || instance.state() != ProxyState.ACTIVE) {
            return Optional.empty();
        }
        return Optional.of(instance);
    }

    public Optional<ProxyInstance> instance(String instanceId) {
        return Optional.ofNullable(instances.get(instanceId));
    }

    public Optional<ProxyStatus> status(String userId) {
        return activeInstance(userId).map(instance -> ProxyStatus.of(instance, backend.healthCheck(instance)));
    }

    /**
     * Every tracked instance that has not terminated yet.
     */
    public List<ProxyStatus> snapshot() {
        List<ProxyStatus> result = new ArrayList<>();
        for (ProxyInstance instance : instances.values()) {
            result.add(ProxyStatus.of(instance, instance.state() == ProxyState.ACTIVE));
        }
        return result;
    }

    public int activeCount() {
        int count = 0;
        for (ProxyInstance instance : instances.values()) {
            if (instance.state() == ProxyState.ACTIVE) {
                count++;
            }
        }
        return count;
    }

    /**
     * Stop the reaper and tear down every instance.
     */
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        if (reaperTask != null) {
            reaperTask.cancel(false);
        }
        scheduler.shutdownNow();
        Instant now = clock.instant();
        for (ProxyInstance instance : new ArrayList<>(instances.values())) {
            drain(instance, now, "shutdown");
            terminate(instance, "shutdown");
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    private ProxyInstance provision(String userId) throws ProvisionException {
        String userHash = UserIdHash.shortHash(userId);
        Instant now = clock.instant();
        String instanceId = "ctl-proxy-" + userHash + "-" + now.toEpochMilli() + "-" + instanceSequence.incrementAndGet();
        ProxyInstance instance = new ProxyInstance(instanceId, userId, userHash,
                "ctl-user-" + userHash + "-net", now);
        instances.put(instanceId, instance);
        emit(ProxyEventType.PROVISIONING, instance, null);
        ProvisionRequest request = new ProvisionRequest(instanceId, userId, userHash, instance.networkNamespace());
        try {
            instance.attach(backend.provision(request, settings.readyTimeout()));
        } catch (ProvisionException e) {
            abandon(instance, e.failure() + ": " + e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            abandon(instance, "ENGINE_ERROR: " + e.getMessage());
            throw new ProvisionException(ProvisionFailure.ENGINE_ERROR, "provisioning failed: " + e.getMessage(), e);
        }
        boolean activated = false;
        synchronized (instance) {
            // shutdown skips instances still provisioning; they are released here instead
            if (!stopped.get()) {
                instance.touch(clock.instant());
                activated = instance.transition(ProxyState.PROVISIONING, ProxyState.ACTIVE);
            }
        }
        if (!activated) {
            abandon(instance, "DRAINING: supervisor shut down during provisioning");
            throw new ProvisionException(ProvisionFailure.DRAINING, "supervisor is shutting down");
        }
        emit(ProxyEventType.ACTIVE, instance, null);
        return instance;
    }

    private void abandon(ProxyInstance instance, String reason) {
        instance.transition(ProxyState.PROVISIONING, ProxyState.TERMINATED);
        instances.remove(instance.instanceId(), instance);
        emit(ProxyEventType.PROVISION_FAILED, instance, reason);
        try {
            backend.terminate(instance);
        } catch (ProvisionException | RuntimeException e) {
            System.err.println("Cleanup after failed provisioning of " + instance.instanceId()
                    + " failed: " + e.getMessage());
        }
    }

    private void authorize(String userId, Claims claims) throws ProvisionException {
        if (claims == null) {
            throw new ProvisionException(ProvisionFailure.UNAUTHORIZED, "a validated token is required");
        }
        if (!userId.equals(claims.subject())) {
            throw new ProvisionException(ProvisionFailure.UNAUTHORIZED, "token subject does not match the user");
        }
        if (claims.isExpiredAt(clock.instant())) {
            throw new ProvisionException(ProvisionFailure.UNAUTHORIZED, "token expired at " + claims.expiresAt());
        }
    }

    private boolean drain(ProxyInstance instance, Instant now, String reason) {
        synchronized (instance) {
            if (!instance.transition(ProxyState.ACTIVE, ProxyState.DRAINING)) {
                return false;
            }
            instance.markDraining(now);
        }
        UserSlot slot = slots.get(instance.ownerUserId());
        if (slot != null) {
            slot.current.compareAndSet(instance, null);
        }
        emit(ProxyEventType.DRAINING, instance, reason);
        scheduleGraceCheck();
        return true;
    }

    private boolean terminate(ProxyInstance instance, String reason) {
        List<StreamLease> forced;
        synchronized (instance) {
            if (instance.state() != ProxyState.DRAINING) {
                return false;
            }
            forced = instance.streamsSnapshot();
            for (StreamLease lease : forced) {
                lease.cancel();
            }
            instance.transition(ProxyState.DRAINING, ProxyState.TERMINATED);
        }
        instances.remove(instance.instanceId(), instance);
        retireSlotIfIdle(instance.ownerUserId());
        String detail = forced.isEmpty() ? reason : reason + ", force-closed " + forced.size() + " streams";
        try {
            backend.terminate(instance);
            emit(ProxyEventType.TERMINATED, instance, detail);
        } catch (ProvisionException | RuntimeException e) {
            emit(ProxyEventType.RELEASE_FAILED, instance, e.getMessage());
            System.err.println("Failed to release " + instance.instanceId() + ": " + e.getMessage());
        }
        return true;
    }

    private void retireSlotIfIdle(String userId) {
        UserSlot slot = slots.get(userId);
        if (slot == null || !slot.lock.tryLock()) {
            return;
        }
        try {
            if (slot.current.get() == null && !hasInstances(userId)) {
                slot.retired = true;
                slots.remove(userId, slot);
            }
        } finally {
            slot.lock.unlock();
        }
    }

    private boolean hasInstances(String userId) {
        for (ProxyInstance instance : instances.values()) {
            if (instance.ownerUserId().equals(userId)) {
                return true;
            }
        }
        return false;
    }

    private void scheduleGraceCheck() {
        if (!started.get() || stopped.get()) {
            return;
        }
        scheduler.schedule(this::reapSafely, settings.drainGrace().toMillis() + 1, TimeUnit.MILLISECONDS);
    }

    private void reapSafely() {
        try {
            reapIdle();
        } catch (RuntimeException e) {
            System.err.println("Proxy reaper cycle failed: " + e.getMessage());
        }
    }

    private void emit(ProxyEventType type, ProxyInstance instance, String reason) {
        try {
            listener.onEvent(ProxyEvent.from(type, instance, clock.instant(), reason));
        } catch (RuntimeException e) {
            System.err.println("Proxy event listener failed: " + e.getMessage());
        }
    }

    private static final class UserSlot {
        private final ReentrantLock lock = new ReentrantLock(true);
        private final AtomicReference<ProxyInstance> current = new AtomicReference<>();
        private volatile boolean retired;
    }
}

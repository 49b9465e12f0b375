package net.cloudtolocalllm.relay.supervisor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One user's isolated proxy. Only {@link ProxySupervisor} changes its state.
 */
public final class ProxyInstance {
    private final String instanceId;
    private final String ownerUserId;
    private final String userHash;
    private final String networkNamespace;
    private final Instant createdAt;
    private final AtomicReference<ProxyState> state = new AtomicReference<>(ProxyState.PROVISIONING);
    private final AtomicLong lastActivityMillis;
    private final Map<String, StreamLease> streams = new ConcurrentHashMap<>();
    private volatile Instant drainingSince;
    private volatile ProvisionedResources resources;

    ProxyInstance(String instanceId, String ownerUserId, String userHash, String networkNamespace, Instant createdAt) {
        this.instanceId = instanceId;
        this.ownerUserId = ownerUserId;
        this.userHash = userHash;
        this.networkNamespace = networkNamespace;
        this.createdAt = createdAt;
        this.lastActivityMillis = new AtomicLong(createdAt.toEpochMilli());
    }

    public String instanceId() {
        return instanceId;
    }

    public String ownerUserId() {
        return ownerUserId;
    }

    public String userHash() {
        return userHash;
    }

    public String networkNamespace() {
        return networkNamespace;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public ProxyState state() {
        return state.get();
    }

    public Instant lastActivityAt() {
        return Instant.ofEpochMilli(lastActivityMillis.get());
    }

    public Instant drainingSince() {
        return drainingSince;
    }

    public ProvisionedResources resources() {
        return resources;
    }

    public int inFlightStreams() {
        return streams.size();
    }

    boolean transition(ProxyState from, ProxyState to) {
        return state.compareAndSet(from, to);
    }

    /**
     * Never moves the activity clock backwards.
     */
    void touch(Instant at) {
        lastActivityMillis.accumulateAndGet(at.toEpochMilli(), Math::max);
    }

    void markDraining(Instant at) {
        drainingSince = at;
    }

    void attach(ProvisionedResources resources) {
        this.resources = resources;
    }

    void addStream(StreamLease lease) {
        streams.put(lease.streamId(), lease);
    }

    void removeStream(StreamLease lease) {
        streams.remove(lease.streamId(), lease);
    }

    List<StreamLease> streamsSnapshot() {
        return new ArrayList<>(streams.values());
    }
}

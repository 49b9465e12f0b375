package net.cloudtolocalllm.relay.supervisor;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Marks one stream as in flight on a proxy instance for as long as it is open.
 * <p>
 * {@link #close()} ends the stream normally and counts as activity. {@link #cancel()} is for a
 * client that went away or a forced shutdown; it does not count as activity.
 */
public final class StreamLease implements AutoCloseable {
    private final String streamId;
    private final ProxyInstance instance;
    private final ProxySupervisor supervisor;
    private final AtomicBoolean finished = new AtomicBoolean(false);
    private volatile boolean cancelled;
    private volatile Runnable cancelAction;

    StreamLease(String streamId, ProxyInstance instance, ProxySupervisor supervisor) {
        this.streamId = streamId;
        this.instance = instance;
        this.supervisor = supervisor;
    }

    public String streamId() {
        return streamId;
    }

    public ProxyInstance instance() {
        return instance;
    }

    public boolean isOpen() {
        return !finished.get();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Register what aborts the upstream transfer. Runs immediately when the lease is already cancelled.
     */
    public void onCancel(Runnable action) {
        cancelAction = action;
        if (cancelled) {
            runCancelAction();
        }
    }

    /**
     * Bytes moved on this stream.
     */
    public void recordActivity() {
        if (!finished.get()) {
            supervisor.recordActivity(instance.instanceId());
        }
    }

    public void cancel() {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        cancelled = true;
        instance.removeStream(this);
        runCancelAction();
    }

    @Override
    public void close() {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        instance.removeStream(this);
        supervisor.recordActivity(instance.instanceId());
    }

    private void runCancelAction() {
        Runnable action = cancelAction;
        cancelAction = null;
        if (action == null) {
            return;
        }
        try {
            action.run();
        } catch (RuntimeException e) {
            System.err.println("Cancel action failed for stream " + streamId + ": " + e.getMessage());
        }
    }
}

package net.cloudtolocalllm.relay.tray;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import net.cloudtolocalllm.relay.ipc.IpcBroadcaster;
import net.cloudtolocalllm.relay.ipc.IpcMessage;
import net.cloudtolocalllm.relay.ipc.IpcMessageType;
import net.cloudtolocalllm.relay.ipc.IpcMessages;
import net.cloudtolocalllm.relay.ipc.IpcRequester;
import net.cloudtolocalllm.relay.util.DaemonThreads;

/**
 * Keeps the relay daemon alive from the tray.
 * <p>
 * A {@code health_check} goes to the daemon every interval. A failed or unanswered check restarts the
 * daemon, at most {@code maxRestarts} times in a row; after that the user is told once and the tray
 * stops restarting until the daemon answers again.
 */
public final class TraySupervisor implements AutoCloseable {
    private final TraySettings settings;
    private final DaemonLauncher launcher;
    private final IpcRequester daemon;
    private final IpcBroadcaster chat;
    private final TrayNotifier notifier;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> checkTask;
    private int consecutiveRestarts;
    private boolean failureReported;

    public TraySupervisor(TraySettings settings,
                          DaemonLauncher launcher,
                          IpcRequester daemon,
                          IpcBroadcaster chat,
                          TrayNotifier notifier) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.daemon = Objects.requireNonNull(daemon, "daemon");
        this.chat = chat == null ? message -> 0 : chat;
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(DaemonThreads.named("ctl-tray-supervisor"));
    }

    /**
     * Launch the daemon and start the health loop.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            launcher.launch();
        } catch (IOException e) {
            System.err.println("Failed to launch daemon: " + e.getMessage());
        }
        long intervalMs = settings.healthInterval().toMillis();
        checkTask = scheduler.scheduleWithFixedDelay(this::checkSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        if (checkTask != null) {
            checkTask.cancel(false);
        }
        scheduler.shutdownNow();
        launcher.stop();
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * One health cycle.
     *
     * @return true when the daemon answered
     */
    public synchronized boolean checkOnce() {
        String failure = probeDaemon();
        if (failure == null) {
            if (consecutiveRestarts > 0 || failureReported) {
                System.out.println("Daemon healthy again after " + consecutiveRestarts + " restarts");
            }
            consecutiveRestarts = 0;
            failureReported = false;
            return true;
        }
        if (consecutiveRestarts >= settings.maxRestarts()) {
            if (!failureReported) {
                failureReported = true;
                notifier.persistentFailure("daemon unhealthy after " + consecutiveRestarts + " restarts: " + failure);
            }
            return false;
        }
        consecutiveRestarts++;
        System.err.println("Daemon health check failed (" + failure + "); restart " + consecutiveRestarts
                + " of " + settings.maxRestarts());
        try {
            launcher.launch();
            notifier.daemonRestarted(consecutiveRestarts);
        } catch (IOException e) {
            System.err.println("Failed to restart daemon: " + e.getMessage());
        }
        return false;
    }

    public synchronized int consecutiveRestarts() {
        return consecutiveRestarts;
    }

    /**
     * Ask the daemon to restart or quit one of its services.
     */
    public CompletableFuture<IpcMessage> serviceControl(String action, String service) {
        return daemon.request(IpcMessages.serviceControl(action, service));
    }

    /**
     * Show or hide the chat window.
     *
     * @return number of chat clients reached
     */
    public int windowControl(String action) {
        return chat.broadcast(IpcMessages.windowControl(action));
    }

    private String probeDaemon() {
        try {
            IpcMessage reply = daemon.request(IpcMessages.healthCheck("daemon")).get();
            if (reply.type() == IpcMessageType.ERROR) {
                return "error reply " + reply.payloadString("code");
            }
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return cause.getMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "interrupted";
        }
    }

    private void checkSafely() {
        try {
            checkOnce();
        } catch (RuntimeException e) {
            System.err.println("Tray health cycle failed: " + e.getMessage());
        }
    }
}

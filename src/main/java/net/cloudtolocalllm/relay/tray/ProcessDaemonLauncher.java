package net.cloudtolocalllm.relay.tray;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the daemon as a child process that shares the tray's console.
 */
public final class ProcessDaemonLauncher implements DaemonLauncher {
    private static final long STOP_TIMEOUT_SECONDS = 5;

    private final List<String> command;
    private Process process;

    public ProcessDaemonLauncher(List<String> command) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("daemon command is required");
        }
        this.command = List.copyOf(command);
    }

    @Override
    public synchronized void launch() throws IOException {
        stop();
        process = new ProcessBuilder(command).inheritIO().start();
        System.out.println("Launched daemon pid=" + process.pid());
    }

    @Override
    public synchronized void stop() {
        Process current = process;
        process = null;
        if (current == null || !current.isAlive()) {
            return;
        }
        current.destroy();
        try {
            if (!current.waitFor(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                current.destroyForcibly();
            }
        } catch (InterruptedException e) {
            current.destroyForcibly();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public synchronized boolean isRunning() {
        return process != null && process.isAlive();
    }
}

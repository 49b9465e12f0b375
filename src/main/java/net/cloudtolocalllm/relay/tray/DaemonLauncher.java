package net.cloudtolocalllm.relay.tray;

import java.io.IOException;

public interface DaemonLauncher {
    /**
     * Start the daemon, stopping a previous instance first.
     */
    void launch() throws IOException;

    void stop();

    boolean isRunning();
}

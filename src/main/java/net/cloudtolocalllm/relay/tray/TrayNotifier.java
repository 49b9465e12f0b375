package net.cloudtolocalllm.relay.tray;

/**
 * What the tray shows the user.
 */
public interface TrayNotifier {
    void statusChanged(String route, String quality, String status);

    void daemonRestarted(int attempt);

    /**
     * The daemon stayed down after every allowed restart.
     */
    void persistentFailure(String reason);
}

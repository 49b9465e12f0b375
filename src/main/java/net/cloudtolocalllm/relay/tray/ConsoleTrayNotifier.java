package net.cloudtolocalllm.relay.tray;

/**
 * Notifier for headless installs: renders notifications as log lines.
 */
public final class ConsoleTrayNotifier implements TrayNotifier {
    public static final ConsoleTrayNotifier INSTANCE = new ConsoleTrayNotifier();

    private ConsoleTrayNotifier() {
    }

    @Override
    public void statusChanged(String route, String quality, String status) {
        System.out.println("tray_status route=" + route + " quality=" + quality + " status=" + status);
    }

    @Override
    public void daemonRestarted(int attempt) {
        System.out.println("tray_event type=daemon_restarted attempt=" + attempt);
    }

    @Override
    public void persistentFailure(String reason) {
        System.err.println("tray_event type=daemon_failed reason=\"" + reason + "\"");
    }
}

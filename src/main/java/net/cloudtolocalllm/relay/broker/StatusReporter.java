package net.cloudtolocalllm.relay.broker;

import java.util.Objects;

import net.cloudtolocalllm.relay.health.QualityScore;
import net.cloudtolocalllm.relay.ipc.IpcBroadcaster;
import net.cloudtolocalllm.relay.ipc.IpcMessages;

/**
 * Publishes every route transition to connected IPC peers as a {@code status_report}.
 */
public final class StatusReporter implements RouteEventListener {
    private final IpcBroadcaster broadcaster;

    public StatusReporter(IpcBroadcaster broadcaster) {
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
    }

    @Override
    public void onRouteChange(RouteEvent event) {
        String route = event.activeKind() == null ? "none" : event.activeKind().wireName();
        broadcaster.broadcast(IpcMessages.statusReport(route, event.quality().wireName(), statusOf(event)));
    }

    static String statusOf(RouteEvent event) {
        if (event.status() == RouteStatus.ALL_UNAVAILABLE || event.activeKind() == null) {
            return IpcMessages.STATUS_DOWN;
        }
        return event.quality().isAtLeast(QualityScore.GOOD) ? IpcMessages.STATUS_OK : IpcMessages.STATUS_DEGRADED;
    }
}

package net.cloudtolocalllm.relay.tray;

import java.util.Objects;

import net.cloudtolocalllm.relay.ipc.IpcMessage;
import net.cloudtolocalllm.relay.ipc.IpcMessageHandler;
import net.cloudtolocalllm.relay.ipc.IpcMessages;
import net.cloudtolocalllm.relay.ipc.IpcSession;

/**
 * Inbound messages on the tray's connections, from the daemon and from the chat client.
 */
public final class TrayIpcHandler implements IpcMessageHandler {
    static final String SERVICE_NAME = "tray";

    private final TrayNotifier notifier;

    public TrayIpcHandler(TrayNotifier notifier) {
        this.notifier = Objects.requireNonNull(notifier, "notifier");
    }

    @Override
    public IpcMessage handle(IpcSession session, IpcMessage message) {
        switch (message.type()) {
            case STATUS_REPORT:
                notifier.statusChanged(
                        message.payloadString("route"),
                        message.payloadString("quality"),
                        message.payloadString("status"));
                return null;
            case HEALTH_CHECK:
                return IpcMessages.healthReply(message, SERVICE_NAME, IpcMessages.STATUS_OK);
            default:
                return IpcMessages.error(message, "UNSUPPORTED", "the tray does not handle "
                        + message.type().wireName());
        }
    }
}

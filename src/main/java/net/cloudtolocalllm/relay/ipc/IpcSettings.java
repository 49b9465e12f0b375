package net.cloudtolocalllm.relay.ipc;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.cloudtolocalllm.relay.config.RelayConfig;

@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class IpcSettings {
    public static final IpcSettings DEFAULT = new IpcSettings(
            Duration.ofSeconds(5),
            List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(5)),
            1024 * 1024);

    private final Duration ackTimeout;
    /**
     * Reconnect delays; the last entry repeats.
     */
    private final List<Duration> reconnectBackoff;
    private final int maxFrameBytes;

    public static IpcSettings fromConfig(RelayConfig.IpcConfig ipc) {
        if (ipc == null) {
            return DEFAULT;
        }
        List<Duration> backoff = DEFAULT.reconnectBackoff;
        if (ipc.reconnectBackoffMs != null && !ipc.reconnectBackoffMs.isEmpty()) {
            backoff = new ArrayList<>();
            for (Integer millis : ipc.reconnectBackoffMs) {
                backoff.add(Duration.ofMillis(millis));
            }
            backoff = List.copyOf(backoff);
        }
        return new IpcSettings(
                ipc.ackTimeoutMs == null ? DEFAULT.ackTimeout : Duration.ofMillis(ipc.ackTimeoutMs),
                backoff,
                ipc.maxFrameBytes == null ? DEFAULT.maxFrameBytes : ipc.maxFrameBytes
        );
    }

    Duration reconnectDelay(int attempt) {
        return reconnectBackoff.get(Math.min(attempt, reconnectBackoff.size() - 1));
    }
}

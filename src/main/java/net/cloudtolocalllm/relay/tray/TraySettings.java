package net.cloudtolocalllm.relay.tray;

import java.time.Duration;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.cloudtolocalllm.relay.config.RelayConfig;

@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class TraySettings {
    public static final TraySettings DEFAULT = new TraySettings(Duration.ofSeconds(10), 3);

    private final Duration healthInterval;
    private final int maxRestarts;

    public static TraySettings fromConfig(RelayConfig.TrayConfig tray) {
        if (tray == null) {
            return DEFAULT;
        }
        return new TraySettings(
                tray.healthIntervalSeconds == null
                        ? DEFAULT.healthInterval : Duration.ofSeconds(tray.healthIntervalSeconds),
                tray.maxRestarts == null ? DEFAULT.maxRestarts : tray.maxRestarts
        );
    }
}

package net.cloudtolocalllm.relay.config;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import net.cloudtolocalllm.relay.util.ListenAddress;

/**
 * Collects non-fatal configuration warnings, such as IPC listeners reachable off-host.
 */
public final class ConfigWarnings {
    private ConfigWarnings() {
    }

    public static List<String> collect(RelayConfig config, Path configPath) {
        List<String> warnings = new ArrayList<>();
        if (config == null) {
            return warnings;
        }
        if (config.ipc != null) {
            warnIfNotLoopback(warnings, "ipc.chatListen", config.ipc.chatListen,
                    "desktop IPC carries unauthenticated control messages");
            warnIfNotLoopback(warnings, "ipc.trayListen", config.ipc.trayListen,
                    "desktop IPC carries unauthenticated control messages");
        }
        if (config.gateway != null && Boolean.TRUE.equals(config.gateway.enabled)) {
            warnIfNotLoopback(warnings, "gateway.listen", config.gateway.listen,
                    "the gateway does not terminate TLS; put it behind a TLS proxy");
            String backend = config.supervisor == null ? null : config.supervisor.backend;
            if (backend == null || "inprocess".equalsIgnoreCase(backend.trim())) {
                warnings.add("gateway is enabled with the inprocess supervisor backend; "
                        + "user streams share one process without container isolation");
            }
        }
        if (config.endpoints != null) {
            for (RelayConfig.EndpointConfig endpoint : config.endpoints) {
                if (endpoint == null || endpoint.address == null || endpoint.token == null) {
                    continue;
                }
                if (endpoint.address.trim().toLowerCase().startsWith("http://")
                        && !"local".equalsIgnoreCase(endpoint.kind)) {
                    warnings.add("endpoint " + endpoint.kind + " sends its probe token over plain http");
                }
            }
        }
        if (configPath != null && config.tray != null && config.tray.daemonCommand == null) {
            warnings.add("tray.daemonCommand is not set; the tray cannot restart the daemon");
        }
        return warnings;
    }

    private static void warnIfNotLoopback(List<String> warnings, String label, String value, String reason) {
        if (value == null || value.isBlank()) {
            return;
        }
        ListenAddress address;
        try {
            address = ListenAddress.parse(value);
        } catch (IllegalArgumentException e) {
            return;
        }
        if (!isLoopback(address.host())) {
            warnings.add(label + " binds " + address.host() + "; " + reason);
        }
    }

    private static boolean isLoopback(String host) {
        if ("localhost".equalsIgnoreCase(host)) {
            return true;
        }
        try {
            return InetAddress.getByName(host).isLoopbackAddress();
        } catch (UnknownHostException e) {
            return false;
        }
    }
}

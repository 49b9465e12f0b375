package net.cloudtolocalllm.relay.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import net.cloudtolocalllm.relay.util.ListenAddress;

public final class ConfigValidator {
    private static final int MAX_CLOCK_SKEW_SECONDS = 60;
    private static final int MAX_PROVISION_RETRIES = 3;

    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException listing every violation.
     */
    public static void validate(RelayConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        validateEndpoints(config, errors);
        validateHealth(config, errors);
        validateBroker(config, errors);
        validateAuth(config, errors);
        validateSupervisor(config, errors);
        validateIpc(config, errors);
        validateGateway(config, errors);
        validateTray(config, errors);

        throwIfErrors(errors);
    }

    private static void validateEndpoints(RelayConfig config, List<String> errors) {
        if (config.endpoints == null || config.endpoints.isEmpty()) {
            errors.add("endpoints must list at least one endpoint");
            return;
        }
        Set<String> kinds = new HashSet<>();
        int enabled = 0;
        for (int i = 0; i < config.endpoints.size(); i++) {
            RelayConfig.EndpointConfig endpoint = config.endpoints.get(i);
            String prefix = "endpoints[" + i + "]";
            if (endpoint == null) {
                errors.add(prefix + " is empty");
                continue;
            }
            if (!isOneOf(endpoint.kind, "local", "cloud", "tunnel")) {
                errors.add(prefix + ".kind must be one of: local, cloud, tunnel");
            } else if (!kinds.add(endpoint.kind.trim().toLowerCase())) {
                errors.add(prefix + ".kind is duplicated: " + endpoint.kind);
            }
            requireHttpUrl(errors, endpoint.address, prefix + ".address");
            if (!isBlank(endpoint.healthPath) && !endpoint.healthPath.startsWith("/")) {
                errors.add(prefix + ".healthPath must start with /");
            }
            if (!Boolean.FALSE.equals(endpoint.enabled)) {
                enabled++;
            }
        }
        if (enabled == 0) {
            errors.add("endpoints must enable at least one endpoint");
        }
    }

    private static void validateHealth(RelayConfig config, List<String> errors) {
        RelayConfig.HealthConfig health = config.health;
        if (health == null) {
            return;
        }
        requirePositive(errors, health.probeTimeoutMs, "health.probeTimeoutMs");
        requirePositive(errors, health.activeIntervalSeconds, "health.activeIntervalSeconds");
        requirePositive(errors, health.unavailableIntervalSeconds, "health.unavailableIntervalSeconds");
        requirePositive(errors, health.excellentLatencyMs, "health.excellentLatencyMs");
        requirePositive(errors, health.goodLatencyMs, "health.goodLatencyMs");
        requirePositive(errors, health.unavailableAfterFailures, "health.unavailableAfterFailures");
        if (health.activeIntervalSeconds != null && health.unavailableIntervalSeconds != null
                && health.unavailableIntervalSeconds < health.activeIntervalSeconds) {
            errors.add("health.unavailableIntervalSeconds must be >= health.activeIntervalSeconds");
        }
        if (health.excellentLatencyMs != null && health.goodLatencyMs != null
                && health.excellentLatencyMs >= health.goodLatencyMs) {
            errors.add("health.excellentLatencyMs must be below health.goodLatencyMs");
        }
        if (health.unavailableAfterFailures != null && health.unavailableAfterFailures < 3) {
            errors.add("health.unavailableAfterFailures must be at least 3");
        }
    }

    private static void validateBroker(RelayConfig config, List<String> errors) {
        RelayConfig.BrokerConfig broker = config.broker;
        if (broker == null) {
            return;
        }
        requirePositive(errors, broker.debounceProbes, "broker.debounceProbes");
        requirePositive(errors, broker.sessionIdleMinutes, "broker.sessionIdleMinutes");
        if (broker.hysteresisTiers != null && (broker.hysteresisTiers < 0 || broker.hysteresisTiers > 3)) {
            errors.add("broker.hysteresisTiers must be between 0 and 3");
        }
    }

    private static void validateAuth(RelayConfig config, List<String> errors) {
        RelayConfig.AuthConfig auth = config.auth;
        if (auth == null) {
            errors.add("auth section is required");
            return;
        }
        requireNonBlank(errors, auth.audience, "auth.audience");
        requireHttpUrl(errors, auth.jwksUri, "auth.jwksUri");
        requirePositive(errors, auth.keyTtlSeconds, "auth.keyTtlSeconds");
        requirePositive(errors, auth.refreshCooldownSeconds, "auth.refreshCooldownSeconds");
        if (auth.clockSkewSeconds != null
                && (auth.clockSkewSeconds < 0 || auth.clockSkewSeconds > MAX_CLOCK_SKEW_SECONDS)) {
            errors.add("auth.clockSkewSeconds must be between 0 and " + MAX_CLOCK_SKEW_SECONDS);
        }
        if (auth.requiredScopes != null) {
            for (String scope : auth.requiredScopes) {
                if (isBlank(scope)) {
                    errors.add("auth.requiredScopes must not contain blank entries");
                    break;
                }
            }
        }
    }

    private static void validateSupervisor(RelayConfig config, List<String> errors) {
        RelayConfig.SupervisorConfig supervisor = config.supervisor;
        if (supervisor == null) {
            return;
        }
        if (!isBlank(supervisor.backend) && !isOneOf(supervisor.backend, "docker", "inprocess")) {
            errors.add("supervisor.backend must be one of: docker, inprocess");
        }
        requirePositive(errors, supervisor.idleTimeoutSeconds, "supervisor.idleTimeoutSeconds");
        requirePositive(errors, supervisor.reaperIntervalSeconds, "supervisor.reaperIntervalSeconds");
        requirePositive(errors, supervisor.readyTimeoutMs, "supervisor.readyTimeoutMs");
        requirePositive(errors, supervisor.maxInstances, "supervisor.maxInstances");
        if (supervisor.drainGraceSeconds != null && supervisor.drainGraceSeconds < 0) {
            errors.add("supervisor.drainGraceSeconds must be >= 0");
        }
        if (supervisor.provisionRetries != null
                && (supervisor.provisionRetries < 0 || supervisor.provisionRetries > MAX_PROVISION_RETRIES)) {
            errors.add("supervisor.provisionRetries must be between 0 and " + MAX_PROVISION_RETRIES);
        }
        if (supervisor.provisionBackoffMs != null) {
            for (Integer backoff : supervisor.provisionBackoffMs) {
                if (backoff == null || backoff < 0) {
                    errors.add("supervisor.provisionBackoffMs entries must be >= 0");
                    break;
                }
            }
        }
        boolean docker = "docker".equalsIgnoreCase(trim(supervisor.backend));
        RelayConfig.DockerConfig dockerConfig = supervisor.docker;
        if (docker && dockerConfig == null) {
            errors.add("supervisor.docker is required when supervisor.backend is docker");
        }
        if (dockerConfig != null) {
            if (docker) {
                requireNonBlank(errors, dockerConfig.image, "supervisor.docker.image");
            }
            requirePositive(errors, dockerConfig.memoryMb, "supervisor.docker.memoryMb");
            requirePort(errors, dockerConfig.proxyPort, "supervisor.docker.proxyPort");
            requirePositive(errors, dockerConfig.commandTimeoutMs, "supervisor.docker.commandTimeoutMs");
            if (dockerConfig.cpus != null && dockerConfig.cpus <= 0) {
                errors.add("supervisor.docker.cpus must be > 0");
            }
            if (dockerConfig.stopTimeoutSeconds != null && dockerConfig.stopTimeoutSeconds < 0) {
                errors.add("supervisor.docker.stopTimeoutSeconds must be >= 0");
            }
        }
    }

    private static void validateIpc(RelayConfig config, List<String> errors) {
        RelayConfig.IpcConfig ipc = config.ipc;
        if (ipc == null) {
            return;
        }
        requireListen(errors, ipc.chatListen, "ipc.chatListen");
        requireListen(errors, ipc.trayListen, "ipc.trayListen");
        requirePositive(errors, ipc.ackTimeoutMs, "ipc.ackTimeoutMs");
        requirePositive(errors, ipc.maxFrameBytes, "ipc.maxFrameBytes");
        if (ipc.reconnectBackoffMs != null) {
            for (Integer backoff : ipc.reconnectBackoffMs) {
                if (backoff == null || backoff <= 0) {
                    errors.add("ipc.reconnectBackoffMs entries must be > 0");
                    break;
                }
            }
        }
    }

    private static void validateGateway(RelayConfig config, List<String> errors) {
        RelayConfig.GatewayConfig gateway = config.gateway;
        if (gateway == null || !Boolean.TRUE.equals(gateway.enabled)) {
            return;
        }
        if (isBlank(gateway.listen)) {
            errors.add("gateway.listen is required when gateway.enabled is true");
        } else {
            requireListen(errors, gateway.listen, "gateway.listen");
        }
        requirePositive(errors, gateway.maxRequestBytes, "gateway.maxRequestBytes");
        requirePositive(errors, gateway.workerThreads, "gateway.workerThreads");
    }

    private static void validateTray(RelayConfig config, List<String> errors) {
        RelayConfig.TrayConfig tray = config.tray;
        if (tray == null) {
            return;
        }
        requireListen(errors, tray.daemonAddress, "tray.daemonAddress");
        requireListen(errors, tray.chatAddress, "tray.chatAddress");
        requirePositive(errors, tray.healthIntervalSeconds, "tray.healthIntervalSeconds");
        if (tray.maxRestarts != null && (tray.maxRestarts < 0 || tray.maxRestarts > 3)) {
            errors.add("tray.maxRestarts must be between 0 and 3");
        }
        if (tray.daemonCommand != null && tray.daemonCommand.isEmpty()) {
            errors.add("tray.daemonCommand must not be empty when set");
        }
    }

    private static void requireNonBlank(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
        }
    }

    private static void requirePort(List<String> errors, Integer value, String field) {
        if (value != null && (value < 1 || value > 65535)) {
            errors.add(field + " must be between 1 and 65535");
        }
    }

    private static void requirePositive(List<String> errors, Integer value, String field) {
        if (value != null && value <= 0) {
            errors.add(field + " must be > 0");
        }
    }

    private static void requireListen(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            return;
        }
        try {
            ListenAddress.parse(value);
        } catch (IllegalArgumentException e) {
            errors.add(field + ": " + e.getMessage());
        }
    }

    private static void requireHttpUrl(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
            return;
        }
        try {
            URI uri = new URI(value.trim());
            String scheme = uri.getScheme();
            if (scheme == null || !isOneOf(scheme, "http", "https") || uri.getHost() == null) {
                errors.add(field + " must be an http(s) URL: " + value);
            }
        } catch (URISyntaxException e) {
            errors.add(field + " is not a valid URL: " + value);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }

    private static boolean isOneOf(String value, String... options) {
        if (value == null) {
            return false;
        }
        for (String option : options) {
            if (option.equalsIgnoreCase(value.trim())) {
                return true;
            }
        }
        return false;
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            StringBuilder builder = new StringBuilder("Invalid config:\n");
            for (String error : errors) {
                builder.append("- ").append(error).append('\n');
            }
            throw new ConfigException(builder.toString());
        }
    }
}

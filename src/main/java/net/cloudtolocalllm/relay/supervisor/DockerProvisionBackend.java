package net.cloudtolocalllm.relay.supervisor;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import net.cloudtolocalllm.relay.http.HttpTarget;
import net.cloudtolocalllm.relay.util.Sleeper;

/**
 * Runs each proxy as an ephemeral container on its own bridge network, driven through the docker CLI.
 * <p>
 * Containers are started with {@code --rm}, so stopping one also removes it.
 */
public final class DockerProvisionBackend implements ProvisionBackend {
    private static final Duration READY_POLL_INTERVAL = Duration.ofMillis(250);
    private static final String LABEL_PREFIX = "cloudtolocalllm.";

    private final DockerSettings settings;
    private final CommandRunner runner;
    private final Sleeper sleeper;

    public DockerProvisionBackend(DockerSettings settings, CommandRunner runner, Sleeper sleeper) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public ProvisionedResources provision(ProvisionRequest request, Duration readyTimeout) throws ProvisionException {
        ensureNetwork(request);
        String container = request.instanceId();
        CommandResult run = exec(runCommand(request), ProvisionFailure.ENGINE_ERROR);
        if (!run.isSuccess()) {
            throw new ProvisionException(classifyRunFailure(run.output()),
                    "docker run failed for " + container + ": " + run.output());
        }
        if (settings.sharedNetwork() != null) {
            CommandResult connect = exec(List.of(settings.binary(), "network", "connect",
                    settings.sharedNetwork(), container), ProvisionFailure.ENGINE_ERROR);
            if (!connect.isSuccess()) {
                removeQuietly(container);
                throw new ProvisionException(ProvisionFailure.ENGINE_ERROR,
                        "failed to attach " + container + " to " + settings.sharedNetwork() + ": " + connect.output());
            }
        }
        awaitRunning(container, readyTimeout);
        return new ProvisionedResources(container,
                HttpTarget.parse("http://" + container + ":" + settings.proxyPort()));
    }

    @Override
    public void terminate(ProxyInstance instance) throws ProvisionException {
        String container = instance.instanceId();
        CommandResult stop = exec(List.of(settings.binary(), "stop", "-t",
                Integer.toString(settings.stopTimeoutSeconds()), container), ProvisionFailure.ENGINE_ERROR);
        if (!stop.isSuccess() && !isNoSuchObject(stop.output())) {
            throw new ProvisionException(ProvisionFailure.ENGINE_ERROR,
                    "docker stop failed for " + container + ": " + stop.output());
        }
        CommandResult removeNetwork = exec(List.of(settings.binary(), "network", "rm",
                instance.networkNamespace()), ProvisionFailure.ENGINE_ERROR);
        if (!removeNetwork.isSuccess() && !isNoSuchObject(removeNetwork.output())) {
            // another instance of the same user still uses the network; it is removed with that one
            System.err.println("Keeping network " + instance.networkNamespace() + ": " + removeNetwork.output());
        }
    }

    @Override
    public boolean healthCheck(ProxyInstance instance) {
        try {
            return isRunning(instance.instanceId());
        } catch (ProvisionException e) {
            System.err.println("Health check failed for " + instance.instanceId() + ": " + e.getMessage());
            return false;
        }
    }

    List<String> runCommand(ProvisionRequest request) {
        List<String> command = new ArrayList<>();
        command.add(settings.binary());
        command.add("run");
        command.add("-d");
        command.add("--rm");
        command.add("--name");
        command.add(request.instanceId());
        command.add("--network");
        command.add(request.networkNamespace());
        command.add("--memory");
        command.add(settings.memoryMb() + "m");
        command.add("--cpus");
        command.add(String.format(Locale.ROOT, "%.2f", settings.cpus()));
        command.add("--restart");
        command.add("no");
        command.add("--label");
        command.add(LABEL_PREFIX + "type=streaming-proxy");
        command.add("--label");
        command.add(LABEL_PREFIX + "user-hash=" + request.userHash());
        command.add("-e");
        command.add("USER_ID=" + request.ownerUserId());
        command.add("-e");
        command.add("PROXY_ID=" + request.instanceId());
        command.add("-e");
        command.add("PORT=" + settings.proxyPort());
        command.add(settings.image());
        return command;
    }

    private void ensureNetwork(ProvisionRequest request) throws ProvisionException {
        String network = request.networkNamespace();
        CommandResult inspect = exec(List.of(settings.binary(), "network", "inspect", network),
                ProvisionFailure.ENGINE_ERROR);
        if (inspect.isSuccess()) {
            return;
        }
        CommandResult create = exec(List.of(settings.binary(), "network", "create",
                "--driver", "bridge",
                "--label", LABEL_PREFIX + "type=user-network",
                "--label", LABEL_PREFIX + "user-hash=" + request.userHash(),
                network), ProvisionFailure.ENGINE_ERROR);
        if (!create.isSuccess()) {
            throw new ProvisionException(ProvisionFailure.ENGINE_ERROR,
                    "failed to create network " + network + ": " + create.output());
        }
    }

    private void awaitRunning(String container, Duration readyTimeout) throws ProvisionException {
        long deadline = System.nanoTime() + readyTimeout.toNanos();
        while (true) {
            if (isRunning(container)) {
                return;
            }
            if (System.nanoTime() >= deadline) {
                removeQuietly(container);
                throw new ProvisionException(ProvisionFailure.READY_TIMEOUT,
                        container + " not running after " + readyTimeout.toMillis() + "ms");
            }
            try {
                sleeper.sleep(READY_POLL_INTERVAL);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                removeQuietly(container);
                throw new ProvisionException(ProvisionFailure.READY_TIMEOUT, "interrupted waiting for " + container, e);
            }
        }
    }

    private boolean isRunning(String container) throws ProvisionException {
        CommandResult inspect = exec(List.of(settings.binary(), "inspect", "-f", "{{.State.Running}}", container),
                ProvisionFailure.ENGINE_ERROR);
        return inspect.isSuccess() && "true".equals(inspect.output().trim());
    }

    private void removeQuietly(String container) {
        try {
            CommandResult result = runner.run(List.of(settings.binary(), "rm", "-f", container), settings.commandTimeout());
            if (!result.isSuccess() && !isNoSuchObject(result.output())) {
                System.err.println("Failed to remove container " + container + ": " + result.output());
            }
        } catch (IOException e) {
            System.err.println("Failed to remove container " + container + ": " + e.getMessage());
        }
    }

    private CommandResult exec(List<String> command, ProvisionFailure failure) throws ProvisionException {
        try {
            return runner.run(command, settings.commandTimeout());
        } catch (IOException e) {
            throw new ProvisionException(failure, "failed to run " + String.join(" ", command.subList(0, 2))
                    + ": " + e.getMessage(), e);
        }
    }

    static ProvisionFailure classifyRunFailure(String output) {
        String lower = output == null ? "" : output.toLowerCase(Locale.ROOT);
        if (lower.contains("no space left") || lower.contains("cannot allocate memory")
                || lower.contains("insufficient") || lower.contains("resources")) {
            return ProvisionFailure.RESOURCE_EXHAUSTED;
        }
        return ProvisionFailure.ENGINE_ERROR;
    }

    private static boolean isNoSuchObject(String output) {
        String lower = output == null ? "" : output.toLowerCase(Locale.ROOT);
        return lower.contains("no such") || lower.contains("not found");
    }
}

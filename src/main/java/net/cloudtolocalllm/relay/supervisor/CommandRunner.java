package net.cloudtolocalllm.relay.supervisor;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external command to completion.
 */
@FunctionalInterface
public interface CommandRunner {
    /**
     * @throws IOException when the command cannot start or outlives {@code timeout}
     */
    CommandResult run(List<String> command, Duration timeout) throws IOException;
}

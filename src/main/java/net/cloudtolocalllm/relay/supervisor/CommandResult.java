package net.cloudtolocalllm.relay.supervisor;

import lombok.Value;
import lombok.experimental.Accessors;

@Value
@Accessors(fluent = true)
public class CommandResult {
    int exitCode;
    String output;

    public boolean isSuccess() {
        return exitCode == 0;
    }
}

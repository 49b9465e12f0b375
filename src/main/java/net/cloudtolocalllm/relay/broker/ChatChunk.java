package net.cloudtolocalllm.relay.broker;

import lombok.Value;
import lombok.experimental.Accessors;

@Value
@Accessors(fluent = true)
public class ChatChunk {
    String text;
    boolean done;
}

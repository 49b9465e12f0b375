package net.cloudtolocalllm.relay.util;

import java.time.Duration;

/**
 * Blocking pause between retry attempts, replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}

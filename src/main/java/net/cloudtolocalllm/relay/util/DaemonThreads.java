package net.cloudtolocalllm.relay.util;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread factory for background schedulers that must not keep the JVM alive.
 */
public final class DaemonThreads {
    private DaemonThreads() {
    }

    public static ThreadFactory named(String name) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            int index = counter.getAndIncrement();
            Thread thread = new Thread(runnable, index == 0 ? name : name + "-" + index);
            thread.setDaemon(true);
            return thread;
        };
    }
}

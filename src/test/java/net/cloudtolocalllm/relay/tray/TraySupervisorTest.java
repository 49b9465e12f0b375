package net.cloudtolocalllm.relay.tray;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import net.cloudtolocalllm.relay.ipc.IpcMessage;
import net.cloudtolocalllm.relay.ipc.IpcMessageType;
import net.cloudtolocalllm.relay.ipc.IpcMessages;
import net.cloudtolocalllm.relay.ipc.IpcRequester;
import net.cloudtolocalllm.relay.ipc.IpcTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TraySupervisorTest {
    private final FakeLauncher launcher = new FakeLauncher();
    private final RecordingNotifier notifier = new RecordingNotifier();
    private final ScriptedDaemon daemon = new ScriptedDaemon();
    private final List<IpcMessage> broadcasts = new ArrayList<>();
    private final TraySupervisor supervisor = new TraySupervisor(
            new TraySettings(Duration.ofHours(1), 3), launcher, daemon, message -> {
                broadcasts.add(message);
                return 1;
            }, notifier);

    @AfterEach
    void tearDown() {
        supervisor.close();
    }

    @Test
    void healthyDaemonIsLeftAlone() {
        assertTrue(supervisor.checkOnce());

        assertEquals(0, launcher.launches);
        assertEquals(0, supervisor.consecutiveRestarts());
    }

    @Test
    void restartsAreCappedAndReportedOnce() {
        daemon.healthy = false;

        for (int i = 0; i < 6; i++) {
            assertFalse(supervisor.checkOnce());
        }

        assertEquals(3, launcher.launches);
        assertEquals(List.of(1, 2, 3), notifier.restarts);
        assertEquals(1, notifier.failures.size());
        assertTrue(notifier.failures.get(0).contains("after 3 restarts"));
    }

    @Test
    void recoveryResetsTheRestartBudget() {
        daemon.healthy = false;
        supervisor.checkOnce();
        supervisor.checkOnce();

        daemon.healthy = true;
        assertTrue(supervisor.checkOnce());
        assertEquals(0, supervisor.consecutiveRestarts());

        daemon.healthy = false;
        supervisor.checkOnce();
        assertEquals(1, supervisor.consecutiveRestarts());
        assertEquals(3, launcher.launches);
    }

    @Test
    void errorReplyCountsAsUnhealthy() {
        daemon.errorReply = true;

        assertFalse(supervisor.checkOnce());
        assertEquals(1, launcher.launches);
    }

    @Test
    void windowControlGoesToChatClients() {
        assertEquals(1, supervisor.windowControl("show"));

        assertEquals(IpcMessageType.WINDOW_CONTROL, broadcasts.get(0).type());
        assertEquals("show", broadcasts.get(0).payloadString("action"));
    }

    @Test
    void startLaunchesAndStopStops() {
        supervisor.start();
        assertTrue(launcher.isRunning());

        supervisor.stop();
        assertFalse(launcher.isRunning());
    }

    private static final class ScriptedDaemon implements IpcRequester {
        private boolean healthy = true;
        private boolean errorReply;

        @Override
        public CompletableFuture<IpcMessage> request(IpcMessage message) {
            if (errorReply) {
                return CompletableFuture.completedFuture(IpcMessages.error(message, "HANDLER_ERROR", "boom"));
            }
            if (!healthy) {
                return CompletableFuture.failedFuture(new IpcTimeoutException("no response"));
            }
            return CompletableFuture.completedFuture(IpcMessages.healthReply(message, "daemon", IpcMessages.STATUS_OK));
        }
    }

    private static final class FakeLauncher implements DaemonLauncher {
        private int launches;
        private boolean running;

        @Override
        public void launch() throws IOException {
            launches++;
            running = true;
        }

        @Override
        public void stop() {
            running = false;
        }

        @Override
        public boolean isRunning() {
            return running;
        }
    }

    private static final class RecordingNotifier implements TrayNotifier {
        private final List<Integer> restarts = new ArrayList<>();
        private final List<String> failures = new ArrayList<>();

        @Override
        public void statusChanged(String route, String quality, String status) {
        }

        @Override
        public void daemonRestarted(int attempt) {
            restarts.add(attempt);
        }

        @Override
        public void persistentFailure(String reason) {
            failures.add(reason);
        }
    }
}

package net.cloudtolocalllm.relay;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Paths;

import org.junit.jupiter.api.Test;

class RelayMainTest {
    @Test
    void defaultsToDaemonRole() {
        RelayMain.CliOptions options = RelayMain.parseArgs(new String[0]);

        assertEquals(RelayMain.Role.DAEMON, options.role());
        assertEquals(Paths.get("config/relay.yaml"), options.configPath());
        assertFalse(options.dryRun());
        assertFalse(options.printEffectiveConfig());
    }

    @Test
    void parsesTrayRoleAndFlags() {
        RelayMain.CliOptions options = RelayMain.parseArgs(
                new String[] {"tray", "-c", "/etc/ctl/relay.yaml", "--dry-run", "--print-effective-config"});

        assertEquals(RelayMain.Role.TRAY, options.role());
        assertEquals(Paths.get("/etc/ctl/relay.yaml"), options.configPath());
        assertTrue(options.dryRun());
        assertTrue(options.printEffectiveConfig());
    }

    @Test
    void danglingConfigFlagKeepsDefault() {
        RelayMain.CliOptions options = RelayMain.parseArgs(new String[] {"--config"});

        assertEquals(Paths.get("config/relay.yaml"), options.configPath());
    }

    @Test
    void nullArgsAreAccepted() {
        assertEquals(RelayMain.Role.DAEMON, RelayMain.parseArgs(null).role());
    }
}

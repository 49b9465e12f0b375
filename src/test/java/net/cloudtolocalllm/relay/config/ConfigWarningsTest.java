package net.cloudtolocalllm.relay.config;

import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;

class ConfigWarningsTest {
    @Test
    void warnsWhenIpcBindsOffHost() {
        RelayConfig config = ConfigValidatorTest.minimal();
        config.ipc = new RelayConfig.IpcConfig();
        config.ipc.chatListen = "0.0.0.0:8181";

        List<String> warnings = ConfigWarnings.collect(config, Path.of("relay.yaml"));

        assertTrue(warnings.stream().anyMatch(warning -> warning.startsWith("ipc.chatListen binds 0.0.0.0")));
    }

    @Test
    void loopbackIpcIsQuiet() {
        RelayConfig config = ConfigValidatorTest.minimal();
        config.ipc = new RelayConfig.IpcConfig();
        config.ipc.chatListen = "127.0.0.1:8181";
        config.ipc.trayListen = "localhost:8184";

        assertTrue(ConfigWarnings.collect(config, Path.of("relay.yaml")).isEmpty());
    }
}

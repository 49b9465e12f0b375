package net.cloudtolocalllm.relay;

import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;

import net.cloudtolocalllm.relay.config.ConfigException;
import net.cloudtolocalllm.relay.config.ConfigLoader;
import net.cloudtolocalllm.relay.config.ConfigPrinter;
import net.cloudtolocalllm.relay.config.ConfigWarnings;
import net.cloudtolocalllm.relay.config.RelayConfig;
import net.cloudtolocalllm.relay.daemon.RelayDaemon;
import net.cloudtolocalllm.relay.ipc.IpcClient;
import net.cloudtolocalllm.relay.ipc.IpcServer;
import net.cloudtolocalllm.relay.ipc.IpcSettings;
import net.cloudtolocalllm.relay.tray.ConsoleTrayNotifier;
import net.cloudtolocalllm.relay.tray.ProcessDaemonLauncher;
import net.cloudtolocalllm.relay.tray.TrayIpcHandler;
import net.cloudtolocalllm.relay.tray.TraySettings;
import net.cloudtolocalllm.relay.tray.TraySupervisor;
import net.cloudtolocalllm.relay.util.ListenAddress;

/**
 * Standalone entry point: {@code daemon} (default) runs the relay, {@code tray} supervises it.
 */
public final class RelayMain {
    private static final String DEFAULT_CONFIG = "config/relay.yaml";
    private static final int DEFAULT_DAEMON_PORT = 8184;
    private static final int DEFAULT_CHAT_PORT = 8183;

    private RelayMain() {
    }

    public static void main(String[] args) {
        CliOptions options = parseArgs(args);
        Path configPath = options.configPath;
        RelayConfig config = ConfigLoader.load(configPath);
        emitWarnings(config, configPath);
        if (options.printEffectiveConfig) {
            System.out.println(ConfigPrinter.toYaml(config));
            return;
        }
        if (options.dryRun) {
            System.out.println("Config OK (--dry-run).");
            return;
        }
        if (options.role == Role.TRAY) {
            runTray(config);
        } else {
            runDaemon(config);
        }
    }

    private static void runDaemon(RelayConfig config) {
        CountDownLatch latch = new CountDownLatch(1);
        RelayDaemon daemon = new RelayDaemon(config, Clock.systemUTC(), latch::countDown);
        daemon.start();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            daemon.stop();
            latch.countDown();
        }));
        await(latch);
        daemon.stop();
    }

    private static void runTray(RelayConfig config) {
        RelayConfig.TrayConfig tray = config.tray;
        if (tray == null || tray.daemonCommand == null) {
            throw new ConfigException("tray.daemonCommand is required for the tray role");
        }
        IpcSettings ipcSettings = IpcSettings.fromConfig(config.ipc);
        TrayIpcHandler handler = new TrayIpcHandler(ConsoleTrayNotifier.INSTANCE);
        IpcClient daemonClient = new IpcClient("daemon",
                address(tray.daemonAddress, DEFAULT_DAEMON_PORT), ipcSettings, handler,
                (peer, state) -> System.out.println("IPC peer " + peer + " is " + state));
        IpcServer chatServer = new IpcServer("tray-chat",
                address(tray.chatAddress, DEFAULT_CHAT_PORT), ipcSettings, handler);
        TraySupervisor supervisor = new TraySupervisor(TraySettings.fromConfig(tray),
                new ProcessDaemonLauncher(tray.daemonCommand), daemonClient, chatServer,
                ConsoleTrayNotifier.INSTANCE);
        chatServer.start();
        daemonClient.start();
        supervisor.start();

        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            supervisor.stop();
            daemonClient.stop();
            chatServer.stop();
            latch.countDown();
        }));
        await(latch);
    }

    private static InetSocketAddress address(String configured, int defaultPort) {
        ListenAddress address = configured == null || configured.isBlank()
                ? ListenAddress.loopback(defaultPort) : ListenAddress.parse(configured);
        return address.toSocketAddress();
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }

    static CliOptions parseArgs(String[] args) {
        Path configPath = Paths.get(DEFAULT_CONFIG);
        boolean dryRun = false;
        boolean printEffectiveConfig = false;
        Role role = Role.DAEMON;
        if (args == null) {
            return new CliOptions(role, configPath, dryRun, printEffectiveConfig);
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) || "-c".equals(arg)) {
                if (i + 1 < args.length) {
                    configPath = Paths.get(args[++i]);
                    continue;
                }
            }
            if ("--dry-run".equals(arg)) {
                dryRun = true;
                continue;
            }
            if ("--print-effective-config".equals(arg)) {
                printEffectiveConfig = true;
                continue;
            }
            if ("tray".equals(arg)) {
                role = Role.TRAY;
            } else if ("daemon".equals(arg)) {
                role = Role.DAEMON;
            }
        }
        return new CliOptions(role, configPath, dryRun, printEffectiveConfig);
    }

    private static void emitWarnings(RelayConfig config, Path configPath) {
        for (String warning : ConfigWarnings.collect(config, configPath)) {
            System.err.println("Config warning: " + warning);
        }
    }

    enum Role {
        DAEMON,
        TRAY
    }

    record CliOptions(Role role, Path configPath, boolean dryRun, boolean printEffectiveConfig) {
    }
}

package net.cloudtolocalllm.relay.daemon;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import net.cloudtolocalllm.relay.auth.AuthSettings;
import net.cloudtolocalllm.relay.auth.HttpJwksSource;
import net.cloudtolocalllm.relay.auth.JwksKeyCache;
import net.cloudtolocalllm.relay.auth.TokenValidator;
import net.cloudtolocalllm.relay.broker.ConnectionBroker;
import net.cloudtolocalllm.relay.broker.InferenceClient;
import net.cloudtolocalllm.relay.broker.RouteAuditLogger;
import net.cloudtolocalllm.relay.broker.RoutePolicy;
import net.cloudtolocalllm.relay.broker.StatusReporter;
import net.cloudtolocalllm.relay.broker.StreamDispatcher;
import net.cloudtolocalllm.relay.config.RelayConfig;
import net.cloudtolocalllm.relay.gateway.GatewayServer;
import net.cloudtolocalllm.relay.health.HealthMonitor;
import net.cloudtolocalllm.relay.health.HealthSettings;
import net.cloudtolocalllm.relay.health.HttpEndpointProbe;
import net.cloudtolocalllm.relay.http.HttpEndpointClient;
import net.cloudtolocalllm.relay.ipc.IpcBroadcaster;
import net.cloudtolocalllm.relay.ipc.IpcServer;
import net.cloudtolocalllm.relay.ipc.IpcSettings;
import net.cloudtolocalllm.relay.supervisor.DockerProvisionBackend;
import net.cloudtolocalllm.relay.supervisor.DockerSettings;
import net.cloudtolocalllm.relay.supervisor.InProcessProvisionBackend;
import net.cloudtolocalllm.relay.supervisor.ProcessCommandRunner;
import net.cloudtolocalllm.relay.supervisor.ProvisionBackend;
import net.cloudtolocalllm.relay.supervisor.ProxyAuditLogger;
import net.cloudtolocalllm.relay.supervisor.ProxySupervisor;
import net.cloudtolocalllm.relay.supervisor.SupervisorSettings;
import net.cloudtolocalllm.relay.util.DaemonThreads;
import net.cloudtolocalllm.relay.util.ListenAddress;
import net.cloudtolocalllm.relay.util.Sleeper;

/**
 * The long-running relay process: health monitoring, routing, per-user proxies, IPC and the gateway.
 */
public final class RelayDaemon implements AutoCloseable {
    private static final int DEFAULT_SESSION_IDLE_MINUTES = 10;
    private static final String DOCKER_BACKEND = "docker";
    private static final int DEFAULT_CHAT_PORT = 8181;
    private static final int DEFAULT_TRAY_PORT = 8184;

    private final RelayConfig config;
    private final Clock clock;
    private final HttpEndpointClient http;
    private final HealthMonitor monitor;
    private final ConnectionBroker broker;
    private final ProxySupervisor supervisor;
    private final StreamDispatcher dispatcher;
    private final TokenValidator validator;
    private final ExecutorService streamExecutor;
    private final ScheduledExecutorService housekeeping;
    private final IpcServer chatServer;
    private final IpcServer trayServer;
    private final GatewayServer gatewayServer;
    private final List<IpcBroadcaster> peers = new CopyOnWriteArrayList<>();
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final Runnable onShutdownRequest;

    /**
     * @param onShutdownRequest invoked when a peer asks the daemon to quit
     */
    public RelayDaemon(RelayConfig config, Clock clock, Runnable onShutdownRequest) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.onShutdownRequest = onShutdownRequest == null ? this::stop : onShutdownRequest;
        this.http = new HttpEndpointClient();
        HealthSettings healthSettings = HealthSettings.fromConfig(config);
        this.monitor = HealthMonitor.fromConfig(config, new HttpEndpointProbe(http), clock);

        AuthSettings authSettings = AuthSettings.fromConfig(config.auth);
        JwksKeyCache keys = new JwksKeyCache(
                new HttpJwksSource(http, config.auth.jwksUri, healthSettings.probeTimeoutMs()),
                authSettings.keyTtl(), authSettings.refreshCooldown(), clock);
        this.validator = new TokenValidator(keys, authSettings, clock);

        IpcBroadcaster fanOut = message -> {
            int sent = 0;
            for (IpcBroadcaster peer : peers) {
                sent += peer.broadcast(message);
            }
            return sent;
        };
        this.broker = new ConnectionBroker(monitor, RoutePolicy.fromConfig(config.broker),
                RouteAuditLogger.INSTANCE.andThen(new StatusReporter(fanOut)), clock);
        monitor.addListener(broker);

        SupervisorSettings supervisorSettings = SupervisorSettings.fromConfig(config.supervisor);
        this.supervisor = new ProxySupervisor(backendFor(config, supervisorSettings), supervisorSettings,
                ProxyAuditLogger.INSTANCE, clock);
        this.dispatcher = new StreamDispatcher(broker, supervisor,
                new InferenceClient(http, healthSettings.probeTimeoutMs()), Sleeper.SYSTEM, clock);

        this.streamExecutor = Executors.newCachedThreadPool(DaemonThreads.named("ctl-stream"));
        this.housekeeping = Executors.newSingleThreadScheduledExecutor(DaemonThreads.named("ctl-housekeeping"));
        DaemonIpcHandler handler = new DaemonIpcHandler(broker, monitor, validator, dispatcher,
                streamExecutor, this.onShutdownRequest);
        IpcSettings ipcSettings = IpcSettings.fromConfig(config.ipc);
        this.chatServer = new IpcServer("chat",
                listen(config.ipc == null ? null : config.ipc.chatListen, DEFAULT_CHAT_PORT), ipcSettings, handler);
        this.trayServer = new IpcServer("tray",
                listen(config.ipc == null ? null : config.ipc.trayListen, DEFAULT_TRAY_PORT), ipcSettings, handler);
        peers.add(chatServer);
        peers.add(trayServer);

        if (config.gateway != null && Boolean.TRUE.equals(config.gateway.enabled)) {
            this.gatewayServer = new GatewayServer(config.gateway, validator, broker, supervisor, dispatcher);
        } else {
            this.gatewayServer = null;
        }
    }

    public void start() {
        chatServer.start();
        trayServer.start();
        if (gatewayServer != null) {
            gatewayServer.start();
        }
        supervisor.start();
        monitor.start();
        Duration sessionIdle = Duration.ofMinutes(config.broker == null || config.broker.sessionIdleMinutes == null
                ? DEFAULT_SESSION_IDLE_MINUTES : config.broker.sessionIdleMinutes);
        housekeeping.scheduleAtFixedRate(() -> pruneSessionsSafely(sessionIdle), 1, 1, TimeUnit.MINUTES);
        System.out.println("Relay daemon started: endpoints=" + monitor.endpoints().size()
                + " backend=" + backendName(config) + " gateway=" + (gatewayServer != null));
    }

    /**
     * Stop every component, in reverse start order.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        housekeeping.shutdownNow();
        monitor.stop();
        if (gatewayServer != null) {
            gatewayServer.stop();
        }
        supervisor.shutdown();
        trayServer.stop();
        chatServer.stop();
        streamExecutor.shutdownNow();
        http.close();
        System.out.println("Relay daemon stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public ConnectionBroker broker() {
        return broker;
    }

    public ProxySupervisor supervisor() {
        return supervisor;
    }

    public HealthMonitor monitor() {
        return monitor;
    }

    private void pruneSessionsSafely(Duration sessionIdle) {
        try {
            int pruned = broker.pruneIdle(sessionIdle, userId -> supervisor.activeInstance(userId).isPresent());
            if (pruned > 0) {
                System.out.println("Pruned " + pruned + " idle route sessions");
            }
        } catch (RuntimeException e) {
            System.err.println("Session pruning failed: " + e.getMessage());
        }
    }

    private static InetSocketAddress listen(String configured, int defaultPort) {
        ListenAddress address = configured == null || configured.isBlank()
                ? ListenAddress.loopback(defaultPort) : ListenAddress.parse(configured);
        return address.toSocketAddress();
    }

    private static ProvisionBackend backendFor(RelayConfig config, SupervisorSettings settings) {
        if (DOCKER_BACKEND.equals(backendName(config))) {
            return new DockerProvisionBackend(DockerSettings.fromConfig(config.supervisor.docker),
                    new ProcessCommandRunner(), Sleeper.SYSTEM);
        }
        return new InProcessProvisionBackend(settings.maxInstances());
    }

    private static String backendName(RelayConfig config) {
        if (config.supervisor == null || config.supervisor.backend == null) {
            return "inprocess";
        }
        return config.supervisor.backend.trim().toLowerCase(Locale.ROOT);
    }
}

package net.cloudtolocalllm.relay.daemon;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import net.cloudtolocalllm.relay.auth.AuthSettings;
import net.cloudtolocalllm.relay.auth.JwksKeyCache;
import net.cloudtolocalllm.relay.auth.TokenValidator;
import net.cloudtolocalllm.relay.broker.ConnectionBroker;
import net.cloudtolocalllm.relay.broker.InferenceClient;
import net.cloudtolocalllm.relay.broker.RoutePolicy;
import net.cloudtolocalllm.relay.broker.StreamDispatcher;
import net.cloudtolocalllm.relay.health.ConnectionEndpoint;
import net.cloudtolocalllm.relay.health.EndpointKind;
import net.cloudtolocalllm.relay.health.HealthMonitor;
import net.cloudtolocalllm.relay.health.HealthSettings;
import net.cloudtolocalllm.relay.health.ProbeResult;
import net.cloudtolocalllm.relay.health.QualityScore;
import net.cloudtolocalllm.relay.http.HttpEndpointClient;
import net.cloudtolocalllm.relay.ipc.IpcClient;
import net.cloudtolocalllm.relay.ipc.IpcMessage;
import net.cloudtolocalllm.relay.ipc.IpcMessageType;
import net.cloudtolocalllm.relay.ipc.IpcMessages;
import net.cloudtolocalllm.relay.ipc.IpcServer;
import net.cloudtolocalllm.relay.ipc.IpcSession;
import net.cloudtolocalllm.relay.ipc.IpcSettings;
import net.cloudtolocalllm.relay.supervisor.InProcessProvisionBackend;
import net.cloudtolocalllm.relay.supervisor.ProxySupervisor;
import net.cloudtolocalllm.relay.supervisor.SupervisorSettings;
import net.cloudtolocalllm.relay.support.FakeUpstream;
import net.cloudtolocalllm.relay.support.MutableClock;
import net.cloudtolocalllm.relay.support.TestTokens;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DaemonIpcHandlerTest {
    private static final TestTokens SIGNER = new TestTokens("daemon-key");
    private static final IpcSettings SETTINGS = new IpcSettings(
            Duration.ofSeconds(2), List.of(Duration.ofMillis(100)), 64 * 1024);

    private final MutableClock clock = MutableClock.startingAt("2026-05-01T10:00:00Z");
    private final HttpEndpointClient http = new HttpEndpointClient();
    private final ExecutorService streams = Executors.newSingleThreadExecutor();
    private final List<IpcMessage> pushed = new CopyOnWriteArrayList<>();
    private final CountDownLatch shutdownRequested = new CountDownLatch(1);
    private volatile CountDownLatch jwksGate;
    private FakeUpstream upstream;
    private ProxySupervisor supervisor;
    private IpcServer server;
    private IpcClient client;

    @BeforeEach
    void setUp() throws Exception {
        upstream = FakeUpstream.start(
                "{\"message\":{\"content\":\"Hi\"},\"done\":false}",
                "{\"message\":{\"content\":\"!\"},\"done\":false}");
        HealthMonitor monitor = new HealthMonitor(
                List.of(new ConnectionEndpoint(EndpointKind.LOCAL_INFERENCE, upstream.target(), null, Map.of())),
                (endpoint, timeoutMs) -> CompletableFuture.completedFuture(ProbeResult.ok(5)),
                HealthSettings.DEFAULT, clock);
        monitor.recordResult(EndpointKind.LOCAL_INFERENCE, ProbeResult.ok(5));
        ConnectionBroker broker = new ConnectionBroker(monitor, RoutePolicy.DEFAULT, null, clock);
        supervisor = new ProxySupervisor(new InProcessProvisionBackend(2), new SupervisorSettings(
                Duration.ofMinutes(10), Duration.ofSeconds(60), Duration.ofSeconds(30), Duration.ofSeconds(30),
                List.of(), 2), null, clock);
        StreamDispatcher dispatcher = new StreamDispatcher(broker, supervisor, new InferenceClient(http, 2000),
                pause -> { }, clock);
        String jwks = TestTokens.jwks(SIGNER);
        TokenValidator validator = new TokenValidator(
                new JwksKeyCache(() -> {
                    CountDownLatch gate = jwksGate;
                    if (gate != null) {
                        try {
                            gate.await(5, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                    }
                    return jwks;
                }, Duration.ofMinutes(10), Duration.ofMinutes(1), clock),
                new AuthSettings(TestTokens.ISSUER, TestTokens.AUDIENCE, Duration.ofSeconds(60),
                        Duration.ofMinutes(10), Duration.ofMinutes(1), Set.of()),
                clock);
        DaemonIpcHandler handler = new DaemonIpcHandler(broker, monitor, validator, dispatcher, streams,
                shutdownRequested::countDown);

        server = new IpcServer("chat", new InetSocketAddress("127.0.0.1", 0), SETTINGS, handler);
        server.start();
        client = new IpcClient("daemon", server.localAddress(), SETTINGS, (session, message) -> {
            pushed.add(message);
            return null;
        }, null);
        client.start();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!client.isConnected() && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
    }

    @AfterEach
    void tearDown() {
        client.stop();
        server.stop();
        streams.shutdownNow();
        supervisor.shutdown();
        upstream.close();
        http.close();
    }

    @Test
    void healthStatusFollowsBestQuality() {
        assertEquals(IpcMessages.STATUS_OK, DaemonIpcHandler.healthStatus(QualityScore.EXCELLENT));
        assertEquals(IpcMessages.STATUS_OK, DaemonIpcHandler.healthStatus(QualityScore.GOOD));
        assertEquals(IpcMessages.STATUS_DEGRADED, DaemonIpcHandler.healthStatus(QualityScore.DEGRADED));
        assertEquals(IpcMessages.STATUS_DOWN, DaemonIpcHandler.healthStatus(QualityScore.UNAVAILABLE));
    }

    @Test
    void answersHealthChecks() throws Exception {
        IpcMessage reply = request(IpcMessages.healthCheck("daemon"));

        assertEquals(IpcMessageType.HEALTH_CHECK, reply.type());
        assertEquals(IpcMessages.STATUS_OK, reply.payloadString("status"));
    }

    @Test
    void anonymousStreamIsAckedThenChunked() throws Exception {
        IpcMessage request = IpcMessages.streamRequest("llama3.2", "hello", null);

        IpcMessage ack = request(request);

        assertEquals(IpcMessageType.ACK, ack.type());
        List<IpcMessage> chunks = awaitChunks(3);
        assertEquals("Hi", chunks.get(0).payloadString("text"));
        assertEquals("!", chunks.get(1).payloadString("text"));
        assertTrue(chunks.get(2).payloadBoolean("done"));
        for (IpcMessage chunk : chunks) {
            assertEquals(IpcMessageType.STREAM_CHUNK, chunk.type());
            assertEquals(request.id(), chunk.payloadString("request_id"));
        }
        assertEquals(1, upstream.requests().size());
    }

    @Test
    void finishedStreamsLeaveNoCloseHooks() throws Exception {
        for (int i = 0; i < 5; i++) {
            pushed.clear();
            assertEquals(IpcMessageType.ACK, request(IpcMessages.streamRequest("llama3.2", "hello", null)).type());
            awaitChunks(3);
        }

        assertEquals(1, server.sessions().size());
        IpcSession session = server.sessions().get(0);
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (session.closeHookCount() > 0 && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        assertEquals(0, session.closeHookCount());
        assertEquals(5, upstream.requests().size());
    }

    @Test
    void invalidTokenNeverFallsBackToLocal() throws Exception {
        IpcMessage reply = request(IpcMessages.streamRequest("llama3.2", "hello", "not-a-jwt"));

        assertEquals(IpcMessageType.ERROR, reply.type());
        assertEquals("MALFORMED_TOKEN", reply.payloadString("code"));
        Thread.sleep(100);
        assertTrue(upstream.requests().isEmpty());
        assertTrue(pushed.isEmpty());
    }

    @Test
    void slowKeyFetchDoesNotStallTheConnection() throws Exception {
        jwksGate = new CountDownLatch(1);
        String token = SIGNER.sign(TestTokens.claims("user-1", clock.instant()));
        CompletableFuture<IpcMessage> streamReply = client.request(IpcMessages.streamRequest("llama3.2", "hello", token));

        IpcMessage health = request(IpcMessages.healthCheck("daemon"));

        assertEquals(IpcMessageType.HEALTH_CHECK, health.type());
        assertFalse(streamReply.isDone());
        jwksGate.countDown();
        assertEquals(IpcMessageType.ACK, streamReply.get(5, TimeUnit.SECONDS).type());
    }

    @Test
    void streamWithoutModelIsBadRequest() throws Exception {
        IpcMessage reply = request(IpcMessages.streamRequest(null, "hello", null));

        assertEquals("BAD_REQUEST", reply.payloadString("code"));
    }

    @Test
    void windowControlIsUnsupported() throws Exception {
        IpcMessage reply = request(IpcMessages.windowControl("show"));

        assertEquals(IpcMessageType.ERROR, reply.type());
        assertEquals("UNSUPPORTED", reply.payloadString("code"));
    }

    @Test
    void serviceControlActions() throws Exception {
        assertEquals("UNKNOWN_ACTION", request(IpcMessages.serviceControl("dance", "daemon")).payloadString("code"));

        IpcMessage quit = request(IpcMessages.serviceControl("quit", "daemon"));

        assertEquals(IpcMessageType.ACK, quit.type());
        assertTrue(shutdownRequested.await(5, TimeUnit.SECONDS));
    }

    private IpcMessage request(IpcMessage message) throws Exception {
        return client.request(message).get(5, TimeUnit.SECONDS);
    }

    private List<IpcMessage> awaitChunks(int count) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (pushed.size() < count) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("expected " + count + " chunks, got " + pushed.size());
            }
            Thread.sleep(20);
        }
        return List.copyOf(pushed);
    }
}

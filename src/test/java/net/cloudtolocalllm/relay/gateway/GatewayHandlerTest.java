package net.cloudtolocalllm.relay.gateway;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
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
import net.cloudtolocalllm.relay.http.HttpEndpointClient;
import net.cloudtolocalllm.relay.http.HttpReply;
import net.cloudtolocalllm.relay.http.HttpTarget;
import net.cloudtolocalllm.relay.supervisor.InProcessProvisionBackend;
import net.cloudtolocalllm.relay.supervisor.ProxySupervisor;
import net.cloudtolocalllm.relay.supervisor.SupervisorSettings;
import net.cloudtolocalllm.relay.support.FakeUpstream;
import net.cloudtolocalllm.relay.support.MutableClock;
import net.cloudtolocalllm.relay.support.TestTokens;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GatewayHandlerTest {
    private static final TestTokens SIGNER = new TestTokens("gw-key");
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String ALICE = "auth0|alice";

    private final MutableClock clock = MutableClock.startingAt("2026-04-01T08:00:00Z");
    private final InProcessProvisionBackend backend = new InProcessProvisionBackend(4);
    private final HttpEndpointClient http = new HttpEndpointClient();
    private FakeUpstream upstream;
    private ProxySupervisor supervisor;
    private EventLoopGroup group;
    private EventExecutorGroup blocking;
    private Channel server;
    private HttpTarget gateway;

    @BeforeEach
    void setUp() throws Exception {
        upstream = FakeUpstream.start(
                "{\"message\":{\"content\":\"Hel\"},\"done\":false}",
                "{\"message\":{\"content\":\"lo\"},\"done\":true}");
        HealthMonitor monitor = new HealthMonitor(
                List.of(new ConnectionEndpoint(EndpointKind.CLOUD_RELAY, upstream.target(), null, Map.of())),
                (endpoint, timeoutMs) -> CompletableFuture.completedFuture(ProbeResult.ok(10)),
                HealthSettings.DEFAULT, clock);
        monitor.recordResult(EndpointKind.CLOUD_RELAY, ProbeResult.ok(40));
        ConnectionBroker broker = new ConnectionBroker(monitor, RoutePolicy.DEFAULT, null, clock);
        supervisor = new ProxySupervisor(backend, new SupervisorSettings(
                Duration.ofMinutes(10), Duration.ofSeconds(60), Duration.ofSeconds(30), Duration.ofSeconds(30),
                List.of(Duration.ofSeconds(1)), 4), null, clock);
        StreamDispatcher dispatcher = new StreamDispatcher(broker, supervisor, new InferenceClient(http, 2000),
                pause -> { }, clock);
        String jwks = TestTokens.jwks(SIGNER);
        TokenValidator validator = new TokenValidator(
                new JwksKeyCache(() -> jwks, Duration.ofMinutes(10), Duration.ofMinutes(1), clock),
                new AuthSettings(TestTokens.ISSUER, TestTokens.AUDIENCE, Duration.ofSeconds(60),
                        Duration.ofMinutes(10), Duration.ofMinutes(1), Set.of()),
                clock);

        group = new NioEventLoopGroup(1);
        blocking = new DefaultEventExecutorGroup(2);
        server = new ServerBootstrap()
                .group(group)
                .channel(NioServerSocketChannel.class)
                .childHandler(new GatewayChannelInitializer(64 * 1024, blocking, validator, broker, supervisor,
                        dispatcher))
                .bind(new InetSocketAddress("127.0.0.1", 0)).sync().channel();
        int port = ((InetSocketAddress) server.localAddress()).getPort();
        gateway = HttpTarget.parse("http://127.0.0.1:" + port);
    }

    @AfterEach
    void tearDown() {
        server.close().awaitUninterruptibly();
        blocking.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        supervisor.shutdown();
        upstream.close();
        http.close();
    }

    @Test
    void healthNeedsNoToken() throws Exception {
        HttpReply reply = call(HttpMethod.GET, GatewayHandler.HEALTH_PATH, null, null);

        assertEquals(200, reply.status());
        JsonNode body = MAPPER.readTree(reply.bodyText());
        assertEquals("ok", body.get("status").asText());
        assertEquals("excellent", body.get("quality").asText());
    }

    @Test
    void missingTokenIsRejectedBeforeProvisioning() throws Exception {
        HttpReply reply = call(HttpMethod.POST, GatewayHandler.STREAM_PATH, null, chatBody());

        assertEquals(401, reply.status());
        assertEquals("MALFORMED_TOKEN", MAPPER.readTree(reply.bodyText()).get("code").asText());
        assertEquals(0, backend.allocatedInstances());
        assertTrue(upstream.requests().isEmpty());
    }

    @Test
    void expiredTokenIsRejectedBeforeProvisioning() throws Exception {
        Map<String, Object> claims = TestTokens.claims(ALICE, clock.instant().minusSeconds(7200));
        claims.put("exp", clock.instant().minusSeconds(1).getEpochSecond());

        HttpReply reply = call(HttpMethod.POST, GatewayHandler.STREAM_PATH, SIGNER.sign(claims), chatBody());

        assertEquals(401, reply.status());
        assertEquals("TOKEN_EXPIRED", MAPPER.readTree(reply.bodyText()).get("code").asText());
        assertEquals(0, backend.allocatedInstances());
        assertTrue(supervisor.activeInstance(ALICE).isEmpty());
    }

    @Test
    void streamsNdjsonThroughTheUsersProxy() throws Exception {
        String token = SIGNER.sign(TestTokens.claims(ALICE, clock.instant()));
        List<String> lines = new CopyOnWriteArrayList<>();

        http.stream(gateway, GatewayHandler.STREAM_PATH, Map.of("Authorization", "Bearer " + token),
                chatBody(), 2000, lines::add).completion().get(5, TimeUnit.SECONDS);

        assertEquals(2, lines.size());
        assertEquals("Hel", MAPPER.readTree(lines.get(0)).get("text").asText());
        assertFalse(MAPPER.readTree(lines.get(0)).get("done").asBoolean());
        assertEquals("lo", MAPPER.readTree(lines.get(1)).get("text").asText());
        assertTrue(MAPPER.readTree(lines.get(1)).get("done").asBoolean());
        assertEquals("Bearer " + token, upstream.requests().get(0).authorization);
        assertEquals(1, backend.allocatedInstances());

        HttpReply status = call(HttpMethod.GET, GatewayHandler.PROXY_STATUS_PATH, token, null);
        JsonNode body = MAPPER.readTree(status.bodyText());
        assertEquals("active", body.get("proxy").get("state").asText());
        assertEquals(0, body.get("proxy").get("inFlightStreams").asInt());
    }

    @Test
    void disconnectReleasesTheProxy() throws Exception {
        String token = SIGNER.sign(TestTokens.claims(ALICE, clock.instant()));
        http.stream(gateway, GatewayHandler.STREAM_PATH, Map.of("Authorization", "Bearer " + token),
                chatBody(), 2000, line -> { }).completion().get(5, TimeUnit.SECONDS);

        HttpReply reply = call(HttpMethod.DELETE, GatewayHandler.PROXY_PATH, token, null);

        assertEquals(200, reply.status());
        assertTrue(MAPPER.readTree(reply.bodyText()).get("disconnected").asBoolean());
        assertEquals(0, backend.allocatedInstances());
    }

    @Test
    void statusWithoutProxyIsNull() throws Exception {
        String token = SIGNER.sign(TestTokens.claims(ALICE, clock.instant()));

        JsonNode body = MAPPER.readTree(call(HttpMethod.GET, GatewayHandler.PROXY_STATUS_PATH, token, null).bodyText());

        assertTrue(body.get("proxy").isNull());
        assertEquals("UNROUTED", body.get("route").asText());
    }

    @Test
    void rejectsBadRequests() throws Exception {
        String token = SIGNER.sign(TestTokens.claims(ALICE, clock.instant()));

        assertEquals(404, call(HttpMethod.GET, "/nope", token, null).status());
        assertEquals(405, call(HttpMethod.GET, GatewayHandler.STREAM_PATH, token, null).status());
        HttpReply missingModel = call(HttpMethod.POST, GatewayHandler.STREAM_PATH, token,
                "{\"message\":\"hi\"}".getBytes(StandardCharsets.UTF_8));
        assertEquals(400, missingModel.status());
        assertEquals("model is required", MAPPER.readTree(missingModel.bodyText()).get("error").asText());
        assertEquals(0, backend.allocatedInstances());
    }

    private HttpReply call(HttpMethod method, String path, String token, byte[] body) throws Exception {
        Map<String, String> headers = token == null ? Map.of() : Map.of("Authorization", "Bearer " + token);
        return http.send(gateway, method, path, headers, body, 5000).get(5, TimeUnit.SECONDS);
    }

    private static byte[] chatBody() {
        return "{\"model\":\"llama3.2\",\"message\":\"hi\"}".getBytes(StandardCharsets.UTF_8);
    }
}

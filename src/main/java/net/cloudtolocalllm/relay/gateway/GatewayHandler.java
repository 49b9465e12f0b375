package net.cloudtolocalllm.relay.gateway;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.DefaultHttpContent;
import io.netty.handler.codec.http.DefaultHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.LastHttpContent;
import io.netty.handler.codec.http.QueryStringDecoder;
import net.cloudtolocalllm.relay.auth.AuthError;
import net.cloudtolocalllm.relay.auth.AuthException;
import net.cloudtolocalllm.relay.auth.BearerTokens;
import net.cloudtolocalllm.relay.auth.Claims;
import net.cloudtolocalllm.relay.auth.TokenRedactor;
import net.cloudtolocalllm.relay.auth.TokenValidation;
import net.cloudtolocalllm.relay.auth.TokenValidator;
import net.cloudtolocalllm.relay.broker.ChatChunk;
import net.cloudtolocalllm.relay.broker.ConnectionBroker;
import net.cloudtolocalllm.relay.broker.NoRouteException;
import net.cloudtolocalllm.relay.broker.RouteSnapshot;
import net.cloudtolocalllm.relay.broker.StreamDispatcher;
import net.cloudtolocalllm.relay.broker.StreamHandle;
import net.cloudtolocalllm.relay.broker.StreamRequest;
import net.cloudtolocalllm.relay.broker.StreamSink;
import net.cloudtolocalllm.relay.supervisor.ProxyStatus;
import net.cloudtolocalllm.relay.supervisor.ProxySupervisor;

/**
 * HTTP front door for remote clients. One instance per connection.
 * <p>
 * Every route except {@code /health} requires a valid bearer token; it is checked before anything is
 * provisioned or forwarded. Runs on a blocking executor group, since dispatch may wait for a proxy.
 */
final class GatewayHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
    static final String HEALTH_PATH = "/health";
    static final String STREAM_PATH = "/v1/chat/stream";
    static final String PROXY_STATUS_PATH = "/v1/proxy/status";
    static final String PROXY_PATH = "/v1/proxy";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String NDJSON = "application/x-ndjson";

    private final TokenValidator validator;
    private final ConnectionBroker broker;
    private final ProxySupervisor supervisor;
    private final StreamDispatcher dispatcher;
    private volatile StreamHandle activeStream;

    GatewayHandler(TokenValidator validator, ConnectionBroker broker, ProxySupervisor supervisor,
                   StreamDispatcher dispatcher) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.broker = Objects.requireNonNull(broker, "broker");
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        String path = new QueryStringDecoder(request.uri()).path();
        HttpMethod method = request.method();
        try {
            if (HEALTH_PATH.equals(path)) {
                requireMethod(method, HttpMethod.GET);
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("status", "ok");
                body.put("quality", broker.bestAvailableQuality().wireName());
                writeJson(ctx, HttpResponseStatus.OK, body);
            } else if (STREAM_PATH.equals(path)) {
                requireMethod(method, HttpMethod.POST);
                stream(ctx, request);
            } else if (PROXY_STATUS_PATH.equals(path)) {
                requireMethod(method, HttpMethod.GET);
                proxyStatus(ctx, authenticate(request).claims().userId());
            } else if (PROXY_PATH.equals(path)) {
                requireMethod(method, HttpMethod.DELETE);
                String userId = authenticate(request).claims().userId();
                boolean disconnected = supervisor.disconnect(userId);
                broker.forget(userId);
                writeJson(ctx, HttpResponseStatus.OK, Map.of("disconnected", disconnected));
            } else {
                writeJson(ctx, HttpResponseStatus.NOT_FOUND, GatewayResponse.error("NOT_FOUND", "no route for " + path));
            }
        } catch (AuthException e) {
            writeJson(ctx, HttpResponseStatus.UNAUTHORIZED, GatewayResponse.error(e.error().code(), e.getMessage()));
        } catch (NoRouteException e) {
            writeJson(ctx, HttpResponseStatus.SERVICE_UNAVAILABLE, GatewayResponse.error("NO_ROUTE", e.getMessage()));
        } catch (MethodNotAllowedException e) {
            writeJson(ctx, HttpResponseStatus.METHOD_NOT_ALLOWED,
                    GatewayResponse.error("METHOD_NOT_ALLOWED", method + " is not allowed on " + path));
        } catch (IllegalArgumentException e) {
            writeJson(ctx, HttpResponseStatus.BAD_REQUEST, GatewayResponse.error("BAD_REQUEST", e.getMessage()));
        } catch (RuntimeException e) {
            System.err.println("Gateway request " + method + " " + path + " failed: " + e.getMessage());
            writeJson(ctx, HttpResponseStatus.INTERNAL_SERVER_ERROR,
                    GatewayResponse.error("INTERNAL", "internal error"));
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        StreamHandle handle = activeStream;
        activeStream = null;
        if (handle != null) {
            handle.cancel();
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        System.err.println("Gateway connection " + ctx.channel().remoteAddress() + " failed: " + cause.getMessage());
        ctx.close();
    }

    private void stream(ChannelHandlerContext ctx, FullHttpRequest request) throws AuthException, NoRouteException {
        Authenticated caller = authenticate(request);
        JsonNode body = readJson(request.content());
        String model = requireText(body, "model");
        String message = requireText(body, "message");
        StreamRequest streamRequest = StreamRequest.authenticated(caller.token(), caller.claims(), model, message);
        NdjsonSink sink = new NdjsonSink(ctx);
        activeStream = dispatcher.dispatch(streamRequest, sink);
        if (!ctx.channel().isActive()) {
            activeStream.cancel();
        }
    }

    private void proxyStatus(ChannelHandlerContext ctx, String userId) {
        Optional<ProxyStatus> status = supervisor.status(userId);
        Map<String, Object> body = new LinkedHashMap<>();
        Optional<RouteSnapshot> route = broker.routeStatus(userId);
        body.put("route", route.map(snapshot -> snapshot.status().name()).orElse("UNROUTED"));
        if (status.isEmpty()) {
            body.put("proxy", null);
            writeJson(ctx, HttpResponseStatus.OK, body);
            return;
        }
        ProxyStatus proxy = status.get();
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("instanceId", proxy.instanceId());
        view.put("state", proxy.state().wireName());
        view.put("createdAt", proxy.createdAt().toString());
        view.put("lastActivityAt", proxy.lastActivityAt().toString());
        view.put("inFlightStreams", proxy.inFlightStreams());
        view.put("healthy", proxy.healthy());
        body.put("proxy", view);
        writeJson(ctx, HttpResponseStatus.OK, body);
    }

    private Authenticated authenticate(FullHttpRequest request) throws AuthException {
        String token = BearerTokens.extract(request.headers().get(HttpHeaderNames.AUTHORIZATION));
        if (token == null) {
            throw new AuthException(AuthError.MALFORMED, "missing bearer token");
        }
        TokenValidation validation = validator.validate(token);
        if (!validation.isOk()) {
            System.err.println("Gateway rejected token " + TokenRedactor.fingerprint(token) + ": "
                    + validation.error.code());
            throw AuthException.from(validation);
        }
        return new Authenticated(token, validation.claims);
    }

    private static void requireMethod(HttpMethod actual, HttpMethod expected) {
        if (!expected.equals(actual)) {
            throw new MethodNotAllowedException();
        }
    }

    private static JsonNode readJson(ByteBuf content) {
        if (!content.isReadable()) {
            throw new IllegalArgumentException("request body required");
        }
        try {
            JsonNode node = MAPPER.readTree(content.toString(StandardCharsets.UTF_8));
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("request body must be a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid json");
        }
    }

    private static String requireText(JsonNode body, String field) {
        JsonNode value = body.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value.asText();
    }

    static void writeJson(ChannelHandlerContext ctx, HttpResponseStatus status, Object body) {
        byte[] payload;
        try {
            payload = MAPPER.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            payload = "{\"error\":\"internal error\",\"code\":\"INTERNAL\"}".getBytes(StandardCharsets.UTF_8);
            status = HttpResponseStatus.INTERNAL_SERVER_ERROR;
        }
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status,
                Unpooled.wrappedBuffer(payload));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON);
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, payload.length);
        response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }

    private static ByteBuf line(Object value) {
        try {
            byte[] json = MAPPER.writeValueAsBytes(value);
            ByteBuf buf = Unpooled.buffer(json.length + 1);
            buf.writeBytes(json).writeByte('\n');
            return buf;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode stream record", e);
        }
    }

    private record Authenticated(String token, Claims claims) {
    }

    private static final class MethodNotAllowedException extends RuntimeException {
        private MethodNotAllowedException() {
            super(null, null, false, false);
        }
    }

    /**
     * Writes the response as chunked NDJSON; the headers go out with the first chunk.
     */
    private final class NdjsonSink implements StreamSink {
        private final ChannelHandlerContext ctx;
        private final AtomicBoolean headersSent = new AtomicBoolean(false);
        private final AtomicBoolean doneSent = new AtomicBoolean(false);

        private NdjsonSink(ChannelHandlerContext ctx) {
            this.ctx = ctx;
        }

        @Override
        public void onChunk(ChatChunk chunk) {
            sendHeaders();
            if (chunk.done()) {
                doneSent.set(true);
            }
            ctx.writeAndFlush(new DefaultHttpContent(line(chunkBody(chunk.text(), chunk.done()))));
        }

        @Override
        public void onComplete() {
            sendHeaders();
            if (doneSent.compareAndSet(false, true)) {
                ctx.write(new DefaultHttpContent(line(chunkBody("", true))));
            }
            finish();
        }

        @Override
        public void onError(Throwable error) {
            if (error instanceof CancellationException) {
                ctx.close();
                return;
            }
            if (headersSent.compareAndSet(false, true)) {
                activeStream = null;
                writeJson(ctx, HttpResponseStatus.BAD_GATEWAY, GatewayResponse.error("STREAM_FAILED", error.getMessage()));
                return;
            }
            ctx.write(new DefaultHttpContent(line(GatewayResponse.error("STREAM_FAILED", error.getMessage()))));
            finish();
        }

        private void sendHeaders() {
            if (!headersSent.compareAndSet(false, true)) {
                return;
            }
            HttpResponse response = new DefaultHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.OK);
            response.headers().set(HttpHeaderNames.CONTENT_TYPE, NDJSON);
            response.headers().set(HttpHeaderNames.TRANSFER_ENCODING, HttpHeaderValues.CHUNKED);
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
            ctx.write(response);
        }

        private void finish() {
            activeStream = null;
            ctx.writeAndFlush(LastHttpContent.EMPTY_LAST_CONTENT).addListener(ChannelFutureListener.CLOSE);
        }

        private Map<String, Object> chunkBody(String text, boolean done) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("text", text);
            body.put("done", done);
            return body;
        }
    }
}

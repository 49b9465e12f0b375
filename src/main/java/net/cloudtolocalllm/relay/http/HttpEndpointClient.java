package net.cloudtolocalllm.relay.http;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import javax.net.ssl.SSLException;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpContent;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObject;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.LastHttpContent;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.util.concurrent.ScheduledFuture;
import net.cloudtolocalllm.relay.util.DaemonThreads;

/**
 * Small Netty HTTP/1.1 client used for health probes, JWKS downloads and streamed inference.
 * <p>
 * Every request opens its own connection and closes it when the exchange ends.
 */
public final class HttpEndpointClient implements AutoCloseable {
    private static final int DEFAULT_MAX_RESPONSE_BYTES = 1024 * 1024;
    private static final int STREAM_READ_TIMEOUT_SECONDS = 300;
    static final int MAX_LINE_BYTES = DEFAULT_MAX_RESPONSE_BYTES;

    private final EventLoopGroup group;
    private final boolean ownsGroup;
    private final SslContext sslContext;

    public HttpEndpointClient() {
        this(new NioEventLoopGroup(2, DaemonThreads.named("ctl-http-client")), true);
    }

    public HttpEndpointClient(EventLoopGroup group) {
        this(group, false);
    }

    private HttpEndpointClient(EventLoopGroup group, boolean ownsGroup) {
        this.group = Objects.requireNonNull(group, "group");
        this.ownsGroup = ownsGroup;
        this.sslContext = buildSslContext();
    }

    /**
     * Send one request and buffer the full response.
     * <p>
     * The whole exchange, connect included, is bounded by {@code timeoutMs}; on expiry the future
     * fails with {@link TimeoutException}.
     */
    public CompletableFuture<HttpReply> send(HttpTarget target,
                                             HttpMethod method,
                                             String path,
                                             Map<String, String> headers,
                                             byte[] body,
                                             int timeoutMs) {
        Objects.requireNonNull(target, "target");
        CompletableFuture<HttpReply> result = new CompletableFuture<>();
        Bootstrap bootstrap = bootstrap(target, timeoutMs, channel -> channel.pipeline().addLast(
                new HttpObjectAggregator(DEFAULT_MAX_RESPONSE_BYTES),
                new ReplyHandler(result)
        ));
        ChannelFuture connect = bootstrap.connect(target.host(), target.port());
        ScheduledFuture<?> timeout = group.next().schedule(() -> {
            if (result.completeExceptionally(new TimeoutException(
                    "no response from " + target + " within " + timeoutMs + "ms"))) {
                connect.channel().close();
            }
        }, timeoutMs, TimeUnit.MILLISECONDS);
        result.whenComplete((reply, error) -> {
            timeout.cancel(false);
            connect.channel().close();
        });
        connect.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                result.completeExceptionally(future.cause());
                return;
            }
            future.channel().writeAndFlush(buildRequest(target, method, path, headers, body))
                    .addListener((ChannelFutureListener) write -> {
                        if (!write.isSuccess()) {
                            result.completeExceptionally(write.cause());
                        }
                    });
        });
        return result;
    }

    /**
     * POST {@code body} and deliver the newline-delimited response to {@code listener} as it arrives.
     */
    public StreamCall stream(HttpTarget target,
                             String path,
                             Map<String, String> headers,
                             byte[] body,
                             int connectTimeoutMs,
                             LineListener listener) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(listener, "listener");
        CompletableFuture<Void> completion = new CompletableFuture<>();
        StreamCall call = new StreamCall(completion);
        Bootstrap bootstrap = bootstrap(target, connectTimeoutMs, channel -> channel.pipeline().addLast(
                new ReadTimeoutHandler(STREAM_READ_TIMEOUT_SECONDS),
                new LineStreamHandler(target, completion, listener)
        ));
        ChannelFuture connect = bootstrap.connect(target.host(), target.port());
        call.attach(connect.channel());
        completion.whenComplete((ignored, error) -> connect.channel().close());
        connect.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                completion.completeExceptionally(future.cause());
                return;
            }
            future.channel().writeAndFlush(buildRequest(target, HttpMethod.POST, path, headers, body))
                    .addListener((ChannelFutureListener) write -> {
                        if (!write.isSuccess()) {
                            completion.completeExceptionally(write.cause());
                        }
                    });
        });
        return call;
    }

    @Override
    public void close() {
        if (ownsGroup) {
            group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        }
    }

    private Bootstrap bootstrap(HttpTarget target, int connectTimeoutMs, PipelineTail tail) {
        return new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.max(1, connectTimeoutMs))
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel channel) {
                        if (target.secure()) {
                            channel.pipeline().addLast(sslContext.newHandler(channel.alloc(), target.host(), target.port()));
                        }
                        channel.pipeline().addLast(new HttpClientCodec());
                        tail.install(channel);
                    }
                });
    }

    private static FullHttpRequest buildRequest(HttpTarget target,
                                                HttpMethod method,
                                                String path,
                                                Map<String, String> headers,
                                                byte[] body) {
        ByteBuf content = body == null ? Unpooled.EMPTY_BUFFER : Unpooled.wrappedBuffer(body);
        FullHttpRequest request = new DefaultFullHttpRequest(
                HttpVersion.HTTP_1_1, method, target.requestUri(path), content);
        request.headers().set(HttpHeaderNames.HOST, target.hostHeader());
        request.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        request.headers().set(HttpHeaderNames.ACCEPT, "application/json, application/x-ndjson");
        request.headers().set(HttpHeaderNames.CONTENT_LENGTH, content.readableBytes());
        if (body != null) {
            request.headers().set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON);
        }
        if (headers != null) {
            headers.forEach(request.headers()::set);
        }
        return request;
    }

    private static SslContext buildSslContext() {
        try {
            return SslContextBuilder.forClient().build();
        } catch (SSLException e) {
            throw new IllegalStateException("Failed to initialise TLS client context", e);
        }
    }

    @FunctionalInterface
    private interface PipelineTail {
        void install(SocketChannel channel);
    }

    private static final class ReplyHandler extends SimpleChannelInboundHandler<FullHttpResponse> {
        private final CompletableFuture<HttpReply> result;

        private ReplyHandler(CompletableFuture<HttpReply> result) {
            this.result = result;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse response) {
            result.complete(new HttpReply(response.status().code(), ByteBufUtil.getBytes(response.content())));
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            result.completeExceptionally(new IOException("connection closed before a response arrived"));
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            result.completeExceptionally(cause);
            ctx.close();
        }
    }

    /**
     * Splits the body on {@code \n} bytes so multi-byte characters split across chunks stay intact.
     * A line longer than {@link #MAX_LINE_BYTES} fails the stream.
     */
    private static final class LineStreamHandler extends SimpleChannelInboundHandler<HttpObject> {
        private final HttpTarget target;
        private final CompletableFuture<Void> completion;
        private final LineListener listener;
        private final ByteArrayOutputStream pending = new ByteArrayOutputStream();

        private LineStreamHandler(HttpTarget target, CompletableFuture<Void> completion, LineListener listener) {
            this.target = target;
            this.completion = completion;
            this.listener = listener;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, HttpObject msg) {
            if (completion.isDone()) {
                return;
            }
            if (msg instanceof HttpResponse) {
                int status = ((HttpResponse) msg).status().code();
                if (status < 200 || status >= 300) {
                    completion.completeExceptionally(new HttpStatusException(status,
                            target + " answered " + ((HttpResponse) msg).status()));
                    ctx.close();
                    return;
                }
            }
            if (msg instanceof HttpContent) {
                ByteBuf content = ((HttpContent) msg).content();
                while (content.isReadable()) {
                    byte next = content.readByte();
                    if (next == '\n') {
                        emitPending();
                    } else if (pending.size() >= MAX_LINE_BYTES) {
                        pending.reset();
                        completion.completeExceptionally(new TooLongFrameException(
                                "line from " + target + " exceeds " + MAX_LINE_BYTES + " bytes"));
                        ctx.close();
                        return;
                    } else {
                        pending.write(next);
                    }
                }
                if (msg instanceof LastHttpContent) {
                    emitPending();
                    completion.complete(null);
                    ctx.close();
                }
            }
        }

        private void emitPending() {
            String line = pending.toString(StandardCharsets.UTF_8).trim();
            pending.reset();
            if (!line.isEmpty() && !completion.isDone()) {
                listener.onLine(line);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            completion.completeExceptionally(new IOException("stream from " + target + " ended early"));
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            completion.completeExceptionally(cause);
            ctx.close();
        }
    }
}

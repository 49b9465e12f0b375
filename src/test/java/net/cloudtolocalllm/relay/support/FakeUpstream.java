package net.cloudtolocalllm.relay.support;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpVersion;
import net.cloudtolocalllm.relay.http.HttpTarget;

/**
 * Loopback HTTP server standing in for an inference endpoint. Answers every request with the
 * configured status and newline-delimited body and records what it received.
 */
public final class FakeUpstream implements AutoCloseable {
    private final List<Recorded> requests = new CopyOnWriteArrayList<>();
    private final EventLoopGroup group = new NioEventLoopGroup(1);
    private volatile int status = 200;
    private volatile String body = "";
    private Channel channel;

    public static FakeUpstream start(String... lines) throws InterruptedException {
        FakeUpstream upstream = new FakeUpstream();
        upstream.respondWith(200, lines);
        upstream.bind();
        return upstream;
    }

    public void respondWith(int status, String... lines) {
        this.status = status;
        this.body = lines.length == 0 ? "" : String.join("\n", lines) + "\n";
    }

    public HttpTarget target() {
        InetSocketAddress address = (InetSocketAddress) channel.localAddress();
        return HttpTarget.parse("http://127.0.0.1:" + address.getPort());
    }

    public List<Recorded> requests() {
        return requests;
    }

    @Override
    public void close() {
        if (channel != null) {
            channel.close().syncUninterruptibly();
        }
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    private void bind() throws InterruptedException {
        channel = new ServerBootstrap()
                .group(group)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(new HttpServerCodec(), new HttpObjectAggregator(1 << 20),
                                new Responder());
                    }
                })
                .bind("127.0.0.1", 0)
                .sync()
                .channel();
    }

    /**
     * What the upstream saw.
     */
    public static final class Recorded {
        public final String uri;
        public final String authorization;
        public final String body;

        private Recorded(String uri, String authorization, String body) {
            this.uri = uri;
            this.authorization = authorization;
            this.body = body;
        }
    }

    private final class Responder extends SimpleChannelInboundHandler<FullHttpRequest> {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
            requests.add(new Recorded(request.uri(), request.headers().get(HttpHeaderNames.AUTHORIZATION),
                    request.content().toString(StandardCharsets.UTF_8)));
            FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1,
                    HttpResponseStatus.valueOf(status), Unpooled.copiedBuffer(body, StandardCharsets.UTF_8));
            response.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/x-ndjson");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }
}

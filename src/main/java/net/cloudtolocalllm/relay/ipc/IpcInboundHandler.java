package net.cloudtolocalllm.relay.ipc;

import java.time.Duration;
import java.util.function.Consumer;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.util.AttributeKey;

/**
 * Routes responses to waiting requests and requests to the {@link IpcMessageHandler}, and guarantees
 * that every ack-required request gets exactly one correlated response.
 */
final class IpcInboundHandler extends SimpleChannelInboundHandler<IpcMessage> {
    static final AttributeKey<IpcSession> SESSION = AttributeKey.valueOf("ctl.ipc.session");

    private final IpcMessageHandler handler;
    private final Duration ackTimeout;
    private final Consumer<IpcSession> onAckTimeout;
    private final SessionCallbacks callbacks;

    IpcInboundHandler(IpcMessageHandler handler, Duration ackTimeout, Consumer<IpcSession> onAckTimeout,
                      SessionCallbacks callbacks) {
        this.handler = handler;
        this.ackTimeout = ackTimeout;
        this.onAckTimeout = onAckTimeout;
        this.callbacks = callbacks;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        IpcSession session = new IpcSession(ctx.channel(), ackTimeout, onAckTimeout);
        ctx.channel().attr(SESSION).set(session);
        callbacks.opened(session);
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, IpcMessage message) {
        IpcSession session = ctx.channel().attr(SESSION).get();
        if (session == null) {
            return;
        }
        if (session.completePending(message)) {
            return;
        }
        if (message.type() == IpcMessageType.ACK) {
            System.err.println("Ignoring ack for unknown request " + message.id());
            return;
        }
        IpcMessage reply;
        try {
            reply = handler.handle(session, message);
        } catch (Exception e) {
            System.err.println("IPC handler failed for " + message + ": " + e.getMessage());
            reply = IpcMessages.error(message, "HANDLER_ERROR", e.getMessage());
        }
        if (reply == IpcMessageHandler.DEFERRED) {
            return;
        }
        if (reply != null) {
            session.send(reply);
        } else if (message.ackRequired()) {
            session.send(IpcMessages.ack(message));
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        IpcSession session = ctx.channel().attr(SESSION).getAndSet(null);
        if (session != null) {
            session.closed();
            callbacks.closed(session);
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        System.err.println("IPC connection " + ctx.channel().remoteAddress() + " failed: " + cause.getMessage());
        ctx.close();
    }

    interface SessionCallbacks {
        SessionCallbacks NONE = new SessionCallbacks() {
            @Override
            public void opened(IpcSession session) {
            }

            @Override
            public void closed(IpcSession session) {
            }
        };

        void opened(IpcSession session);

        void closed(IpcSession session);
    }
}

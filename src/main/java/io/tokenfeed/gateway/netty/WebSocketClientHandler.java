package io.tokenfeed.gateway.netty;

import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.function.Consumer;

/**
 * Netty handler for the feed WebSocket.
 * Runs the handshake, answers pings, sends keep-alive pings when the writer is idle,
 * and hands text frames to the message callback.
 */
public class WebSocketClientHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketClientHandler.class);

    // Feed frames are small, but creation events with long metadata URIs can exceed the default
    private static final int MAX_FRAME_PAYLOAD = 1024 * 1024;

    private final String name;
    private final WebSocketClientHandshaker handshaker;
    private final Consumer<String> onFrame;
    private final Consumer<Throwable> onError;
    private final Runnable onOpen;
    private final Runnable onClosed;
    private ChannelPromise handshakeFuture;

    public WebSocketClientHandler(
        URI uri,
        String name,
        Consumer<String> onFrame,
        Consumer<Throwable> onError,
        Runnable onOpen,
        Runnable onClosed
    ) {
        this.name = name;
        this.handshaker = WebSocketClientHandshakerFactory.newHandshaker(
            uri,
            WebSocketVersion.V13,
            null,
            true,
            new DefaultHttpHeaders(),
            MAX_FRAME_PAYLOAD
        );
        this.onFrame = onFrame;
        this.onError = onError;
        this.onOpen = onOpen;
        this.onClosed = onClosed;
    }

    /**
     * Completes when the WebSocket handshake succeeds, fails when it does not.
     */
    public ChannelFuture handshakeFuture() {
        return handshakeFuture;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        handshakeFuture = ctx.newPromise();
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        handshaker.handshake(ctx.channel());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        LOGGER.debug("{}: WebSocket channel inactive", name);
        if (!handshakeFuture.isDone()) {
            handshakeFuture.tryFailure(new IllegalStateException("Channel closed before handshake completed"));
        }
        if (onClosed != null) {
            onClosed.run();
        }
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        if (!handshaker.isHandshakeComplete()) {
            try {
                handshaker.finishHandshake(ctx.channel(), (FullHttpResponse) msg);
                LOGGER.debug("{}: WebSocket handshake complete", name);
                // connected state is published before connect() is released
                if (onOpen != null) {
                    onOpen.run();
                }
                handshakeFuture.setSuccess();
            } catch (Exception e) {
                LOGGER.error("{}: WebSocket handshake failed", name, e);
                handshakeFuture.tryFailure(e);
                ctx.close();
            }
            return;
        }

        if (msg instanceof FullHttpResponse response) {
            throw new IllegalStateException(
                "Unexpected FullHttpResponse (status=" + response.status() + ")"
            );
        }

        WebSocketFrame frame = (WebSocketFrame) msg;

        if (frame instanceof TextWebSocketFrame textFrame) {
            String message = textFrame.text();
            try {
                if (onFrame != null) {
                    onFrame.accept(message);
                }
            } catch (Exception e) {
                LOGGER.error("{}: Error in message handler", name, e);
                if (onError != null) {
                    onError.accept(e);
                }
            }
            return;
        }

        if (frame instanceof PingWebSocketFrame ping) {
            ctx.writeAndFlush(new PongWebSocketFrame(ping.content().retain()));
            return;
        }

        if (frame instanceof PongWebSocketFrame) {
            LOGGER.trace("{}: Pong received", name);
            return;
        }

        if (frame instanceof CloseWebSocketFrame close) {
            LOGGER.info("{}: Server closed connection ({} {})", name, close.statusCode(), close.reasonText());
            ctx.close();
            return;
        }

        LOGGER.warn("{}: Unsupported frame type: {}", name, frame.getClass().getName());
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent idle && idle.state() == IdleState.WRITER_IDLE) {
            if (handshaker.isHandshakeComplete()) {
                ctx.writeAndFlush(new PingWebSocketFrame());
            }
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.error("{}: WebSocket exception", name, cause);
        if (!handshakeFuture.isDone()) {
            handshakeFuture.tryFailure(cause);
        }
        if (onError != null) {
            onError.accept(cause);
        }
        ctx.close();
    }
}

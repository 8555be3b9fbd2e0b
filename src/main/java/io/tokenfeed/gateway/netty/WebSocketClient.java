package io.tokenfeed.gateway.netty;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketClientCompressionHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslProvider;
import io.netty.handler.timeout.IdleStateHandler;
import io.tokenfeed.gateway.connection.ConnectionException;
import io.tokenfeed.gateway.connection.FeedTransport;
import io.tokenfeed.gateway.connection.NotConnectedException;
import io.tokenfeed.gateway.connection.TransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Netty-based WebSocket client for the feed's streaming API.
 * One instance owns at most one channel at a time and may be reconnected after a loss.
 */
public class WebSocketClient implements FeedTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketClient.class);
    private static final long HANDSHAKE_TIMEOUT_MS = 10000;
    private static final int CONNECT_TIMEOUT_MS = 10000;
    private static final int MAX_MESSAGE_SIZE = 1024 * 1024;

    private final URI uri;
    private final String name;
    private final TransportListener listener;
    private final boolean enableCompression;
    private final long pingIntervalMs;
    private final AtomicBoolean connected = new AtomicBoolean(false);

    private EventLoopGroup eventLoopGroup;
    private volatile Channel channel;
    private volatile boolean closed = false;

    /**
     * Creates a client that reports to a transport listener.
     *
     * @param uri               The WebSocket URI to connect to
     * @param name              Friendly name for this client (e.g., "PumpPortal")
     * @param listener          Receives frames and lifecycle callbacks
     * @param enableCompression Whether to negotiate permessage-deflate
     * @param pingIntervalMs    Writer idle time before a keep-alive ping (0 disables pings)
     */
    public WebSocketClient(URI uri, String name, TransportListener listener, boolean enableCompression, long pingIntervalMs) {
        this.uri = uri;
        this.name = name;
        this.listener = listener;
        this.enableCompression = enableCompression;
        this.pingIntervalMs = pingIntervalMs;
    }

    /**
     * Connects to the WebSocket server and waits for the handshake.
     *
     * @throws ConnectionException if the TCP connect or the WebSocket handshake fails
     */
    @Override
    public synchronized void connect() {
        if (closed) {
            throw new ConnectionException(name + ": client is closed");
        }
        if (connected.get()) {
            LOGGER.warn("{}: Already connected", name);
            return;
        }

        if (eventLoopGroup == null) {
            eventLoopGroup = NettyEventLoopFactory.createEventLoopGroup(1, name.toLowerCase() + "-io");
        }

        SslContext sslContext = "wss".equals(uri.getScheme()) ? buildSslContext() : null;
        String host = uri.getHost();
        int port = uri.getPort() > 0 ? uri.getPort() : ("wss".equals(uri.getScheme()) ? 443 : 80);

        WebSocketClientHandler handler = new WebSocketClientHandler(
            uri,
            name,
            listener::onFrame,
            listener::onError,
            () -> {
                connected.set(true);
                LOGGER.info("{}: Connected", name);
                listener.onOpen();
            },
            () -> {
                // Only an established connection counts as lost; failed attempts surface from connect()
                if (connected.compareAndSet(true, false)) {
                    LOGGER.warn("{}: Disconnected", name);
                    listener.onClosed();
                }
            }
        );

        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(eventLoopGroup)
            .channel(NettyEventLoopFactory.getClientChannelClass())
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
            .option(ChannelOption.TCP_NODELAY, true)
            .handler(new ChannelInitializer<>() {
                @Override
                protected void initChannel(Channel ch) {
                    // set before the handshake so the connect callback can already send
                    channel = ch;
                    ChannelPipeline pipeline = ch.pipeline();

                    if (sslContext != null) {
                        pipeline.addLast(sslContext.newHandler(ch.alloc(), host, port));
                    }

                    pipeline.addLast(new HttpClientCodec());
                    pipeline.addLast(new HttpObjectAggregator(8192));

                    if (enableCompression) {
                        pipeline.addLast(WebSocketClientCompressionHandler.INSTANCE);
                    }

                    pipeline.addLast(new WebSocketFrameAggregator(MAX_MESSAGE_SIZE));

                    if (pingIntervalMs > 0) {
                        pipeline.addLast(new IdleStateHandler(0, pingIntervalMs, 0, TimeUnit.MILLISECONDS));
                    }

                    pipeline.addLast(handler);
                }
            });

        LOGGER.info("{}: Connecting to {}:{}...", name, host, port);
        Channel ch = null;
        try {
            ChannelFuture connectFuture = bootstrap.connect(host, port).sync();
            ch = connectFuture.channel();

            if (!handler.handshakeFuture().await(HANDSHAKE_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                throw new ConnectionException(name + ": handshake timed out after " + HANDSHAKE_TIMEOUT_MS + " ms");
            }
            if (!handler.handshakeFuture().isSuccess()) {
                throw new ConnectionException(name + ": handshake failed", handler.handshakeFuture().cause());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeQuietly(ch);
            throw new ConnectionException(name + ": interrupted while connecting", e);
        } catch (ConnectionException e) {
            closeQuietly(ch);
            throw e;
        } catch (Exception e) {
            closeQuietly(ch);
            throw new ConnectionException(name + ": failed to connect to " + uri, e);
        }
    }

    /**
     * Sends a text message through the WebSocket.
     *
     * @param message   The message to send
     * @param timeoutMs Maximum time to wait for the write to complete
     */
    @Override
    public void send(String message, long timeoutMs) {
        Channel ch = channel;
        if (!connected.get() || ch == null || !ch.isActive()) {
            throw new NotConnectedException(name + ": cannot send message, not connected");
        }

        ChannelFuture future = ch.writeAndFlush(new TextWebSocketFrame(message));
        if (ch.eventLoop().inEventLoop()) {
            // Blocking here would deadlock the I/O thread; the write is already queued
            return;
        }

        try {
            if (!future.await(timeoutMs, TimeUnit.MILLISECONDS)) {
                throw new NotConnectedException(name + ": write timed out after " + timeoutMs + " ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotConnectedException(name + ": interrupted while sending", e);
        }
        if (!future.isSuccess()) {
            throw new NotConnectedException(name + ": write failed", future.cause());
        }
    }

    /**
     * Returns whether the client is currently connected.
     */
    @Override
    public boolean isConnected() {
        Channel ch = channel;
        return connected.get() && ch != null && ch.isActive();
    }

    @Override
    public void disconnect() {
        Channel ch = channel;
        if (ch != null) {
            LOGGER.info("{}: Dropping connection", name);
            ch.close();
        }
    }

    @Override
    public synchronized void close() {
        closed = true;

        Channel ch = channel;
        if (ch != null) {
            try {
                ch.close().sync();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.error("{}: Interrupted while closing channel", name, e);
            }
            channel = null;
        }
        connected.set(false);

        if (eventLoopGroup != null) {
            eventLoopGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
            eventLoopGroup = null;
        }

        LOGGER.info("{}: Closed", name);
    }

    private SslContext buildSslContext() {
        try {
            return SslContextBuilder.forClient()
                .protocols("TLSv1.2", "TLSv1.3")
                .sslProvider(SslProvider.JDK)
                .build();
        } catch (SSLException e) {
            throw new ConnectionException(name + ": failed to create SSL context", e);
        }
    }

    private void closeQuietly(Channel ch) {
        if (ch != null) {
            ch.close();
        }
        channel = null;
    }
}

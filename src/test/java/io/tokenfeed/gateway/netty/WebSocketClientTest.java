package io.tokenfeed.gateway.netty;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.tokenfeed.gateway.TestWait;
import io.tokenfeed.gateway.connection.ConnectionException;
import io.tokenfeed.gateway.connection.NotConnectedException;
import io.tokenfeed.gateway.connection.TransportListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.URI;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests WebSocketClient against an in-process Netty WebSocket server.
 */
class WebSocketClientTest {

    private EventLoopGroup serverGroup;
    private Channel serverChannel;
    private final List<String> serverReceived = new CopyOnWriteArrayList<>();
    private final AtomicReference<Channel> serverPeer = new AtomicReference<>();
    private final RecordingListener listener = new RecordingListener();
    private WebSocketClient client;

    @BeforeEach
    void setUp() throws Exception {
        serverGroup = new NioEventLoopGroup(1);
        ServerBootstrap bootstrap = new ServerBootstrap()
            .group(serverGroup)
            .channel(NioServerSocketChannel.class)
            .childHandler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    ch.pipeline().addLast(
                        new HttpServerCodec(),
                        new HttpObjectAggregator(65536),
                        new WebSocketServerProtocolHandler("/feed"),
                        new SimpleChannelInboundHandler<TextWebSocketFrame>() {
                            @Override
                            public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
                                if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
                                    serverPeer.set(ctx.channel());
                                }
                                super.userEventTriggered(ctx, evt);
                            }

                            @Override
                            protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
                                serverReceived.add(frame.text());
                            }
                        });
                }
            });
        serverChannel = bootstrap.bind("127.0.0.1", 0).sync().channel();
    }

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
        serverChannel.close().syncUninterruptibly();
        serverGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
    }

    @Test
    void testExchangesFramesWithServer() {
        client = new WebSocketClient(feedUri(port()), "test", listener, false, 0);

        client.connect();

        assertTrue(client.isConnected());
        assertEquals(1, listener.opened.get());

        client.send("{\"method\":\"subscribeNewToken\"}", 1000);
        TestWait.until(() -> serverReceived.contains("{\"method\":\"subscribeNewToken\"}"), 2000, "frame at server");

        TestWait.until(() -> serverPeer.get() != null, 2000, "server handshake");
        serverPeer.get().writeAndFlush(new TextWebSocketFrame("{\"message\":\"ok\"}"));
        TestWait.until(() -> listener.frames.contains("{\"message\":\"ok\"}"), 2000, "frame at client");
    }

    @Test
    void testServerCloseReportsDisconnect() {
        client = new WebSocketClient(feedUri(port()), "test", listener, false, 0);
        client.connect();
        TestWait.until(() -> serverPeer.get() != null, 2000, "server handshake");

        serverPeer.get().close();

        TestWait.until(() -> listener.closed.get() == 1, 2000, "disconnect callback");
        assertFalse(client.isConnected());
        assertThrows(NotConnectedException.class, () -> client.send("frame", 100));
    }

    @Test
    void testRefusedConnectionThrows() {
        int port = port();
        serverChannel.close().syncUninterruptibly();
        client = new WebSocketClient(feedUri(port), "test", listener, false, 0);

        assertThrows(ConnectionException.class, () -> client.connect());
        assertFalse(client.isConnected());
        assertEquals(0, listener.opened.get());
        assertEquals(0, listener.closed.get());
    }

    @Test
    void testSendBeforeConnectThrows() {
        client = new WebSocketClient(feedUri(port()), "test", listener, false, 0);

        assertThrows(NotConnectedException.class, () -> client.send("frame", 100));
    }

    private int port() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    private static URI feedUri(int port) {
        return URI.create("ws://127.0.0.1:" + port + "/feed");
    }

    private static class RecordingListener implements TransportListener {

        final AtomicInteger opened = new AtomicInteger();
        final AtomicInteger closed = new AtomicInteger();
        final List<String> frames = new CopyOnWriteArrayList<>();

        @Override
        public void onOpen() {
            opened.incrementAndGet();
        }

        @Override
        public void onFrame(String frame) {
            frames.add(frame);
        }

        @Override
        public void onError(Throwable error) {
            // not asserted
        }

        @Override
        public void onClosed() {
            closed.incrementAndGet();
        }
    }
}

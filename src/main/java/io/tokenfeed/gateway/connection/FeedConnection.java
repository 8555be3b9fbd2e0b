package io.tokenfeed.gateway.connection;

import io.tokenfeed.gateway.config.FeedConfig;
import io.tokenfeed.gateway.metrics.FeedMetrics;
import io.tokenfeed.gateway.netty.ReconnectHandler;
import io.tokenfeed.gateway.netty.WebSocketClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Supervises the single feed connection.
 *
 * <p>Owns the transport, reconnects with bounded exponential backoff, and exposes the
 * send and receive primitives. Every new connection is announced to the registered
 * {@link ConnectionListener}s on a dedicated control thread so that subscribers can
 * re-subscribe without blocking the I/O thread.
 *
 * <p>Connection failures never reach callers of {@link #connect()}. When the retry budget
 * is exhausted the inbound {@link FrameStream} terminates with a {@link ConnectionClosedException}.
 */
public class FeedConnection implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(FeedConnection.class);

    private final String name;
    private final FeedTransport transport;
    private final ReconnectHandler reconnectHandler;
    private final FrameStream frameStream = new FrameStream();
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService controlExecutor;
    private final long sendTimeoutMs;
    private final FeedMetrics metrics;
    private final AtomicBoolean receiveCalled = new AtomicBoolean(false);

    private volatile boolean started = false;
    private volatile boolean closed = false;

    /**
     * Creates a connection to the configured feed over a Netty WebSocket.
     */
    public FeedConnection(FeedConfig config, FeedMetrics metrics) {
        this(
            config.name(),
            listener -> new WebSocketClient(
                config.feedUri(),
                config.name(),
                listener,
                config.compression(),
                config.pingIntervalMs()
            ),
            config.reconnectMaxRetries(),
            config.reconnectInitialDelayMs(),
            config.reconnectMaxDelayMs(),
            config.sendTimeoutMs(),
            metrics
        );
    }

    /**
     * Creates a connection over an arbitrary transport.
     *
     * @param name                Friendly name for logging
     * @param transportFactory    Creates the transport bound to this connection's callbacks
     * @param maxRetries          Maximum consecutive reconnect attempts (-1 for unlimited)
     * @param initialDelayMs      First reconnect delay
     * @param maxDelayMs          Upper bound of the reconnect delay
     * @param sendTimeoutMs       Write timeout after which the connection is considered lost
     * @param metrics             Metrics sink
     */
    public FeedConnection(
        String name,
        FeedTransport.Factory transportFactory,
        int maxRetries,
        long initialDelayMs,
        long maxDelayMs,
        long sendTimeoutMs,
        FeedMetrics metrics
    ) {
        this.name = name;
        this.sendTimeoutMs = sendTimeoutMs;
        this.metrics = metrics;
        this.transport = transportFactory.create(new Listener());
        this.reconnectHandler = new ReconnectHandler(
            name,
            maxRetries,
            initialDelayMs,
            maxDelayMs,
            this::reconnect,
            this::onRetriesExhausted
        );
        this.controlExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, name.toLowerCase() + "-control");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Registers a listener for connection lifecycle changes.
     */
    public void addConnectionListener(ConnectionListener listener) {
        listeners.add(listener);
    }

    /**
     * Establishes the connection. A failed first attempt is retried in the background.
     */
    public void connect() {
        if (closed) {
            throw new IllegalStateException(name + ": connection is closed");
        }
        if (started) {
            LOGGER.warn("[{}] Already started", name);
            return;
        }
        started = true;
        reconnectHandler.start();

        try {
            transport.connect();
        } catch (ConnectionException e) {
            metrics.recordConnectionError();
            LOGGER.warn("[{}] Initial connection failed, retrying: {}", name, e.getMessage());
            reconnectHandler.scheduleReconnect();
        }
    }

    /**
     * Sends a control frame on the live connection.
     *
     * @throws NotConnectedException if there is no live connection or the write times out;
     *                               a timed out write drops the connection and triggers a reconnect
     */
    public void send(String frame) {
        if (closed || !transport.isConnected()) {
            metrics.recordSendFailure();
            throw new NotConnectedException(name + ": not connected");
        }
        try {
            transport.send(frame, sendTimeoutMs);
            LOGGER.debug("[{}] Sent {}", name, frame);
        } catch (NotConnectedException e) {
            metrics.recordSendFailure();
            LOGGER.warn("[{}] Send failed, dropping connection: {}", name, e.getMessage());
            transport.disconnect();
            throw e;
        }
    }

    /**
     * Returns the inbound frame stream. May only be called once.
     */
    public FrameStream receive() {
        if (!receiveCalled.compareAndSet(false, true)) {
            throw new IllegalStateException(name + ": frame stream already taken");
        }
        return frameStream;
    }

    public boolean isConnected() {
        return !closed && transport.isConnected();
    }

    public String getName() {
        return name;
    }

    public ReconnectHandler getReconnectHandler() {
        return reconnectHandler;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        reconnectHandler.stop();
        try {
            transport.close();
        } finally {
            metrics.setConnectionStatus(false);
            frameStream.terminate(new ConnectionClosedException(name + ": connection closed"));
            controlExecutor.shutdown();
            try {
                if (!controlExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    controlExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                controlExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        LOGGER.info("[{}] Connection closed", name);
    }

    private void reconnect() {
        metrics.recordReconnectAttempt();
        transport.connect();
    }

    private void onRetriesExhausted() {
        LOGGER.error("[{}] Reconnect budget exhausted, closing frame stream", name);
        frameStream.terminate(new ConnectionClosedException(name + ": reconnect retries exhausted"));
    }

    private void notifyListeners(boolean connected) {
        try {
            controlExecutor.execute(() -> fireListeners(connected));
        } catch (RejectedExecutionException e) {
            LOGGER.debug("[{}] Control executor stopped, dropping lifecycle notification", name);
        }
    }

    private void fireListeners(boolean connected) {
        for (ConnectionListener listener : listeners) {
            try {
                if (connected) {
                    listener.onConnected();
                } else {
                    listener.onDisconnected();
                }
            } catch (Exception e) {
                LOGGER.error("[{}] Connection listener failed", name, e);
            }
        }
    }

    private final class Listener implements TransportListener {

        @Override
        public void onOpen() {
            reconnectHandler.reset();
            metrics.setConnectionStatus(true);
            LOGGER.info("[{}] Connected", name);
            notifyListeners(true);
        }

        @Override
        public void onFrame(String frame) {
            metrics.recordFrameReceived();
            frameStream.offer(frame);
        }

        @Override
        public void onError(Throwable error) {
            metrics.recordConnectionError();
            LOGGER.error("[{}] Transport error", name, error);
        }

        @Override
        public void onClosed() {
            metrics.setConnectionStatus(false);
            notifyListeners(false);
            if (closed) {
                return;
            }
            LOGGER.warn("[{}] Disconnected, scheduling reconnect...", name);
            reconnectHandler.scheduleReconnect();
        }
    }
}

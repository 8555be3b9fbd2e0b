package io.tokenfeed.gateway.connection;

/**
 * A single bidirectional text-frame transport to the feed.
 * Implementations report lifecycle and inbound frames to the {@link TransportListener}
 * they were created with.
 */
public interface FeedTransport extends AutoCloseable {

    /**
     * Opens the transport and completes the protocol handshake.
     *
     * @throws ConnectionException if the connection or handshake fails
     */
    void connect();

    /**
     * Writes a text frame, waiting at most {@code timeoutMs} for the write to complete.
     *
     * @throws NotConnectedException if there is no live connection or the write does not complete in time
     */
    void send(String frame, long timeoutMs);

    /**
     * Returns whether the transport currently has a live, handshaken connection.
     */
    boolean isConnected();

    /**
     * Drops the current connection without releasing resources.
     * The listener is notified through {@link TransportListener#onClosed()}.
     */
    void disconnect();

    /**
     * Releases all resources. The transport cannot be reconnected afterwards.
     */
    @Override
    void close();

    /**
     * Creates transports bound to a listener.
     */
    @FunctionalInterface
    interface Factory {
        FeedTransport create(TransportListener listener);
    }
}

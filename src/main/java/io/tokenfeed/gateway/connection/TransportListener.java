package io.tokenfeed.gateway.connection;

/**
 * Callbacks from a {@link FeedTransport}. May be invoked on I/O threads.
 */
public interface TransportListener {

    /**
     * Called once the handshake of a new connection completes.
     */
    void onOpen();

    /**
     * Called for every inbound text frame.
     */
    void onFrame(String frame);

    /**
     * Called on transport errors.
     */
    void onError(Throwable error);

    /**
     * Called when an established connection is lost.
     */
    void onClosed();
}

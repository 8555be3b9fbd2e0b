package io.tokenfeed.gateway.subscription;

/**
 * Destination for encoded control frames, normally {@code FeedConnection::send}.
 */
@FunctionalInterface
public interface FrameSender {

    /**
     * @throws io.tokenfeed.gateway.connection.NotConnectedException if the frame cannot be sent
     */
    void send(String frame);
}

package io.tokenfeed.gateway.connection;

/**
 * A frame could not be sent because there is no live connection,
 * or the write did not complete within the send timeout.
 */
public class NotConnectedException extends RuntimeException {

    public NotConnectedException(String message) {
        super(message);
    }

    public NotConnectedException(String message, Throwable cause) {
        super(message, cause);
    }
}

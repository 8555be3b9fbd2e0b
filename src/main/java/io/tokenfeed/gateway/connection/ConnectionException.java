package io.tokenfeed.gateway.connection;

/**
 * Connection or handshake failure. Retried with backoff by the {@link FeedConnection}.
 */
public class ConnectionException extends RuntimeException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}

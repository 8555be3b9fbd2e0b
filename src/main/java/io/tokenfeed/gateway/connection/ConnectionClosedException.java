package io.tokenfeed.gateway.connection;

/**
 * The inbound frame stream has ended, either because the connection was closed
 * or because the reconnect budget was exhausted.
 */
public class ConnectionClosedException extends RuntimeException {

    public ConnectionClosedException(String message) {
        super(message);
    }
}

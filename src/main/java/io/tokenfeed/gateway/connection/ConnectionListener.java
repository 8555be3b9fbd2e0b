package io.tokenfeed.gateway.connection;

/**
 * Observes connection lifecycle changes of a {@link FeedConnection}.
 * Callbacks run on the connection's control thread, in the order the changes happened.
 */
public interface ConnectionListener {

    /**
     * A new connection is live. It carries no subscriptions yet.
     */
    void onConnected();

    /**
     * The connection was lost.
     */
    default void onDisconnected() {
    }
}

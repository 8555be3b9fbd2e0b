package io.tokenfeed.gateway.dispatch;

import io.tokenfeed.gateway.model.FeedEvent;

/**
 * Handler for one event variant.
 *
 * @param <E> the event variant handled
 */
@FunctionalInterface
public interface FeedEventHandler<E extends FeedEvent> {

    void onEvent(E event) throws Exception;
}

package io.tokenfeed.gateway.dispatch;

import io.tokenfeed.gateway.model.EventType;

/**
 * A registered event handler threw. Isolated to that handler and that event.
 */
public class HandlerFailureException extends RuntimeException {

    private final EventType eventType;

    public HandlerFailureException(EventType eventType, String handler, Throwable cause) {
        super("Handler " + handler + " failed on " + eventType + " event", cause);
        this.eventType = eventType;
    }

    public EventType getEventType() {
        return eventType;
    }
}

package io.tokenfeed.gateway.dispatch;

import io.tokenfeed.gateway.metrics.FeedMetrics;
import io.tokenfeed.gateway.model.FeedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Routes classified events to the handlers registered for their variant.
 *
 * <p>A handler registered for a type receives every event assignable to it, so a
 * {@code FeedEvent} handler sees all variants. Matching handlers run in registration
 * order on the calling thread. A handler
 * that throws is logged and skipped; the remaining handlers still run and later events
 * are unaffected. Malformed frames are logged and dropped.
 */
public class EventDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventDispatcher.class);

    private static final int PREVIEW_LENGTH = 200;

    private final FrameClassifier classifier;
    private final FeedMetrics metrics;
    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    public EventDispatcher(FrameClassifier classifier, FeedMetrics metrics) {
        this.classifier = classifier;
        this.metrics = metrics;
    }

    /**
     * Registers a handler for an event variant or any of its supertypes.
     *
     * @param eventClass The event type, e.g. {@code TradeEvent.class} or {@code FeedEvent.class}
     * @param handler    The handler, invoked after previously registered matching handlers
     */
    public <E extends FeedEvent> void register(Class<E> eventClass, FeedEventHandler<? super E> handler) {
        if (eventClass == null || handler == null) {
            throw new IllegalArgumentException("eventClass and handler cannot be null");
        }
        registrations.add(new Registration(
            eventClass,
            event -> handler.onEvent(eventClass.cast(event)),
            handler.getClass().getName()
        ));
        LOGGER.debug("Registered handler for {}", eventClass.getSimpleName());
    }

    /**
     * Classifies a raw frame and dispatches the resulting event.
     *
     * @return true if an event was dispatched
     */
    public boolean process(String rawFrame) {
        Optional<FeedEvent> event;
        try {
            event = classifier.classify(rawFrame);
        } catch (MalformedFrameException e) {
            metrics.recordMalformedFrame();
            LOGGER.warn("Dropping malformed frame: {} | frame: {}", e.getMessage(), preview(rawFrame));
            return false;
        }
        if (event.isEmpty()) {
            return false;
        }
        dispatch(event.get());
        return true;
    }

    /**
     * Invokes every handler registered for the event's class or one of its supertypes.
     *
     * @return number of handlers that failed
     */
    public int dispatch(FeedEvent event) {
        metrics.recordEventDispatched(event.type().name());

        int failures = 0;
        for (Registration registration : registrations) {
            if (!registration.eventClass().isInstance(event)) {
                continue;
            }
            try {
                registration.handler().onEvent(event);
            } catch (Exception e) {
                failures++;
                HandlerFailureException failure =
                    new HandlerFailureException(event.type(), registration.handlerName(), e);
                metrics.recordHandlerFailure(event.type().name());
                LOGGER.error("{} (mint={})", failure.getMessage(), event.mint(), failure);
            }
        }
        return failures;
    }

    private static String preview(String frame) {
        if (frame == null) {
            return "null";
        }
        return frame.length() > PREVIEW_LENGTH ? frame.substring(0, PREVIEW_LENGTH) + "..." : frame;
    }

    private record Registration(
        Class<? extends FeedEvent> eventClass,
        FeedEventHandler<FeedEvent> handler,
        String handlerName
    ) {
    }
}

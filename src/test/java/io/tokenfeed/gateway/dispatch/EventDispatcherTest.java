package io.tokenfeed.gateway.dispatch;

import io.prometheus.client.CollectorRegistry;
import io.tokenfeed.gateway.metrics.FeedMetrics;
import io.tokenfeed.gateway.model.EventType;
import io.tokenfeed.gateway.model.FeedEvent;
import io.tokenfeed.gateway.model.TokenCreatedEvent;
import io.tokenfeed.gateway.model.TradeEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EventDispatcher.
 */
class EventDispatcherTest {

    private static final String CREATE_FRAME =
        "{\"mint\":\"MINT_A\",\"txType\":\"create\",\"name\":\"Alpha\",\"symbol\":\"ALP\"}";
    private static final String BUY_FRAME =
        "{\"mint\":\"MINT_A\",\"txType\":\"buy\",\"solAmount\":0.5}";

    private FeedMetrics metrics;
    private EventDispatcher dispatcher;
    private final List<String> calls = new ArrayList<>();

    @BeforeEach
    void setUp() {
        metrics = new FeedMetrics(new CollectorRegistry());
        dispatcher = new EventDispatcher(new FrameClassifier(() -> 7), metrics);
    }

    @Test
    void testHandlersRunInRegistrationOrder() {
        dispatcher.register(TokenCreatedEvent.class, event -> calls.add("first:" + event.mint()));
        dispatcher.register(TokenCreatedEvent.class, event -> calls.add("second:" + event.mint()));

        assertTrue(dispatcher.process(CREATE_FRAME));

        assertEquals(List.of("first:MINT_A", "second:MINT_A"), calls);
        assertEquals(1.0, metrics.getEventsDispatched(EventType.CREATED.name()));
    }

    @Test
    void testEventsRouteByVariant() {
        List<TradeEvent> trades = new ArrayList<>();
        dispatcher.register(TokenCreatedEvent.class, event -> calls.add("created"));
        dispatcher.register(TradeEvent.class, trades::add);

        dispatcher.process(BUY_FRAME);

        assertTrue(calls.isEmpty());
        assertEquals(1, trades.size());
        assertEquals(7, trades.get(0).trackedCountAtEvent());
    }

    @Test
    void testSupertypeHandlerReceivesEvent() {
        FeedEventHandler<FeedEvent> any = event -> calls.add(event.type().name());
        dispatcher.register(TradeEvent.class, any);

        dispatcher.process(BUY_FRAME);

        assertEquals(List.of("TRADE"), calls);
    }

    @Test
    void testHandlerRegisteredForFeedEventSeesEveryVariant() {
        dispatcher.register(FeedEvent.class, event -> calls.add("any:" + event.type()));

        assertTrue(dispatcher.process(BUY_FRAME));
        assertTrue(dispatcher.process(CREATE_FRAME));

        assertEquals(List.of("any:TRADE", "any:CREATED"), calls);
    }

    @Test
    void testSupertypeAndVariantHandlersKeepRegistrationOrder() {
        dispatcher.register(TradeEvent.class, event -> calls.add("trade-first"));
        dispatcher.register(FeedEvent.class, event -> calls.add("any"));
        dispatcher.register(TradeEvent.class, event -> calls.add("trade-second"));

        dispatcher.process(BUY_FRAME);

        assertEquals(List.of("trade-first", "any", "trade-second"), calls);
    }

    @Test
    void testFailingHandlerDoesNotStopOthers() {
        dispatcher.register(TokenCreatedEvent.class, event -> {
            throw new IllegalStateException("boom");
        });
        dispatcher.register(TokenCreatedEvent.class, event -> calls.add("after"));

        assertTrue(dispatcher.process(CREATE_FRAME));
        assertTrue(dispatcher.process(CREATE_FRAME));

        assertEquals(List.of("after", "after"), calls);
        assertEquals(2.0, metrics.getHandlerFailures(EventType.CREATED.name()));
    }

    @Test
    void testCheckedExceptionIsContained() {
        dispatcher.register(TradeEvent.class, event -> {
            throw new Exception("checked");
        });

        TradeEvent trade = (TradeEvent) new FrameClassifier(() -> 0).classify(BUY_FRAME).orElseThrow();
        assertEquals(1, dispatcher.dispatch(trade));
    }

    @Test
    void testMalformedFrameDropped() {
        dispatcher.register(TokenCreatedEvent.class, event -> calls.add("created"));

        assertFalse(dispatcher.process("{\"txType\":\"create\"}"));
        assertFalse(dispatcher.process("garbage"));

        assertTrue(calls.isEmpty());
        assertEquals(2.0, metrics.getMalformedFrames());

        // the dispatcher keeps working after malformed input
        assertTrue(dispatcher.process(CREATE_FRAME));
        assertEquals(List.of("created"), calls);
    }

    @Test
    void testReplyFrameIsNotDispatched() {
        dispatcher.register(TokenCreatedEvent.class, event -> calls.add("created"));

        assertFalse(dispatcher.process("{\"message\":\"Successfully subscribed to keys.\"}"));

        assertTrue(calls.isEmpty());
        assertEquals(0.0, metrics.getMalformedFrames());
    }

    @Test
    void testNoHandlersIsNotAnError() {
        assertTrue(dispatcher.process(BUY_FRAME));
    }

    @Test
    void testRegisterRejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> dispatcher.register(TradeEvent.class, null));
    }
}

package io.tokenfeed.gateway.subscription;

import io.tokenfeed.gateway.model.ControlFrame;
import io.tokenfeed.gateway.model.SubscriptionKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ControlFrameEncoder.
 */
class ControlFrameEncoderTest {

    private final ControlFrameEncoder encoder = new ControlFrameEncoder();

    @Test
    void testEncodeTokenTradeSubscribe() {
        ControlFrame frame = new ControlFrame(
            SubscriptionKind.TOKEN_TRADE, ControlFrame.Action.SUBSCRIBE, List.of("MINT_A", "MINT_B"));

        assertEquals("{\"method\":\"subscribeTokenTrade\",\"keys\":[\"MINT_A\",\"MINT_B\"]}", encoder.encode(frame));
    }

    @Test
    void testEncodeTokenTradeUnsubscribe() {
        ControlFrame frame = new ControlFrame(
            SubscriptionKind.TOKEN_TRADE, ControlFrame.Action.UNSUBSCRIBE, List.of("MINT_A"));

        assertEquals("{\"method\":\"unsubscribeTokenTrade\",\"keys\":[\"MINT_A\"]}", encoder.encode(frame));
    }

    @Test
    void testEncodeNewTokenOmitsKeys() {
        ControlFrame frame = new ControlFrame(
            SubscriptionKind.NEW_TOKEN, ControlFrame.Action.SUBSCRIBE, List.of(SubscriptionKind.NEW_TOKEN_TOPIC));

        assertEquals("{\"method\":\"subscribeNewToken\"}", encoder.encode(frame));
    }

    @Test
    void testEmptyTopicListRejected() {
        assertThrows(IllegalArgumentException.class, () ->
            new ControlFrame(SubscriptionKind.TOKEN_TRADE, ControlFrame.Action.SUBSCRIBE, List.of()));
    }

    @Test
    void testTopicsAreCopied() {
        List<String> topics = new ArrayList<>(List.of("MINT_A"));
        ControlFrame frame = new ControlFrame(SubscriptionKind.TOKEN_TRADE, ControlFrame.Action.SUBSCRIBE, topics);
        topics.add("MINT_B");

        assertEquals(List.of("MINT_A"), frame.topics());
    }
}

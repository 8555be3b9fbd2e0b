package io.tokenfeed.gateway.model;

import java.util.List;

/**
 * An outbound subscribe or unsubscribe request.
 *
 * @param kind   Subscription kind the request applies to
 * @param action Subscribe or unsubscribe
 * @param topics Topics to add or remove, never empty
 */
public record ControlFrame(
    SubscriptionKind kind,
    Action action,
    List<String> topics
) {
    public ControlFrame {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (topics == null || topics.isEmpty()) {
            throw new IllegalArgumentException("topics cannot be null or empty");
        }
        topics = List.copyOf(topics);
    }

    public enum Action {
        SUBSCRIBE,
        UNSUBSCRIBE
    }
}

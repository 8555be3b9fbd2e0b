package io.tokenfeed.gateway.model;

/**
 * Subscription streams offered by the feed.
 * Each kind keeps its own desired and active topic sets.
 */
public enum SubscriptionKind {
    /** New token discovery stream. Not keyed on the wire. */
    NEW_TOKEN("subscribeNewToken", "unsubscribeNewToken", false),
    /** Per-mint trade stream. */
    TOKEN_TRADE("subscribeTokenTrade", "unsubscribeTokenTrade", true);

    /**
     * The single topic that stands for the discovery stream in the NEW_TOKEN sets.
     */
    public static final String NEW_TOKEN_TOPIC = "newToken";

    private final String subscribeMethod;
    private final String unsubscribeMethod;
    private final boolean keyed;

    SubscriptionKind(String subscribeMethod, String unsubscribeMethod, boolean keyed) {
        this.subscribeMethod = subscribeMethod;
        this.unsubscribeMethod = unsubscribeMethod;
        this.keyed = keyed;
    }

    public String subscribeMethod() {
        return subscribeMethod;
    }

    public String unsubscribeMethod() {
        return unsubscribeMethod;
    }

    /**
     * Whether control frames for this kind carry a list of keys.
     */
    public boolean keyed() {
        return keyed;
    }

    public static SubscriptionKind fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("subscription kind cannot be null");
        }
        return switch (value.trim().toLowerCase()) {
            case "new_token", "newtoken", "new-token" -> NEW_TOKEN;
            case "token_trade", "tokentrade", "token-trade", "trade" -> TOKEN_TRADE;
            default -> throw new IllegalArgumentException("Unknown subscription kind: " + value);
        };
    }
}

package io.tokenfeed.gateway.subscription;

import io.tokenfeed.gateway.connection.ConnectionListener;
import io.tokenfeed.gateway.connection.NotConnectedException;
import io.tokenfeed.gateway.metrics.FeedMetrics;
import io.tokenfeed.gateway.model.ControlFrame;
import io.tokenfeed.gateway.model.SubscriptionKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tracks desired and active topics per subscription kind and converges them.
 *
 * <p>Each kind has its own lock; mutations, reads and reconciliation of one kind are
 * serialized, while different kinds proceed independently. Control frames are sent while
 * holding the kind's lock, so a re-subscribe after reconnect never interleaves with a
 * reconcile of the same kind.
 *
 * <p>The feed does not acknowledge subscriptions, so the active set is updated as soon as
 * a frame has been written. A failed write leaves the active set untouched; the next
 * connection re-subscribes the full desired set.
 */
public class SubscriptionManager implements ConnectionListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(SubscriptionManager.class);

    private final FrameSender sender;
    private final ControlFrameEncoder encoder;
    private final FeedMetrics metrics;
    private final Map<SubscriptionKind, TopicSet> topicSets = new EnumMap<>(SubscriptionKind.class);

    public SubscriptionManager(FrameSender sender, ControlFrameEncoder encoder, FeedMetrics metrics) {
        this.sender = sender;
        this.encoder = encoder;
        this.metrics = metrics;
        for (SubscriptionKind kind : SubscriptionKind.values()) {
            topicSets.put(kind, new TopicSet(kind));
        }
    }

    /**
     * Replaces the desired set of a kind. Does not send anything until {@link #reconcile}.
     */
    public void setDesired(SubscriptionKind kind, Collection<String> topics) {
        validate(kind, topics);
        TopicSet set = topicSets.get(kind);
        set.lock.lock();
        try {
            set.desired.clear();
            set.desired.addAll(topics);
            publishCounts(set);
        } finally {
            set.lock.unlock();
        }
    }

    /**
     * Adds topics to the desired set of a kind.
     *
     * @return true if at least one topic was not desired before
     */
    public boolean addDesired(SubscriptionKind kind, Collection<String> topics) {
        validate(kind, topics);
        TopicSet set = topicSets.get(kind);
        set.lock.lock();
        try {
            boolean changed = set.desired.addAll(topics);
            publishCounts(set);
            return changed;
        } finally {
            set.lock.unlock();
        }
    }

    public boolean addDesired(SubscriptionKind kind, String... topics) {
        return addDesired(kind, Arrays.asList(topics));
    }

    /**
     * Adds topics only while the desired set stays within {@code limit} entries (0 for no limit).
     *
     * @return true if the topics were added
     */
    public boolean addDesiredWithin(SubscriptionKind kind, String topic, int limit) {
        validate(kind, List.of(topic));
        TopicSet set = topicSets.get(kind);
        set.lock.lock();
        try {
            if (set.desired.contains(topic)) {
                return false;
            }
            if (limit > 0 && set.desired.size() >= limit) {
                LOGGER.info("[{}] Desired set at limit ({}), ignoring {}", kind, limit, topic);
                return false;
            }
            set.desired.add(topic);
            publishCounts(set);
            return true;
        } finally {
            set.lock.unlock();
        }
    }

    /**
     * Removes topics from the desired set of a kind.
     *
     * @return true if at least one topic was desired before
     */
    public boolean removeDesired(SubscriptionKind kind, Collection<String> topics) {
        validate(kind, topics);
        TopicSet set = topicSets.get(kind);
        set.lock.lock();
        try {
            boolean changed = set.desired.removeAll(topics);
            publishCounts(set);
            return changed;
        } finally {
            set.lock.unlock();
        }
    }

    public boolean removeDesired(SubscriptionKind kind, String... topics) {
        return removeDesired(kind, Arrays.asList(topics));
    }

    /**
     * Sends the minimal subscribe and unsubscribe frames that make the active set of a kind
     * equal to its desired set. Never sends an empty topic list; a second call without an
     * intervening change sends nothing.
     *
     * @return number of control frames sent
     */
    public int reconcile(SubscriptionKind kind) {
        TopicSet set = topicSets.get(kind);
        set.lock.lock();
        try {
            return reconcileLocked(set);
        } finally {
            set.lock.unlock();
        }
    }

    /**
     * Reconciles every subscription kind.
     *
     * @return number of control frames sent
     */
    public int reconcileAll() {
        int sent = 0;
        for (SubscriptionKind kind : SubscriptionKind.values()) {
            sent += reconcile(kind);
        }
        return sent;
    }

    /**
     * A new connection carries no subscriptions: forget the active sets and re-subscribe
     * everything that is desired.
     */
    @Override
    public void onConnected() {
        for (TopicSet set : topicSets.values()) {
            set.lock.lock();
            try {
                if (!set.active.isEmpty()) {
                    LOGGER.info("[{}] New connection, re-subscribing {} topic(s)", set.kind, set.desired.size());
                }
                set.active.clear();
                reconcileLocked(set);
            } finally {
                set.lock.unlock();
            }
        }
    }

    @Override
    public void onDisconnected() {
        for (TopicSet set : topicSets.values()) {
            set.lock.lock();
            try {
                set.active.clear();
                publishCounts(set);
            } finally {
                set.lock.unlock();
            }
        }
    }

    /**
     * Number of desired topics of a kind, read atomically with respect to mutations.
     */
    public int desiredCount(SubscriptionKind kind) {
        TopicSet set = topicSets.get(kind);
        set.lock.lock();
        try {
            return set.desired.size();
        } finally {
            set.lock.unlock();
        }
    }

    public boolean isDesired(SubscriptionKind kind, String topic) {
        TopicSet set = topicSets.get(kind);
        set.lock.lock();
        try {
            return set.desired.contains(topic);
        } finally {
            set.lock.unlock();
        }
    }

    /**
     * Snapshot of the desired topics of a kind.
     */
    public Set<String> desired(SubscriptionKind kind) {
        TopicSet set = topicSets.get(kind);
        set.lock.lock();
        try {
            return Set.copyOf(set.desired);
        } finally {
            set.lock.unlock();
        }
    }

    /**
     * Snapshot of the topics believed subscribed on the live connection.
     */
    public Set<String> active(SubscriptionKind kind) {
        TopicSet set = topicSets.get(kind);
        set.lock.lock();
        try {
            return Set.copyOf(set.active);
        } finally {
            set.lock.unlock();
        }
    }

    private int reconcileLocked(TopicSet set) {
        List<String> toAdd = set.toAdd();
        List<String> toRemove = set.toRemove();
        int sent = 0;

        try {
            if (!toAdd.isEmpty()) {
                if (!sendFrame(new ControlFrame(set.kind, ControlFrame.Action.SUBSCRIBE, toAdd))) {
                    return sent;
                }
                set.active.addAll(toAdd);
                sent++;
            }

            if (!toRemove.isEmpty()) {
                if (!sendFrame(new ControlFrame(set.kind, ControlFrame.Action.UNSUBSCRIBE, toRemove))) {
                    return sent;
                }
                toRemove.forEach(set.active::remove);
                sent++;
            }
        } finally {
            publishCounts(set);
        }
        return sent;
    }

    private boolean sendFrame(ControlFrame frame) {
        String encoded = encoder.encode(frame);
        try {
            sender.send(encoded);
        } catch (NotConnectedException e) {
            LOGGER.warn("[{}] {} of {} topic(s) deferred until reconnect: {}",
                frame.kind(), frame.action(), frame.topics().size(), e.getMessage());
            return false;
        }
        metrics.recordControlFrameSent(frame);
        LOGGER.info("[{}] {} {} topic(s): {}", frame.kind(), frame.action(), frame.topics().size(), frame.topics());
        return true;
    }

    private void publishCounts(TopicSet set) {
        metrics.setTopicCounts(set.kind, set.desired.size(), set.active.size());
    }

    private static void validate(SubscriptionKind kind, Collection<String> topics) {
        if (topics == null) {
            throw new IllegalArgumentException("topics cannot be null");
        }
        for (String topic : topics) {
            if (topic == null || topic.isBlank()) {
                throw new IllegalArgumentException("topic cannot be null or blank");
            }
            // unkeyed frames name no topic, so the kind has exactly one
            if (!kind.keyed() && !SubscriptionKind.NEW_TOKEN_TOPIC.equals(topic)) {
                throw new IllegalArgumentException(
                    kind + " only accepts the topic " + SubscriptionKind.NEW_TOKEN_TOPIC + ", got: " + topic);
            }
        }
    }
}

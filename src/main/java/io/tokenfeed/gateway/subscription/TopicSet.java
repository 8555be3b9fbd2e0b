package io.tokenfeed.gateway.subscription;

import io.tokenfeed.gateway.model.SubscriptionKind;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Desired and active topics of one subscription kind. All access goes through {@link #lock}.
 */
final class TopicSet {

    final SubscriptionKind kind;
    final ReentrantLock lock = new ReentrantLock();
    final Set<String> desired = new LinkedHashSet<>();
    final Set<String> active = new LinkedHashSet<>();

    TopicSet(SubscriptionKind kind) {
        this.kind = kind;
    }

    /**
     * Desired topics not yet active, in desired order.
     */
    List<String> toAdd() {
        List<String> result = new ArrayList<>();
        for (String topic : desired) {
            if (!active.contains(topic)) {
                result.add(topic);
            }
        }
        return result;
    }

    /**
     * Active topics no longer desired, in subscription order.
     */
    List<String> toRemove() {
        List<String> result = new ArrayList<>();
        for (String topic : active) {
            if (!desired.contains(topic)) {
                result.add(topic);
            }
        }
        return result;
    }
}

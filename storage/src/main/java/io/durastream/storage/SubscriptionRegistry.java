package io.durastream.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Subscribers of one stream instance, in registration order.
 * <p>
 * Each stream owns its registry, so a stream that was deleted and created
 * again under the same path starts with an empty one. Mutations happen under
 * the stream's lock in the store; the list is copy-on-write so fan-out can
 * iterate a stable snapshot while listeners cancel themselves.
 */
final class SubscriptionRegistry {

    private final CopyOnWriteArrayList<Subscription> subs = new CopyOnWriteArrayList<>();

    Subscription register(String path, String offset, SubscriptionListener listener) {
        Subscription sub = new Subscription(path, offset, listener, this);
        subs.add(sub);
        return sub;
    }

    /** Snapshot of active subscribers. */
    List<Subscription> snapshot() {
        return List.copyOf(subs);
    }

    /** Remove and return every subscriber. */
    List<Subscription> drain() {
        List<Subscription> out = new ArrayList<>(subs);
        subs.removeAll(out);
        return out;
    }

    void remove(Subscription sub) {
        subs.remove(sub);
    }

    int size() {
        return subs.size();
    }
}

package io.durastream.storage;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle for one registered subscriber.
 * <p>
 * {@link #cancel()} is idempotent and safe to call at any time, including
 * from inside the listener and after the store has been torn down.
 */
public final class Subscription {

    private final String path;
    private final SubscriptionListener listener;
    private final SubscriptionRegistry owner;
    private final AtomicBoolean active = new AtomicBoolean(true);

    // Guarded by the owning stream's lock.
    private String offset;

    Subscription(String path, String offset, SubscriptionListener listener, SubscriptionRegistry owner) {
        this.path = Objects.requireNonNull(path, "path");
        this.offset = Objects.requireNonNull(offset, "offset");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.owner = owner;
    }

    /** A handle that was never registered, e.g. a terminal event was delivered at subscribe time. */
    static Subscription inactive(String path, String offset, SubscriptionListener listener) {
        Subscription s = new Subscription(path, offset, listener, null);
        s.active.set(false);
        return s;
    }

    public void cancel() {
        if (active.compareAndSet(true, false) && owner != null) {
            owner.remove(this);
        }
    }

    public boolean isActive() {
        return active.get();
    }

    public String path() {
        return path;
    }

    /** Last offset delivered to (or requested by) this subscriber. */
    public synchronized String offset() {
        return offset;
    }

    synchronized void advanceTo(String newOffset) {
        this.offset = newOffset;
    }

    SubscriptionListener listener() {
        return listener;
    }

    /** Mark inactive without touching the registry (the registry is dropping it itself). */
    boolean deactivate() {
        return active.compareAndSet(true, false);
    }
}

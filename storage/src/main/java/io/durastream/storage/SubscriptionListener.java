package io.durastream.storage;

/**
 * Callback for stream events.
 * <p>
 * Invoked synchronously on the thread performing the mutation, while the
 * store already reflects the new state. Implementations must not block.
 */
@FunctionalInterface
public interface SubscriptionListener {
    void onEvent(SubscriptionEvent event);
}

package io.durastream.storage;

import io.durastream.core.StreamMessage;

import java.util.List;
import java.util.Objects;

/**
 * Event delivered to a subscriber.
 * <p>
 * Variants:
 *  - APPEND: {@link #messages()} holds only the records the subscriber has not seen yet.
 *  - CLOSED: stream became terminal; {@link #offset()} is the final offset.
 *  - ERROR:  stream deleted/expired, or the subscription was force-cancelled;
 *            {@link #reason()} says which. No further events follow.
 */
public record SubscriptionEvent(Type type, List<StreamMessage> messages, String offset, String reason) {

    public enum Type { APPEND, CLOSED, ERROR }

    public SubscriptionEvent {
        Objects.requireNonNull(type, "type");
        messages = List.copyOf(messages);
    }

    public static SubscriptionEvent append(List<StreamMessage> messages) {
        return new SubscriptionEvent(Type.APPEND, messages, messages.get(messages.size() - 1).offset(), null);
    }

    public static SubscriptionEvent closed(String finalOffset) {
        return new SubscriptionEvent(Type.CLOSED, List.of(), finalOffset, null);
    }

    public static SubscriptionEvent error(String reason) {
        return new SubscriptionEvent(Type.ERROR, List.of(), null, reason);
    }

    public boolean isTerminal() {
        return type != Type.APPEND;
    }
}

package io.durastream.storage;

import io.durastream.core.Offset;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Subscriber fan-out: ordering, backlog, terminal events and cancellation.
 */
class StreamSubscriptionTest {

    private final InMemoryStreamStore store = new InMemoryStreamStore();

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(SubscriptionEvent e) {
        StringBuilder sb = new StringBuilder();
        e.messages().forEach(m -> sb.append(new String(m.data(), StandardCharsets.UTF_8)));
        return sb.toString();
    }

    @Test
    void subscriber_receives_only_new_messages_in_order() {
        store.create("/s", CreateOptions.defaults());
        store.append("/s", b("old"));

        List<SubscriptionEvent> events = new ArrayList<>();
        var sub = store.subscribe("/s", Offset.NOW, events::add);

        store.append("/s", b("a"));
        store.append("/s", b("b"));

        assertEquals(2, events.size());
        assertEquals("a", text(events.get(0)));
        assertEquals("b", text(events.get(1)));
        assertEquals(events.get(1).offset(), sub.offset());
        assertTrue(sub.isActive());
    }

    @Test
    void backlog_is_delivered_during_subscribe() {
        store.create("/s", CreateOptions.defaults());
        String first = store.append("/s", b("a")).offset();
        store.append("/s", b("b"));
        store.append("/s", b("c"));

        List<SubscriptionEvent> events = new ArrayList<>();
        store.subscribe("/s", first, events::add);

        assertEquals(1, events.size());
        assertEquals("bc", text(events.get(0)));
    }

    @Test
    void subscribers_are_notified_in_registration_order() {
        store.create("/s", CreateOptions.defaults());
        List<String> order = new ArrayList<>();
        store.subscribe("/s", Offset.NOW, e -> order.add("first"));
        store.subscribe("/s", Offset.NOW, e -> order.add("second"));

        store.append("/s", b("x"));

        assertEquals(List.of("first", "second"), order);
    }

    @Test
    void close_sends_terminal_event_and_drops_subscribers() {
        store.create("/s", CreateOptions.defaults());
        List<SubscriptionEvent> events = new ArrayList<>();
        var sub = store.subscribe("/s", Offset.NOW, events::add);

        String tail = store.append("/s", b("x")).offset();
        store.closeStream("/s");

        assertEquals(2, events.size());
        assertEquals(SubscriptionEvent.Type.CLOSED, events.get(1).type());
        assertEquals(tail, events.get(1).offset());
        assertFalse(sub.isActive());
        assertEquals(0, store.subscriptionCount());
    }

    @Test
    void subscribing_to_closed_stream_at_tail_resolves_immediately() {
        store.create("/s", CreateOptions.defaults());
        store.append("/s", b("x"));
        store.closeStream("/s");

        List<SubscriptionEvent> events = new ArrayList<>();
        var sub = store.subscribe("/s", Offset.NOW, events::add);

        assertEquals(1, events.size());
        assertTrue(events.get(0).isTerminal());
        assertFalse(sub.isActive());
    }

    @Test
    void subscribing_behind_a_closed_tail_gets_backlog_then_close() {
        store.create("/s", CreateOptions.defaults());
        store.append("/s", b("x"));
        store.closeStream("/s");

        List<SubscriptionEvent> events = new ArrayList<>();
        store.subscribe("/s", Offset.BEGINNING, events::add);

        assertEquals(2, events.size());
        assertEquals("x", text(events.get(0)));
        assertEquals(SubscriptionEvent.Type.CLOSED, events.get(1).type());
        assertEquals(0, store.subscriptionCount());
    }

    @Test
    void delete_sends_error_event() {
        store.create("/s", CreateOptions.defaults());
        List<SubscriptionEvent> events = new ArrayList<>();
        store.subscribe("/s", Offset.NOW, events::add);

        store.delete("/s");

        assertEquals(1, events.size());
        assertEquals(SubscriptionEvent.Type.ERROR, events.get(0).type());
        assertEquals("deleted", events.get(0).reason());
    }

    @Test
    void cancel_is_idempotent_and_stops_delivery() {
        store.create("/s", CreateOptions.defaults());
        List<SubscriptionEvent> events = new ArrayList<>();
        var sub = store.subscribe("/s", Offset.NOW, events::add);

        sub.cancel();
        sub.cancel();
        store.append("/s", b("x"));

        assertTrue(events.isEmpty());
        assertEquals(0, store.subscriptionCount());
    }

    @Test
    void listener_may_cancel_itself_during_delivery() {
        store.create("/s", CreateOptions.defaults());
        List<SubscriptionEvent> events = new ArrayList<>();
        Subscription[] self = new Subscription[1];
        self[0] = store.subscribe("/s", Offset.NOW, e -> {
            events.add(e);
            self[0].cancel();
        });

        store.append("/s", b("a"));
        store.append("/s", b("b"));

        assertEquals(1, events.size());
    }

    @Test
    void failing_listener_is_cancelled_without_affecting_others() {
        store.create("/s", CreateOptions.defaults());
        var bad = store.subscribe("/s", Offset.NOW, e -> {
            throw new IllegalStateException("boom");
        });
        List<SubscriptionEvent> good = new ArrayList<>();
        store.subscribe("/s", Offset.NOW, good::add);

        assertDoesNotThrow(() -> store.append("/s", b("a")));
        store.append("/s", b("b"));

        assertFalse(bad.isActive());
        assertEquals(2, good.size());
    }

    @Test
    void cancel_all_resolves_every_subscriber() {
        store.create("/a", CreateOptions.defaults());
        store.create("/b", CreateOptions.defaults());
        List<SubscriptionEvent> events = new ArrayList<>();
        store.subscribe("/a", Offset.NOW, events::add);
        store.subscribe("/b", Offset.NOW, events::add);

        store.cancelAllSubscriptions();

        assertEquals(2, events.size());
        events.forEach(e -> assertEquals("cancelled", e.reason()));
        assertEquals(0, store.subscriptionCount());
    }

    @Test
    void delete_racing_a_recreate_leaves_new_stream_subscribers_alone() throws Exception {
        store.create("/p", CreateOptions.defaults());
        CountDownLatch insideListener = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        // Holds the old stream's lock from inside its append callback.
        store.subscribe("/p", Offset.NOW, e -> {
            if (e.type() == SubscriptionEvent.Type.APPEND) {
                insideListener.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                }
            }
        });

        Thread appender = new Thread(() -> store.append("/p", b("old")));
        appender.start();
        assertTrue(insideListener.await(5, TimeUnit.SECONDS));

        // Unlinks /p at once, then parks on the old stream's lock.
        Thread deleter = new Thread(() -> store.delete("/p"));
        deleter.start();
        long deadline = System.currentTimeMillis() + 5_000;
        while (store.has("/p") && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertFalse(store.has("/p"));

        store.create("/p", CreateOptions.defaults());
        List<SubscriptionEvent> events = new CopyOnWriteArrayList<>();
        var sub = store.subscribe("/p", Offset.NOW, events::add);

        release.countDown();
        appender.join(5_000);
        deleter.join(5_000);

        assertTrue(events.isEmpty(), "new stream got " + events);
        assertTrue(sub.isActive());
        assertTrue(store.has("/p"));

        store.append("/p", b("new"));
        assertEquals(1, events.size());
        assertEquals("new", text(events.get(0)));
    }
}

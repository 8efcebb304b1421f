package io.durastream.storage;

import io.durastream.core.ContentTypes;
import io.durastream.core.JsonFraming;
import io.durastream.core.Offset;
import io.durastream.core.StreamMessage;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory {@link StreamStore}.
 * <p>
 * Responsibilities:
 *  - Keep one append-only message list per path plus its tail offset.
 *  - Validate producers, writer seqs, content types and JSON framing.
 *  - Fan events out to subscribers synchronously.
 *  - Expire streams lazily once their TTL / expiry instant has passed.
 * <p>
 * Concurrency:
 *  - The path -> stream map is concurrent.
 *  - Every operation touching one stream (mutation, read, subscribe) runs
 *    while holding that stream's monitor, so history and tail are always
 *    observed together and events for a path are delivered in order.
 *  - Listeners run on the mutating thread while the monitor is held; they
 *    may call back into the store for the same path (monitors are reentrant)
 *    but must not block.
 */
public class InMemoryStreamStore implements StreamStore {
    private static final Logger log = Logger.getLogger(InMemoryStreamStore.class.getName());

    public static final Duration DEFAULT_PRODUCER_TTL = Duration.ofDays(7);

    private final Map<String, StreamState> streams = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration producerTtl;

    public InMemoryStreamStore() {
        this(Clock.systemUTC(), DEFAULT_PRODUCER_TTL);
    }

    public InMemoryStreamStore(Clock clock, Duration producerTtl) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.producerTtl = Objects.requireNonNull(producerTtl, "producerTtl");
    }

    @Override
    public boolean has(String path) {
        return live(path) != null;
    }

    @Override
    public StreamMetadata get(String path) {
        StreamState s = live(path);
        if (s == null) {
            return null;
        }
        synchronized (s) {
            return s.removed ? null : s.snapshot();
        }
    }

    @Override
    public StreamMetadata create(String path, CreateOptions options) {
        requirePath(path);
        Objects.requireNonNull(options, "options");
        if (options.ttlSeconds() != null && options.expiresAt() != null) {
            throw StoreException.validation("Cannot specify both ttlSeconds and expiresAt");
        }
        if (options.ttlSeconds() != null && options.ttlSeconds() < 0) {
            throw StoreException.validation("ttlSeconds must be >= 0");
        }

        // Drops an expired predecessor so the path can be reused.
        live(path);

        StreamState fresh = new StreamState(
                path,
                options.contentType(),
                options.ttlSeconds(),
                options.expiresAt(),
                clock.millis(),
                new ProducerRegistry(clock, producerTtl)
        );

        synchronized (fresh) {
            byte[] initial = options.initialData();
            if (initial != null && initial.length > 0) {
                appendRecord(fresh, initial, true);
            }
            fresh.closed = options.closed();

            StreamState prev = streams.putIfAbsent(path, fresh);
            if (prev != null) {
                throw StoreException.conflict("Stream already exists: " + path);
            }
            log.fine(() -> "created stream " + path + " contentType=" + options.contentType());
            return fresh.snapshot();
        }
    }

    @Override
    public AppendResult append(String path, byte[] data, AppendOptions options) {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(options, "options");
        StreamState s = require(path);

        synchronized (s) {
            ensureNotRemoved(s);
            ProducerInfo producer = options.producer();

            if (s.closed) {
                // Retry of the append-and-close that closed the stream.
                if (producer != null && producer.equals(s.closedBy)) {
                    return new AppendResult(s.current.render(), true, true);
                }
                throw new StreamClosedException(path, s.current.render());
            }

            if (options.contentType() != null && s.contentType != null
                    && !ContentTypes.normalize(options.contentType()).equals(ContentTypes.normalize(s.contentType))) {
                throw StoreException.conflict(
                        "Content-type mismatch: expected " + s.contentType + ", got " + options.contentType());
            }

            if (producer != null) {
                ProducerRegistry.Decision decision = s.producers.validate(producer);
                if (decision.duplicate()) {
                    return new AppendResult(decision.duplicateOffset(), true, false);
                }
            }

            if (options.seq() != null && s.lastWriterSeq != null && options.seq().compareTo(s.lastWriterSeq) <= 0) {
                throw StoreException.conflict("Sequence conflict: " + options.seq() + " <= " + s.lastWriterSeq);
            }

            StreamMessage message = appendRecord(s, data, false);

            if (producer != null) {
                s.producers.commit(producer, message.offset());
            }
            if (options.seq() != null) {
                s.lastWriterSeq = options.seq();
            }

            notifyAppended(s, message);

            if (options.close()) {
                s.closed = true;
                s.closedBy = producer;
                notifyClosed(s);
            }
            return new AppendResult(message.offset(), false, options.close());
        }
    }

    @Override
    public ReadResult read(String path, String offset, int maxMessages) {
        if (maxMessages < 0) {
            throw new IllegalArgumentException("maxMessages must be >= 0");
        }
        StreamState s = require(path);

        synchronized (s) {
            ensureNotRemoved(s);
            String current = s.current.render();
            String from = resolve(offset, current);
            boolean upToDate = from.equals(current);

            int start = firstAfter(s.messages, from);
            int end = s.messages.size();
            if (maxMessages > 0) {
                end = Math.min(end, start + maxMessages);
            }
            List<StreamMessage> page = List.copyOf(s.messages.subList(start, end));
            return new ReadResult(page, upToDate, current, s.closed);
        }
    }

    @Override
    public Subscription subscribe(String path, String offset, SubscriptionListener listener) {
        Objects.requireNonNull(listener, "listener");
        StreamState s = require(path);

        synchronized (s) {
            ensureNotRemoved(s);
            String current = s.current.render();
            String from = resolve(offset, current);
            List<StreamMessage> backlog = List.copyOf(s.messages.subList(firstAfter(s.messages, from), s.messages.size()));

            if (s.closed && backlog.isEmpty()) {
                Subscription done = Subscription.inactive(path, from, listener);
                deliver(done, SubscriptionEvent.closed(current));
                return done;
            }

            Subscription sub = s.subscribers.register(path, from, listener);
            if (!backlog.isEmpty()) {
                sub.advanceTo(current);
                deliver(sub, SubscriptionEvent.append(backlog));
            }
            if (s.closed && sub.deactivate()) {
                s.subscribers.remove(sub);
                deliver(sub, SubscriptionEvent.closed(current));
            }
            return sub;
        }
    }

    @Override
    public CloseResult closeStream(String path) {
        StreamState s = require(path);
        synchronized (s) {
            ensureNotRemoved(s);
            boolean alreadyClosed = s.closed;
            if (!alreadyClosed) {
                s.closed = true;
                notifyClosed(s);
                log.fine(() -> "closed stream " + path + " at " + s.current);
            }
            return new CloseResult(s.current.render(), alreadyClosed, false);
        }
    }

    @Override
    public CloseResult closeStreamWithProducer(String path, ProducerInfo producer) {
        Objects.requireNonNull(producer, "producer");
        StreamState s = require(path);

        synchronized (s) {
            ensureNotRemoved(s);
            String current = s.current.render();

            if (s.closed) {
                if (producer.equals(s.closedBy)) {
                    return new CloseResult(current, true, true);
                }
                throw new StreamClosedException(path, current);
            }

            ProducerRegistry.Decision decision = s.producers.validate(producer);
            if (decision.duplicate()) {
                // Retransmit of an earlier append; it must not close the stream.
                return new CloseResult(current, false, true);
            }

            s.producers.commit(producer, current);
            s.closed = true;
            s.closedBy = producer;
            notifyClosed(s);
            return new CloseResult(current, false, false);
        }
    }

    @Override
    public boolean delete(String path) {
        StreamState s = streams.remove(path);
        if (s == null) {
            return false;
        }
        synchronized (s) {
            s.removed = true;
            notifyError(s, "deleted");
        }
        log.fine(() -> "deleted stream " + path);
        return true;
    }

    @Override
    public void cancelAllSubscriptions() {
        int cancelled = 0;
        for (StreamState s : streams.values()) {
            synchronized (s) {
                for (Subscription sub : s.subscribers.drain()) {
                    if (sub.deactivate()) {
                        deliver(sub, SubscriptionEvent.error("cancelled"));
                        cancelled++;
                    }
                }
            }
        }
        if (cancelled > 0) {
            int n = cancelled;
            log.info(() -> "cancelled " + n + " subscription(s)");
        }
    }

    @Override
    public List<String> list() {
        List<String> out = new ArrayList<>();
        for (String path : streams.keySet()) {
            if (live(path) != null) {
                out.add(path);
            }
        }
        return out;
    }

    /** Number of registered (active) subscriptions across all streams. */
    public int subscriptionCount() {
        int n = 0;
        for (StreamState s : streams.values()) {
            n += s.subscribers.size();
        }
        return n;
    }

    // ---------- internals ----------

    private StreamState live(String path) {
        StreamState s = streams.get(path);
        if (s == null) {
            return null;
        }
        if (s.isExpired(clock.millis())) {
            if (streams.remove(path, s)) {
                synchronized (s) {
                    s.removed = true;
                    notifyError(s, "expired");
                }
                log.fine(() -> "expired stream " + path);
            }
            return null;
        }
        return s;
    }

    private StreamState require(String path) {
        StreamState s = live(path);
        if (s == null) {
            throw StoreException.notFound(path);
        }
        return s;
    }

    private static void ensureNotRemoved(StreamState s) {
        if (s.removed) {
            throw StoreException.notFound(s.path);
        }
    }

    private static void requirePath(String path) {
        if (path == null || path.isEmpty()) {
            throw StoreException.validation("stream path must not be empty");
        }
    }

    /** Concrete, canonical offset to read after. */
    private static String resolve(String offset, String current) {
        if (Offset.isBeginning(offset)) {
            return Offset.ZERO.render();
        }
        if (Offset.NOW.equals(offset)) {
            return current;
        }
        try {
            return Offset.parse(offset).render();
        } catch (IllegalArgumentException e) {
            throw StoreException.validation("Invalid offset format: " + offset, e);
        }
    }

    /** Index of the first message whose offset sorts after {@code offset}. */
    private static int firstAfter(List<StreamMessage> messages, String offset) {
        int lo = 0;
        int hi = messages.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (messages.get(mid).offset().compareTo(offset) > 0) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }

    /** Frame, store and return one record. Caller holds the stream's monitor. */
    private StreamMessage appendRecord(StreamState s, byte[] data, boolean initialCreate) {
        byte[] stored = data;
        if (ContentTypes.isJson(s.contentType)) {
            try {
                stored = JsonFraming.normalizeAppend(data, initialCreate);
            } catch (IllegalArgumentException e) {
                throw StoreException.validation(e.getMessage(), e);
            }
            if (stored.length == 0) {
                return null;
            }
        } else if (stored.length == 0) {
            throw StoreException.validation("Empty payload");
        } else {
            stored = data.clone();
        }

        Offset next = s.current.advance(stored.length);
        StreamMessage message = new StreamMessage(stored, next.render(), clock.millis());
        s.messages.add(message);
        s.current = next;
        return message;
    }

    private void notifyAppended(StreamState s, StreamMessage message) {
        for (Subscription sub : s.subscribers.snapshot()) {
            if (sub.isActive() && message.offset().compareTo(sub.offset()) > 0) {
                sub.advanceTo(message.offset());
                deliver(sub, SubscriptionEvent.append(List.of(message)));
            }
        }
    }

    private void notifyClosed(StreamState s) {
        SubscriptionEvent event = SubscriptionEvent.closed(s.current.render());
        for (Subscription sub : s.subscribers.drain()) {
            if (sub.deactivate()) {
                deliver(sub, event);
            }
        }
    }

    private void notifyError(StreamState s, String reason) {
        SubscriptionEvent event = SubscriptionEvent.error(reason);
        for (Subscription sub : s.subscribers.drain()) {
            if (sub.deactivate()) {
                deliver(sub, event);
            }
        }
    }

    private static void deliver(Subscription sub, SubscriptionEvent event) {
        try {
            sub.listener().onEvent(event);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "subscriber on " + sub.path() + " failed; cancelling it", e);
            sub.cancel();
        }
    }

    /** Mutable per-stream state; every field is guarded by the instance monitor. */
    private static final class StreamState {
        final String path;
        final String contentType;
        final Long ttlSeconds;
        final Instant expiresAt;
        final long createdAt;
        final ProducerRegistry producers;
        final List<StreamMessage> messages = new ArrayList<>();
        final SubscriptionRegistry subscribers = new SubscriptionRegistry();

        Offset current = Offset.ZERO;
        String lastWriterSeq;
        boolean closed;
        ProducerInfo closedBy;
        boolean removed;

        StreamState(String path, String contentType, Long ttlSeconds, Instant expiresAt,
                    long createdAt, ProducerRegistry producers) {
            this.path = path;
            this.contentType = contentType;
            this.ttlSeconds = ttlSeconds;
            this.expiresAt = expiresAt;
            this.createdAt = createdAt;
            this.producers = producers;
        }

        boolean isExpired(long now) {
            if (expiresAt != null && now >= expiresAt.toEpochMilli()) {
                return true;
            }
            return ttlSeconds != null && now >= createdAt + ttlSeconds * 1000L;
        }

        StreamMetadata snapshot() {
            return new StreamMetadata(
                    path,
                    contentType,
                    current.render(),
                    closed,
                    ttlSeconds,
                    expiresAt,
                    createdAt,
                    lastWriterSeq,
                    messages.size(),
                    closedBy
            );
        }
    }
}

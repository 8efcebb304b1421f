package io.durastream.storage;

import java.util.List;

/**
 * Synchronous stream store contract used by the protocol layer.
 * <p>
 * Semantics:
 *  - Every stream is an append-only log of opaque records; offsets strictly
 *    increase and never change once assigned.
 *  - Mutations and subscription changes for one path are linearizable.
 *  - Failures are reported as {@link StoreException}s, immediately and
 *    without internal retries.
 *  - Subscribers are notified synchronously, in registration order, from
 *    inside the call that produced the event.
 */
public interface StreamStore {

    boolean has(String path);

    /** Snapshot of a stream, or null if it does not exist (or has expired). */
    StreamMetadata get(String path);

    /**
     * Register a new open stream (or a closed one if requested).
     *
     * @throws StoreException CONFLICT if the path already exists, VALIDATION for bad initial JSON
     */
    StreamMetadata create(String path, CreateOptions options);

    default AppendResult append(String path, byte[] data) {
        return append(path, data, AppendOptions.none());
    }

    /**
     * Append one record.
     * <p>
     * When {@code options.producer()} is set this behaves as
     * {@link #appendWithProducer}. Subscribers whose watched offset is behind
     * the new tail receive only the new record(s).
     *
     * @throws StoreException NOT_FOUND, ALREADY_CLOSED, CONFLICT (content type / writer seq),
     *                        VALIDATION (empty or malformed payload), STALE_EPOCH, OUT_OF_ORDER
     */
    AppendResult append(String path, byte[] data, AppendOptions options);

    /**
     * Append with producer validation. A retransmit of an already applied
     * (producerId, epoch, seq) returns the original offset with {@code duplicate = true}.
     */
    default AppendResult appendWithProducer(String path, byte[] data, ProducerInfo producer) {
        return append(path, data, AppendOptions.withProducer(producer));
    }

    default ReadResult read(String path, String offset) {
        return read(path, offset, 0);
    }

    /**
     * Messages strictly after {@code offset} ("-1"/null = from the start,
     * "now" = nothing, only the current tail).
     *
     * @param maxMessages page size, 0 for unlimited
     */
    ReadResult read(String path, String offset, int maxMessages);

    /**
     * Register {@code listener} for every later event on {@code path} after {@code offset}.
     * Records already past {@code offset} are delivered before this call returns;
     * for a closed stream at its tail the CLOSED event is delivered immediately
     * and the returned handle is already inactive.
     */
    Subscription subscribe(String path, String offset, SubscriptionListener listener);

    /** Mark the stream closed. Repeated calls report {@code alreadyClosed = true}. */
    CloseResult closeStream(String path);

    /** Close with the same epoch/seq validation as {@link #appendWithProducer}. */
    CloseResult closeStreamWithProducer(String path, ProducerInfo producer);

    /** Remove the stream in any state; outstanding subscribers get an ERROR event. */
    boolean delete(String path);

    /** Send an ERROR event to and drop every outstanding subscription. */
    void cancelAllSubscriptions();

    List<String> list();
}

package io.durastream.client;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Exactly-once writer for one stream.
 * <p>
 * Each append carries (Producer-Id, Producer-Epoch, Producer-Seq). The sequence
 * number is fixed before the first attempt, so a retry after a lost response is
 * recognised by the server as a duplicate and acknowledged with the original
 * offset instead of being stored twice.
 * <p>
 * Only transport failures and retryable statuses (5xx, 429) are retried. A 403
 * means another instance with a newer epoch took over; a 409 sequence gap means
 * this instance's state is out of step with the server. Both are thrown as is.
 * <p>
 * Appends are serialised: one request in flight per producer.
 */
public final class IdempotentProducer {
    private static final Logger log = Logger.getLogger(IdempotentProducer.class.getName());

    private final StreamClient client;
    private final String path;
    private final String producerId;
    private final String contentType;
    private final RetryPolicy retry;

    private long epoch;
    private long nextSeq;
    private boolean closed;

    public IdempotentProducer(StreamClient client, String path, String producerId, long epoch,
                              String contentType, RetryPolicy retry) {
        this.client = Objects.requireNonNull(client, "client");
        this.path = Objects.requireNonNull(path, "path");
        this.producerId = Objects.requireNonNull(producerId, "producerId");
        if (producerId.isEmpty()) {
            throw new IllegalArgumentException("producerId must not be empty");
        }
        if (epoch < 0) {
            throw new IllegalArgumentException("epoch must be >= 0");
        }
        this.epoch = epoch;
        this.contentType = Objects.requireNonNull(contentType, "contentType");
        this.retry = retry.retryingOn(IdempotentProducer::isTransient);
    }

    public synchronized AppendAck append(byte[] data) throws Exception {
        return append(data, CancellationToken.none());
    }

    public synchronized AppendAck append(byte[] data, CancellationToken token) throws Exception {
        ensureOpen();
        Map<String, String> headers = producerHeaders(nextSeq);
        AppendAck ack = retry.execute(attempt -> client.append(path, contentType, data, headers), token);
        nextSeq++;
        return ack;
    }

    /** Close the stream with this producer's next tuple; safe to retry. */
    public synchronized AppendAck close() throws Exception {
        return close(CancellationToken.none());
    }

    public synchronized AppendAck close(CancellationToken token) throws Exception {
        ensureOpen();
        Map<String, String> headers = producerHeaders(nextSeq);
        AppendAck ack = retry.execute(attempt -> client.close(path, headers), token);
        nextSeq++;
        closed = true;
        return ack;
    }

    /**
     * Start a new epoch after a restart: sequence numbers begin again at 0 and
     * writers still using the old epoch are fenced off by the server.
     */
    public synchronized void bumpEpoch() {
        epoch++;
        nextSeq = 0;
        log.info(() -> "producer " + producerId + " on " + path + " moved to epoch " + epoch);
    }

    public synchronized long epoch() {
        return epoch;
    }

    public synchronized long nextSeq() {
        return nextSeq;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("producer already closed the stream");
        }
    }

    private Map<String, String> producerHeaders(long seq) {
        return Map.of(
                "Producer-Id", producerId,
                "Producer-Epoch", Long.toString(epoch),
                "Producer-Seq", Long.toString(seq)
        );
    }

    static boolean isTransient(Exception e) {
        if (e instanceof StreamClientException sce) {
            return sce.isRetryable();
        }
        return e instanceof IOException;
    }
}

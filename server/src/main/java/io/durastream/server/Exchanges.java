package io.durastream.server;

import io.durastream.storage.ErrorKind;
import io.durastream.storage.SequenceGapException;
import io.durastream.storage.StaleEpochException;
import io.durastream.storage.StoreException;
import io.durastream.storage.StreamClosedException;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.AttachmentKey;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;

import java.nio.ByteBuffer;
import java.util.Deque;
import java.util.function.Supplier;

/**
 * Response helpers shared by the handlers, and the single mapping from store
 * error kinds to HTTP statuses.
 */
final class Exchanges {

    /** Nanoseconds spent in store calls for this request. */
    static final AttachmentKey<Long> STORE_NANOS = AttachmentKey.create(Long.class);

    /** Failure to log with the request, if any. */
    static final AttachmentKey<Throwable> FAILURE = AttachmentKey.create(Throwable.class);

    /** Set when an injected fault was applied to the request. */
    static final AttachmentKey<Boolean> FAULTED = AttachmentKey.create(Boolean.class);

    private Exchanges() {
        // utility
    }

    /** Run a store call and account its latency to the request. */
    static <T> T timed(HttpServerExchange ex, Supplier<T> op) {
        long start = System.nanoTime();
        try {
            return op.get();
        } finally {
            long spent = System.nanoTime() - start;
            Long prev = ex.getAttachment(STORE_NANOS);
            ex.putAttachment(STORE_NANOS, prev == null ? spent : prev + spent);
        }
    }

    static void sendText(HttpServerExchange ex, int status, String text) {
        ex.setStatusCode(status);
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        ex.getResponseSender().send(text);
    }

    static void sendBytes(HttpServerExchange ex, int status, byte[] body) {
        ex.setStatusCode(status);
        ex.getResponseSender().send(ByteBuffer.wrap(body));
    }

    static void sendEmpty(HttpServerExchange ex, int status) {
        ex.setStatusCode(status);
        ex.endExchange();
    }

    static void sendStoreError(HttpServerExchange ex, StoreException e) {
        var headers = ex.getResponseHeaders();
        if (e instanceof StreamClosedException closed) {
            headers.put(ProtocolHeaders.STREAM_CLOSED, "true");
            headers.put(ProtocolHeaders.STREAM_NEXT_OFFSET, closed.finalOffset());
        } else if (e instanceof StaleEpochException stale) {
            headers.put(ProtocolHeaders.PRODUCER_EPOCH, Long.toString(stale.currentEpoch()));
        } else if (e instanceof SequenceGapException gap) {
            headers.put(ProtocolHeaders.PRODUCER_EXPECTED_SEQ, Long.toString(gap.expectedSeq()));
            headers.put(ProtocolHeaders.PRODUCER_RECEIVED_SEQ, Long.toString(gap.receivedSeq()));
        }
        sendText(ex, statusFor(e.kind()), e.getMessage());
    }

    /**
     * Last-resort mapping for anything a handler let escape: store errors by kind,
     * IllegalArgumentException as 400, everything else 500 (kept for the request log).
     */
    static void sendFailure(HttpServerExchange ex, Exception e) {
        if (ex.isResponseStarted()) {
            ex.putAttachment(FAILURE, e);
            ex.endExchange();
            return;
        }
        if (e instanceof StoreException se) {
            sendStoreError(ex, se);
        } else if (e instanceof IllegalArgumentException bad) {
            sendText(ex, 400, bad.getMessage());
        } else {
            ex.putAttachment(FAILURE, e);
            sendText(ex, 500, "Internal server error");
        }
    }

    static int statusFor(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> 404;
            case CONFLICT, ALREADY_CLOSED, OUT_OF_ORDER -> 409;
            case STALE_EPOCH -> 403;
            case VALIDATION -> 400;
        };
    }

    static String header(HttpServerExchange ex, HttpString name) {
        return ex.getRequestHeaders().getFirst(name);
    }

    static String query(HttpServerExchange ex, String name) {
        Deque<String> values = ex.getQueryParameters().get(name);
        return values == null || values.isEmpty() ? null : values.getFirst();
    }

    static int queryCount(HttpServerExchange ex, String name) {
        Deque<String> values = ex.getQueryParameters().get(name);
        return values == null ? 0 : values.size();
    }
}

package io.durastream.server;

import io.durastream.core.ContentTypes;
import io.durastream.storage.AppendOptions;
import io.durastream.storage.AppendResult;
import io.durastream.storage.CloseResult;
import io.durastream.storage.CreateOptions;
import io.durastream.storage.ErrorKind;
import io.durastream.storage.ProducerInfo;
import io.durastream.storage.StoreException;
import io.durastream.storage.StreamMetadata;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.HeaderMap;
import io.undertow.util.Headers;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * PUT (create) and POST (append / close / strict create) for stream paths.
 *
 * Bodies are read in full before anything touches the store; a body larger
 * than {@link #MAX_BODY_BYTES} is refused with 413.
 */
final class WriteHandler {
    static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB

    private static final Pattern CONTENT_TYPE_PATTERN = Pattern.compile("^[\\w-]+/[\\w-]+.*");
    private static final Pattern TTL_PATTERN = Pattern.compile("0|[1-9]\\d*");
    private static final Pattern NON_NEGATIVE_INT = Pattern.compile("\\d+");

    private final ServerContext ctx;

    WriteHandler(ServerContext ctx) {
        this.ctx = ctx;
    }

    /** PUT /{path} */
    void handlePut(HttpServerExchange ex, String path) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> guarded(exchange, () -> create(exchange, path, data, false)),
                Exchanges::sendFailure
        );
    }

    /** POST /{path} */
    void handlePost(HttpServerExchange ex, String path) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> guarded(exchange, () -> {
                    if ("true".equals(Exchanges.header(exchange, ProtocolHeaders.STREAM_CREATE))) {
                        create(exchange, path, data, true);
                    } else {
                        append(exchange, path, data);
                    }
                }),
                Exchanges::sendFailure
        );
    }

    // ---------- create ----------

    private void create(HttpServerExchange ex, String path, byte[] raw, boolean strict) throws IOException {
        byte[] body = decodedBody(ex, raw);
        if (body == null) {
            return;
        }
        CreateOptions options = createOptions(ex, body);

        StreamMetadata meta;
        int status;
        try {
            meta = Exchanges.timed(ex, () -> ctx.store().create(path, options));
            status = 201;
        } catch (StoreException e) {
            if (strict || e.kind() != ErrorKind.CONFLICT) {
                throw e;
            }
            meta = Exchanges.timed(ex, () -> ctx.store().get(path));
            if (meta == null || !sameConfiguration(meta, options)) {
                Exchanges.sendText(ex, 409, "Stream already exists with different configuration");
                return;
            }
            status = 200;
        }

        HeaderMap h = ex.getResponseHeaders();
        h.put(Headers.CONTENT_TYPE, meta.contentType());
        h.put(ProtocolHeaders.STREAM_NEXT_OFFSET, meta.currentOffset());
        if (status == 201) {
            h.put(Headers.LOCATION, ex.getRequestScheme() + "://" + ex.getHostAndPort() + path);
        }
        if (meta.closed()) {
            h.put(ProtocolHeaders.STREAM_CLOSED, "true");
        }
        Exchanges.sendEmpty(ex, status);
    }

    static CreateOptions createOptions(HttpServerExchange ex, byte[] body) {
        String contentType = Exchanges.header(ex, Headers.CONTENT_TYPE);
        if (contentType == null || !CONTENT_TYPE_PATTERN.matcher(contentType.trim()).matches()) {
            contentType = ContentTypes.OCTET_STREAM;
        }

        String ttl = Exchanges.header(ex, ProtocolHeaders.STREAM_TTL);
        String expiresAt = Exchanges.header(ex, ProtocolHeaders.STREAM_EXPIRES_AT);
        if (ttl != null && expiresAt != null) {
            throw new IllegalArgumentException("Cannot specify both Stream-TTL and Stream-Expires-At");
        }

        CreateOptions options = CreateOptions.ofContentType(contentType);
        if (ttl != null) {
            if (!TTL_PATTERN.matcher(ttl).matches()) {
                throw new IllegalArgumentException("Invalid Stream-TTL value");
            }
            options = options.withTtlSeconds(Long.parseLong(ttl));
        }
        if (expiresAt != null) {
            options = options.withExpiresAt(parseTimestamp(expiresAt));
        }
        if (body.length > 0) {
            options = options.withInitialData(body);
        }
        return options.withClosed("true".equals(Exchanges.header(ex, ProtocolHeaders.STREAM_CLOSED)));
    }

    private static Instant parseTimestamp(String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid Stream-Expires-At timestamp", e);
        }
    }

    private static boolean sameConfiguration(StreamMetadata meta, CreateOptions options) {
        return ContentTypes.normalize(meta.contentType()).equals(ContentTypes.normalize(options.contentType()))
                && Objects.equals(meta.ttlSeconds(), options.ttlSeconds())
                && Objects.equals(meta.expiresAt(), options.expiresAt())
                && meta.closed() == options.closed();
    }

    // ---------- append / close ----------

    private void append(HttpServerExchange ex, String path, byte[] raw) throws IOException {
        ProducerInfo producer = producerHeaders(ex);
        byte[] body = decodedBody(ex, raw);
        if (body == null) {
            return;
        }
        boolean close = "true".equals(Exchanges.header(ex, ProtocolHeaders.STREAM_CLOSED));

        if (body.length == 0) {
            if (close) {
                close(ex, path, producer);
            } else {
                Exchanges.sendText(ex, 400, "Empty body");
            }
            return;
        }
        String contentType = Exchanges.header(ex, Headers.CONTENT_TYPE);
        if (contentType == null) {
            Exchanges.sendText(ex, 400, "Content-Type header is required");
            return;
        }

        var options = new AppendOptions(Exchanges.header(ex, ProtocolHeaders.STREAM_SEQ), contentType, producer, close);
        AppendResult r = Exchanges.timed(ex, () -> ctx.store().append(path, body, options));

        HeaderMap h = ex.getResponseHeaders();
        h.put(ProtocolHeaders.STREAM_NEXT_OFFSET, r.offset());
        putProducer(h, producer);
        if (r.streamClosed()) {
            h.put(ProtocolHeaders.STREAM_CLOSED, "true");
        }
        Exchanges.sendEmpty(ex, producer != null && !r.duplicate() ? 200 : 204);
    }

    private void close(HttpServerExchange ex, String path, ProducerInfo producer) {
        CloseResult r = Exchanges.timed(ex, () -> producer == null
                ? ctx.store().closeStream(path)
                : ctx.store().closeStreamWithProducer(path, producer));

        HeaderMap h = ex.getResponseHeaders();
        h.put(ProtocolHeaders.STREAM_NEXT_OFFSET, r.finalOffset());
        // a retried append tuple is acknowledged without closing
        if (r.alreadyClosed() || !r.duplicate()) {
            h.put(ProtocolHeaders.STREAM_CLOSED, "true");
        }
        putProducer(h, producer);
        Exchanges.sendEmpty(ex, 204);
    }

    /**
     * Producer-Id, Producer-Epoch and Producer-Seq, all or none.
     *
     * @return null when the request carries no producer headers
     */
    static ProducerInfo producerHeaders(HttpServerExchange ex) {
        String id = Exchanges.header(ex, ProtocolHeaders.PRODUCER_ID);
        String epoch = Exchanges.header(ex, ProtocolHeaders.PRODUCER_EPOCH);
        String seq = Exchanges.header(ex, ProtocolHeaders.PRODUCER_SEQ);
        if (id == null && epoch == null && seq == null) {
            return null;
        }
        if (id == null || epoch == null || seq == null) {
            throw new IllegalArgumentException(
                    "All producer headers (Producer-Id, Producer-Epoch, Producer-Seq) must be provided together");
        }
        if (id.isEmpty()) {
            throw new IllegalArgumentException("Invalid Producer-Id: must not be empty");
        }
        return new ProducerInfo(id, nonNegative(epoch, "Producer-Epoch"), nonNegative(seq, "Producer-Seq"));
    }

    private static long nonNegative(String value, String header) {
        if (!NON_NEGATIVE_INT.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid " + header + ": must be a non-negative integer");
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + header + ": must be a non-negative integer", e);
        }
    }

    private static void putProducer(HeaderMap h, ProducerInfo producer) {
        if (producer != null) {
            h.put(ProtocolHeaders.PRODUCER_EPOCH, Long.toString(producer.epoch()));
            h.put(ProtocolHeaders.PRODUCER_SEQ, Long.toString(producer.seq()));
        }
    }

    /** Size check plus Content-Encoding; null means a response was already sent. */
    private static byte[] decodedBody(HttpServerExchange ex, byte[] raw) throws IOException {
        if (raw.length > MAX_BODY_BYTES) {
            Exchanges.sendText(ex, 413, "Request body too large");
            return null;
        }
        String encoding = Exchanges.header(ex, Headers.CONTENT_ENCODING);
        if (encoding == null || encoding.isBlank() || "identity".equalsIgnoreCase(encoding.trim()) || raw.length == 0) {
            return raw;
        }
        byte[] body = Compression.decompress(raw, encoding, MAX_BODY_BYTES);
        if (body.length > MAX_BODY_BYTES) {
            Exchanges.sendText(ex, 413, "Request body too large");
            return null;
        }
        return body;
    }

    private static void guarded(HttpServerExchange ex, BodyAction action) {
        try {
            action.run();
        } catch (IOException e) {
            Exchanges.sendText(ex, 400, "Malformed request body: " + e.getMessage());
        } catch (Exception e) {
            Exchanges.sendFailure(ex, e);
        }
    }

    @FunctionalInterface
    private interface BodyAction {
        void run() throws Exception;
    }
}

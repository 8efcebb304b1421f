package io.durastream.server;

import io.durastream.core.ContentTypes;
import io.durastream.core.JsonFraming;
import io.durastream.core.Offset;
import io.durastream.core.StreamMessage;
import io.durastream.server.fault.InjectedFault;
import io.durastream.storage.ReadResult;
import io.durastream.storage.StoreException;
import io.durastream.storage.StreamMetadata;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.HeaderMap;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.regex.Pattern;

/**
 * HEAD and GET for stream paths.
 *
 * GET modes:
 *   - catch-up (no live param):  everything after offset, at most maxPageMessages
 *   - live=long-poll:            like catch-up, but waits at the tail (see {@link LongPoll})
 *   - live=sse / stream=sse:     server-sent events (see {@link SseSession})
 */
final class ReadHandler {

    private static final Pattern OFFSET_PATTERN = Pattern.compile("-1|now|\\d+_\\d+");

    private final ServerContext ctx;

    ReadHandler(ServerContext ctx) {
        this.ctx = ctx;
    }

    /** HEAD /{path}: metadata only, never a body. */
    void handleHead(HttpServerExchange ex, String path) {
        StreamMetadata meta = Exchanges.timed(ex, () -> ctx.store().get(path));
        if (meta == null) {
            Exchanges.sendEmpty(ex, 404);
            return;
        }
        HeaderMap h = ex.getResponseHeaders();
        h.put(ProtocolHeaders.STREAM_NEXT_OFFSET, meta.currentOffset());
        if (meta.contentType() != null) {
            h.put(Headers.CONTENT_TYPE, meta.contentType());
        }
        if (meta.closed()) {
            h.put(ProtocolHeaders.STREAM_CLOSED, "true");
        }
        if (meta.ttlSeconds() != null) {
            h.put(ProtocolHeaders.STREAM_TTL, Long.toString(meta.ttlSeconds()));
        }
        if (meta.expiresAt() != null) {
            h.put(ProtocolHeaders.STREAM_EXPIRES_AT, meta.expiresAt().toString());
        }
        h.put(Headers.CACHE_CONTROL, "no-store");
        h.put(Headers.ETAG, etag(path, Offset.BEGINNING, meta.currentOffset(), meta.closed()));
        Exchanges.sendEmpty(ex, 200);
    }

    /** GET /{path}?offset=..[&live=long-poll|sse][&cursor=..] */
    void handleGet(HttpServerExchange ex, String path, InjectedFault bodyFault) throws Exception {
        StreamMetadata meta = Exchanges.timed(ex, () -> ctx.store().get(path));
        if (meta == null) {
            Exchanges.sendText(ex, 404, "Stream not found");
            return;
        }

        String offset = Exchanges.query(ex, ProtocolHeaders.OFFSET_PARAM);
        String live = Exchanges.query(ex, ProtocolHeaders.LIVE_PARAM);
        if (live == null && ProtocolHeaders.LIVE_SSE.equals(Exchanges.query(ex, ProtocolHeaders.STREAM_PARAM))) {
            live = ProtocolHeaders.LIVE_SSE;
        }
        String clientCursor = Exchanges.query(ex, ProtocolHeaders.CURSOR_PARAM);

        if (offset != null) {
            if (offset.isEmpty()) {
                Exchanges.sendText(ex, 400, "Empty offset parameter");
                return;
            }
            if (Exchanges.queryCount(ex, ProtocolHeaders.OFFSET_PARAM) > 1) {
                Exchanges.sendText(ex, 400, "Multiple offset parameters not allowed");
                return;
            }
            if (!OFFSET_PATTERN.matcher(offset).matches()) {
                Exchanges.sendText(ex, 400, "Invalid offset format");
                return;
            }
        }

        boolean longPoll = ProtocolHeaders.LIVE_LONG_POLL.equals(live);
        boolean sse = ProtocolHeaders.LIVE_SSE.equals(live);
        if (live != null && !longPoll && !sse) {
            Exchanges.sendText(ex, 400, "Unsupported live mode: " + live);
            return;
        }
        if ((longPoll || sse) && offset == null) {
            Exchanges.sendText(ex, 400, (sse ? "SSE" : "Long-poll") + " requires offset parameter");
            return;
        }

        if (sse) {
            String start;
            if (Offset.NOW.equals(offset)) {
                start = meta.currentOffset();
            } else if (Offset.isBeginning(offset)) {
                start = Offset.ZERO.render();
            } else {
                start = Offset.parse(offset).render();
            }
            new SseSession(ctx, path, meta.contentType(), start, clientCursor, bodyFault).handle(ex);
            return;
        }

        String requested = offset != null ? offset : ctx.config().cursorOptions().defaultOffset();
        String etagStart = offset != null ? offset : Offset.BEGINNING;

        if (Offset.NOW.equals(requested) && !longPoll) {
            sendTail(ex, meta);
            return;
        }

        int maxPage = ctx.config().maxPageMessages();
        ReadResult r = Exchanges.timed(ex, () -> ctx.store().read(path, requested, maxPage));

        if (longPoll && r.messages().isEmpty() && r.upToDate()) {
            if (r.closed()) {
                HeaderMap h = ex.getResponseHeaders();
                h.put(ProtocolHeaders.STREAM_NEXT_OFFSET, r.currentOffset());
                h.put(ProtocolHeaders.STREAM_UP_TO_DATE, "true");
                h.put(ProtocolHeaders.STREAM_CLOSED, "true");
                Exchanges.sendEmpty(ex, 204);
                return;
            }
            new LongPoll(ctx, this, ex, path, meta.contentType(), r.currentOffset(), etagStart, clientCursor, bodyFault)
                    .start();
            return;
        }

        sendMessages(ex, path, meta.contentType(), etagStart, r.messages(), r.currentOffset(),
                longPoll, clientCursor, bodyFault);
    }

    /**
     * 200 with a page of messages. Also used by {@link LongPoll} once it wakes up.
     *
     * @param fallbackOffset next offset to report when {@code messages} is empty
     */
    void sendMessages(HttpServerExchange ex,
                      String path,
                      String contentType,
                      String etagStart,
                      List<StreamMessage> messages,
                      String fallbackOffset,
                      boolean live,
                      String clientCursor,
                      InjectedFault bodyFault) {
        String responseOffset = messages.isEmpty()
                ? fallbackOffset
                : messages.get(messages.size() - 1).offset();

        StreamMetadata now;
        try {
            now = Exchanges.timed(ex, () -> ctx.store().get(path));
        } catch (StoreException e) {
            Exchanges.sendStoreError(ex, e);
            return;
        }
        boolean atTail = now != null && responseOffset.equals(now.currentOffset());
        boolean closedAtTail = atTail && now.closed();

        HeaderMap h = ex.getResponseHeaders();
        if (contentType != null) {
            h.put(Headers.CONTENT_TYPE, contentType);
        }
        h.put(ProtocolHeaders.STREAM_NEXT_OFFSET, responseOffset);
        if (live) {
            h.put(ProtocolHeaders.STREAM_CURSOR, ctx.cursor().next(clientCursor));
        }
        if (atTail) {
            h.put(ProtocolHeaders.STREAM_UP_TO_DATE, "true");
        }
        if (closedAtTail) {
            h.put(ProtocolHeaders.STREAM_CLOSED, "true");
        }

        String etag = etag(path, etagStart, responseOffset, closedAtTail);
        h.put(Headers.ETAG, etag);

        String ifNoneMatch = ex.getRequestHeaders().getFirst(Headers.IF_NONE_MATCH);
        if (etag.equals(ifNoneMatch)) {
            if (ctx.config().compression()) {
                h.put(Headers.VARY, "accept-encoding");
            }
            Exchanges.sendEmpty(ex, 304);
            return;
        }

        byte[] body = JsonFraming.render(contentType, messages);

        if (ctx.config().compression() && body.length >= Compression.THRESHOLD) {
            String encoding = Compression.negotiate(ex.getRequestHeaders().getFirst(Headers.ACCEPT_ENCODING));
            if (encoding != null) {
                body = Compression.compress(body, encoding);
                h.put(Headers.CONTENT_ENCODING, encoding);
                h.put(Headers.VARY, "accept-encoding");
            }
        }

        if (bodyFault != null) {
            body = ctx.faults().mangleBody(bodyFault, body);
        }
        Exchanges.sendBytes(ex, 200, body);
    }

    /** offset=now without live mode: no messages, just the tail position. */
    private void sendTail(HttpServerExchange ex, StreamMetadata meta) {
        HeaderMap h = ex.getResponseHeaders();
        h.put(ProtocolHeaders.STREAM_NEXT_OFFSET, meta.currentOffset());
        h.put(ProtocolHeaders.STREAM_UP_TO_DATE, "true");
        h.put(Headers.CACHE_CONTROL, "no-store");
        if (meta.contentType() != null) {
            h.put(Headers.CONTENT_TYPE, meta.contentType());
        }
        if (meta.closed()) {
            h.put(ProtocolHeaders.STREAM_CLOSED, "true");
        }
        String body = ContentTypes.isJson(meta.contentType()) ? "[]" : "";
        Exchanges.sendBytes(ex, 200, body.getBytes(StandardCharsets.UTF_8));
    }

    /** Quoted ETag: {@code "<base64(path)>:<start>:<offset>[:c]"}. */
    static String etag(String path, String start, String offset, boolean closed) {
        String encodedPath = Base64.getEncoder().encodeToString(path.getBytes(StandardCharsets.UTF_8));
        return "\"" + encodedPath + ":" + start + ":" + offset + (closed ? ":c" : "") + "\"";
    }
}

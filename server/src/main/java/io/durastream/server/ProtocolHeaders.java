package io.durastream.server;

import io.undertow.util.HeaderMap;
import io.undertow.util.HttpString;

/**
 * Header and query names of the stream protocol, plus the CORS / security
 * headers every response carries.
 */
public final class ProtocolHeaders {

    public static final HttpString STREAM_NEXT_OFFSET = new HttpString("Stream-Next-Offset");
    public static final HttpString STREAM_CURSOR = new HttpString("Stream-Cursor");
    public static final HttpString STREAM_UP_TO_DATE = new HttpString("Stream-Up-To-Date");
    public static final HttpString STREAM_SEQ = new HttpString("Stream-Seq");
    public static final HttpString STREAM_TTL = new HttpString("Stream-TTL");
    public static final HttpString STREAM_EXPIRES_AT = new HttpString("Stream-Expires-At");
    public static final HttpString STREAM_SSE_DATA_ENCODING = new HttpString("Stream-SSE-Data-Encoding");
    public static final HttpString STREAM_CLOSED = new HttpString("Stream-Closed");
    public static final HttpString STREAM_CREATE = new HttpString("Stream-Create");

    public static final HttpString PRODUCER_ID = new HttpString("Producer-Id");
    public static final HttpString PRODUCER_EPOCH = new HttpString("Producer-Epoch");
    public static final HttpString PRODUCER_SEQ = new HttpString("Producer-Seq");
    public static final HttpString PRODUCER_EXPECTED_SEQ = new HttpString("Producer-Expected-Seq");
    public static final HttpString PRODUCER_RECEIVED_SEQ = new HttpString("Producer-Received-Seq");

    // SSE control frame fields
    public static final String SSE_OFFSET_FIELD = "streamNextOffset";
    public static final String SSE_CURSOR_FIELD = "streamCursor";
    public static final String SSE_UP_TO_DATE_FIELD = "upToDate";
    public static final String SSE_CLOSED_FIELD = "streamClosed";

    public static final String OFFSET_PARAM = "offset";
    public static final String LIVE_PARAM = "live";
    public static final String STREAM_PARAM = "stream";
    public static final String CURSOR_PARAM = "cursor";

    public static final String LIVE_LONG_POLL = "long-poll";
    public static final String LIVE_SSE = "sse";

    private static final HttpString ALLOW_ORIGIN = new HttpString("access-control-allow-origin");
    private static final HttpString ALLOW_METHODS = new HttpString("access-control-allow-methods");
    private static final HttpString ALLOW_HEADERS = new HttpString("access-control-allow-headers");
    private static final HttpString EXPOSE_HEADERS = new HttpString("access-control-expose-headers");
    private static final HttpString CONTENT_TYPE_OPTIONS = new HttpString("x-content-type-options");
    private static final HttpString RESOURCE_POLICY = new HttpString("cross-origin-resource-policy");

    private ProtocolHeaders() {
        // constants
    }

    /** CORS and hardening headers, set on every response. */
    public static void applyDefaults(HeaderMap headers) {
        headers.put(ALLOW_ORIGIN, "*");
        headers.put(ALLOW_METHODS, "GET, POST, PUT, DELETE, HEAD, OPTIONS");
        headers.put(ALLOW_HEADERS,
                "content-type, authorization, Stream-Seq, Stream-TTL, Stream-Expires-At, Stream-Closed, "
                        + "Stream-Create, Producer-Id, Producer-Epoch, Producer-Seq");
        headers.put(EXPOSE_HEADERS,
                "Stream-Next-Offset, Stream-Cursor, Stream-Up-To-Date, Stream-Closed, Producer-Epoch, "
                        + "Producer-Seq, Producer-Expected-Seq, Producer-Received-Seq, etag, content-type, "
                        + "content-encoding, vary");
        headers.put(CONTENT_TYPE_OPTIONS, "nosniff");
        headers.put(RESOURCE_POLICY, "cross-origin");
    }
}

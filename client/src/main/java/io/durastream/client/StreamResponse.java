package io.durastream.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.http.HttpHeaders;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A response whose body was read exactly once into a buffer owned by this object.
 * <p>
 * Consumers never see the transport's body stream. They take either a parsed
 * value ({@link #text()}, {@link #jsonMessages()}) or an independent read-only
 * cursor over the same bytes ({@link #bodyCursor()}), as often as they like.
 */
public final class StreamResponse {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final int status;
    private final HttpHeaders headers;
    private final byte[] body;

    public StreamResponse(int status, HttpHeaders headers, byte[] body) {
        this.status = status;
        this.headers = headers;
        this.body = body == null ? new byte[0] : body;
    }

    public int status() {
        return status;
    }

    public HttpHeaders headers() {
        return headers;
    }

    public Optional<String> header(String name) {
        return headers.firstValue(name);
    }

    public String nextOffset() {
        return headers.firstValue("Stream-Next-Offset").orElse(null);
    }

    public String cursor() {
        return headers.firstValue("Stream-Cursor").orElse(null);
    }

    public boolean upToDate() {
        return "true".equals(headers.firstValue("Stream-Up-To-Date").orElse(null));
    }

    public boolean closed() {
        return "true".equals(headers.firstValue("Stream-Closed").orElse(null));
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public int bodyLength() {
        return body.length;
    }

    /** A fresh read-only cursor positioned at the start of the body. */
    public ByteBuffer bodyCursor() {
        return ByteBuffer.wrap(body).asReadOnlyBuffer();
    }

    /** Copy of the body bytes. */
    public byte[] bodyBytes() {
        return body.clone();
    }

    public String text() {
        return new String(body, StandardCharsets.UTF_8);
    }

    /**
     * Messages of a JSON stream read: the body is a JSON array, one element per message.
     * An empty body yields an empty list.
     */
    public List<JsonNode> jsonMessages() {
        if (body.length == 0) {
            return List.of();
        }
        JsonNode root;
        try {
            root = JSON.readTree(body);
        } catch (IOException e) {
            throw new UncheckedIOException("response body is not JSON", e);
        }
        if (!root.isArray()) {
            throw new IllegalStateException("expected a JSON array body, got " + root.getNodeType());
        }
        List<JsonNode> out = new ArrayList<>(root.size());
        root.forEach(out::add);
        return out;
    }

    @Override
    public String toString() {
        return "StreamResponse{status=" + status + ", nextOffset=" + nextOffset() + ", bytes=" + body.length + "}";
    }
}

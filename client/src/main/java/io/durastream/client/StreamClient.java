package io.durastream.client;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Blocking HTTP client for one stream server.
 * <p>
 * Every response body is read once into a {@link StreamResponse}. Non-success
 * answers surface as {@link StreamClientException}; transport failures as
 * {@link IOException}. No retries happen here; wrap calls in a {@link RetryPolicy}.
 */
public final class StreamClient {
    private static final Logger log = Logger.getLogger(StreamClient.class.getName());

    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);

    private final HttpClient http;
    private final String baseUrl;
    private final Duration requestTimeout;

    public StreamClient(String baseUrl) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(), baseUrl, DEFAULT_REQUEST_TIMEOUT);
    }

    public StreamClient(HttpClient http, String baseUrl, Duration requestTimeout) {
        this.http = http;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestTimeout = requestTimeout;
    }

    public String baseUrl() {
        return baseUrl;
    }

    // ---------- lifecycle ----------

    /** PUT: create (or confirm) a stream with the given content type. */
    public StreamResponse create(String path, String contentType) throws IOException, InterruptedException {
        return create(path, contentType, Map.of(), null);
    }

    /**
     * PUT with extra headers (Stream-TTL, Stream-Expires-At, Stream-Closed) and optional initial data.
     */
    public StreamResponse create(String path, String contentType, Map<String, String> headers, byte[] initialData)
            throws IOException, InterruptedException {
        var b = request(path).PUT(body(initialData));
        if (contentType != null) {
            b.header("Content-Type", contentType);
        }
        headers.forEach(b::header);
        return expectSuccess("create " + path, send(b.build()));
    }

    /** HEAD: metadata, or empty when the stream does not exist. */
    public Optional<StreamResponse> head(String path) throws IOException, InterruptedException {
        StreamResponse r = send(request(path).method("HEAD", HttpRequest.BodyPublishers.noBody()).build());
        if (r.status() == 404) {
            return Optional.empty();
        }
        return Optional.of(expectSuccess("head " + path, r));
    }

    public boolean delete(String path) throws IOException, InterruptedException {
        StreamResponse r = send(request(path).DELETE().build());
        if (r.status() == 404) {
            return false;
        }
        expectSuccess("delete " + path, r);
        return true;
    }

    // ---------- writes ----------

    public AppendAck append(String path, String contentType, byte[] data) throws IOException, InterruptedException {
        return append(path, contentType, data, Map.of());
    }

    /** POST one record; {@code headers} may carry Stream-Seq, producer headers or Stream-Closed. */
    public AppendAck append(String path, String contentType, byte[] data, Map<String, String> headers)
            throws IOException, InterruptedException {
        var b = request(path).POST(body(data)).header("Content-Type", contentType);
        headers.forEach(b::header);
        StreamResponse r = expectSuccess("append " + path, send(b.build()));
        boolean producer = headers.containsKey("Producer-Id");
        return new AppendAck(r.nextOffset(), producer && r.status() == 204, r.closed());
    }

    /** POST with an empty body and Stream-Closed: true. */
    public AppendAck close(String path) throws IOException, InterruptedException {
        return close(path, Map.of());
    }

    public AppendAck close(String path, Map<String, String> headers) throws IOException, InterruptedException {
        var b = request(path).POST(HttpRequest.BodyPublishers.noBody()).header("Stream-Closed", "true");
        headers.forEach(b::header);
        StreamResponse r = expectSuccess("close " + path, send(b.build()));
        return new AppendAck(r.nextOffset(), !r.closed(), r.closed());
    }

    // ---------- reads ----------

    /** Catch-up read of everything after {@code offset} (one page). */
    public StreamResponse read(String path, String offset) throws IOException, InterruptedException {
        return expectRead("read " + path, send(request(path + "?offset=" + encode(offset)).GET().build()));
    }

    /**
     * Long-poll read: returns at once when data is available, otherwise waits for
     * the server's timeout (204, nothing new) or the next append.
     */
    public StreamResponse longPoll(String path, String offset, String cursor) throws IOException, InterruptedException {
        String query = "?offset=" + encode(offset) + "&live=long-poll" + (cursor == null ? "" : "&cursor=" + encode(cursor));
        return expectRead("long-poll " + path, send(request(path + query).GET().build()));
    }

    /**
     * Server-sent events read. The call returns once the server ends the
     * response, which happens when the stream is closed or the server shuts down.
     */
    public StreamResponse sse(String path, String offset) throws IOException, InterruptedException {
        var req = HttpRequest.newBuilder(URI.create(baseUrl + path + "?offset=" + encode(offset) + "&live=sse"))
                .header("Accept", "text/event-stream")
                .GET()
                .build();
        return expectRead("sse " + path, send(req));
    }

    // ---------- plumbing ----------

    private HttpRequest.Builder request(String pathAndQuery) {
        return HttpRequest.newBuilder(URI.create(baseUrl + pathAndQuery)).timeout(requestTimeout);
    }

    private StreamResponse send(HttpRequest req) throws IOException, InterruptedException {
        HttpResponse<byte[]> resp = http.send(req, HttpResponse.BodyHandlers.ofByteArray());
        log.fine(() -> req.method() + " " + req.uri() + " -> " + resp.statusCode());
        return new StreamResponse(resp.statusCode(), resp.headers(), resp.body());
    }

    private static StreamResponse expectSuccess(String operation, StreamResponse r) {
        if (!r.isSuccess()) {
            throw new StreamClientException(operation, r);
        }
        return r;
    }

    private static StreamResponse expectRead(String operation, StreamResponse r) {
        if (r.status() == 304) {
            return r;
        }
        return expectSuccess(operation, r);
    }

    private static HttpRequest.BodyPublisher body(byte[] data) {
        return data == null || data.length == 0
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(data);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /** Convenience for text payloads. */
    public static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}

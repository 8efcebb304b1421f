package io.durastream.server;

import io.durastream.core.Offset;
import io.durastream.storage.InMemoryStreamStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end specs for create / append / read / head / delete over HTTP.
 */
class WebServerStreamTest {

    private static final int PORT = 18090; // test-only port
    private WebServer server;
    private StreamHttp http;

    @BeforeEach
    void startServer() {
        var ctx = new ServerContext(new InMemoryStreamStore(), ServerConfig.defaults().withPort(PORT));
        server = new WebServer(PORT, ctx);
        server.start();
        http = new StreamHttp(PORT);
    }

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    void create_append_and_read_back() throws Exception {
        var created = http.put("/s/a", null, "Content-Type", "text/plain");
        assertEquals(201, created.statusCode());
        assertTrue(created.headers().firstValue("Location").orElseThrow().endsWith("/s/a"));
        assertEquals(Offset.ZERO.render(), created.headers().firstValue("Stream-Next-Offset").orElseThrow());

        assertEquals(204, http.post("/s/a", "hello", "Content-Type", "text/plain").statusCode());
        assertEquals(204, http.post("/s/a", " world", "Content-Type", "text/plain").statusCode());

        var read = http.get("/s/a?offset=-1");
        assertEquals(200, read.statusCode());
        assertEquals("hello world", read.body());
        assertEquals(Offset.ZERO.advance(11).render(), read.headers().firstValue("Stream-Next-Offset").orElseThrow());
        assertEquals("true", read.headers().firstValue("Stream-Up-To-Date").orElseThrow());
        assertEquals("nosniff", read.headers().firstValue("x-content-type-options").orElseThrow());

        String afterHello = Offset.ZERO.advance(5).render();
        assertEquals(" world", http.get("/s/a?offset=" + afterHello).body());
    }

    @Test
    void put_is_idempotent_for_same_config_and_conflicts_otherwise() throws Exception {
        assertEquals(201, http.put("/s/b", null, "Content-Type", "text/plain").statusCode());
        var again = http.put("/s/b", null, "Content-Type", "text/plain; charset=utf-8");
        assertEquals(200, again.statusCode());
        assertTrue(again.headers().firstValue("Location").isEmpty());

        var other = http.put("/s/b", null, "Content-Type", "application/json");
        assertEquals(409, other.statusCode());
        assertTrue(other.body().contains("different configuration"));
    }

    @Test
    void post_with_stream_create_is_strict() throws Exception {
        assertEquals(201, http.post("/s/strict", null, "Content-Type", "text/plain", "Stream-Create", "true").statusCode());
        assertEquals(409, http.post("/s/strict", null, "Content-Type", "text/plain", "Stream-Create", "true").statusCode());
    }

    @Test
    void create_rejects_ttl_together_with_expires_at() throws Exception {
        var resp = http.put("/s/ttl", null,
                "Stream-TTL", "60",
                "Stream-Expires-At", "2030-01-01T00:00:00Z");
        assertEquals(400, resp.statusCode());

        assertEquals(400, http.put("/s/ttl", null, "Stream-TTL", "01").statusCode());
        assertEquals(400, http.put("/s/ttl", null, "Stream-Expires-At", "tomorrow").statusCode());

        var ok = http.put("/s/ttl", null, "Stream-TTL", "60");
        assertEquals(201, ok.statusCode());
        assertEquals("application/octet-stream", ok.headers().firstValue("Content-Type").orElseThrow());
        assertEquals("60", http.head("/s/ttl").headers().firstValue("Stream-TTL").orElseThrow());
    }

    @Test
    void json_arrays_are_flattened_into_messages() throws Exception {
        http.put("/s/json", null, "Content-Type", "application/json");
        assertEquals(204, http.post("/s/json", "[{\"n\":1},{\"n\":2}]", "Content-Type", "application/json").statusCode());
        assertEquals(204, http.post("/s/json", "{\"n\":3}", "Content-Type", "application/json").statusCode());

        var read = http.get("/s/json?offset=-1");
        assertEquals(200, read.statusCode());
        assertEquals("[{\"n\":1},{\"n\":2},{\"n\":3}]", read.body().replace(" ", ""));

        assertEquals(400, http.post("/s/json", "{not json", "Content-Type", "application/json").statusCode());
        assertEquals(400, http.post("/s/json", "[]", "Content-Type", "application/json").statusCode());
    }

    @Test
    void offset_now_returns_tail_without_messages() throws Exception {
        http.put("/s/now", null, "Content-Type", "application/json");
        http.post("/s/now", "{\"a\":1}", "Content-Type", "application/json");

        var tail = http.get("/s/now?offset=now");
        assertEquals(200, tail.statusCode());
        assertEquals("[]", tail.body());
        assertEquals(http.head("/s/now").headers().firstValue("Stream-Next-Offset").orElseThrow(),
                tail.headers().firstValue("Stream-Next-Offset").orElseThrow());
    }

    @Test
    void bad_requests_are_rejected_with_400() throws Exception {
        http.put("/s/bad", null, "Content-Type", "text/plain");

        assertEquals(400, http.get("/s/bad?offset=").statusCode());
        assertEquals(400, http.get("/s/bad?offset=abc").statusCode());
        assertEquals(400, http.get("/s/bad?offset=-1&offset=-1").statusCode());
        assertEquals(400, http.get("/s/bad?offset=-1&live=websocket").statusCode());
        assertEquals(400, http.get("/s/bad?live=long-poll").statusCode());
        assertEquals(400, http.post("/s/bad", null, "Content-Type", "text/plain").statusCode());

        var noType = http.send(http.request("/s/bad")
                .POST(HttpRequest.BodyPublishers.ofString("x")).build());
        assertEquals(400, noType.statusCode());
    }

    @Test
    void content_type_mismatch_conflicts() throws Exception {
        http.put("/s/ct", null, "Content-Type", "text/plain");
        assertEquals(409, http.post("/s/ct", "{}", "Content-Type", "application/json").statusCode());
    }

    @Test
    void writer_seq_must_increase() throws Exception {
        http.put("/s/seq", null, "Content-Type", "text/plain");
        assertEquals(204, http.post("/s/seq", "a", "Content-Type", "text/plain", "Stream-Seq", "002").statusCode());
        assertEquals(409, http.post("/s/seq", "b", "Content-Type", "text/plain", "Stream-Seq", "001").statusCode());
        assertEquals(204, http.post("/s/seq", "c", "Content-Type", "text/plain", "Stream-Seq", "003").statusCode());
    }

    @Test
    void missing_stream_is_404() throws Exception {
        assertEquals(404, http.get("/s/missing?offset=-1").statusCode());
        assertEquals(404, http.head("/s/missing").statusCode());
        assertEquals(404, http.post("/s/missing", "x", "Content-Type", "text/plain").statusCode());
        assertEquals(404, http.delete("/s/missing").statusCode());
    }

    @Test
    void head_reports_metadata_and_etag() throws Exception {
        http.put("/s/head", null, "Content-Type", "text/plain");
        http.post("/s/head", "abc", "Content-Type", "text/plain");

        var head = http.head("/s/head");
        assertEquals(200, head.statusCode());
        assertEquals("", head.body());
        assertEquals("text/plain", head.headers().firstValue("Content-Type").orElseThrow());
        assertEquals("no-store", head.headers().firstValue("Cache-Control").orElseThrow());
        assertTrue(head.headers().firstValue("ETag").isPresent());
    }

    @Test
    void etag_changes_only_when_offset_or_closed_state_changes() throws Exception {
        http.put("/s/tag", null, "Content-Type", "text/plain");
        http.post("/s/tag", "abc", "Content-Type", "text/plain");

        String tail = Offset.ZERO.advance(3).render();
        String etag = http.head("/s/tag").headers().firstValue("ETag").orElseThrow();
        assertEquals("\"L3MvdGFn:-1:" + tail + "\"", etag);
        assertEquals(etag, http.head("/s/tag").headers().firstValue("ETag").orElseThrow());

        http.post("/s/tag", "d", "Content-Type", "text/plain");
        String grown = Offset.ZERO.advance(4).render();
        String afterAppend = http.head("/s/tag").headers().firstValue("ETag").orElseThrow();
        assertEquals("\"L3MvdGFn:-1:" + grown + "\"", afterAppend);

        http.post("/s/tag", null, "Stream-Closed", "true");
        var closed = http.head("/s/tag");
        String afterClose = closed.headers().firstValue("ETag").orElseThrow();
        assertEquals("\"L3MvdGFn:-1:" + grown + ":c\"", afterClose);
        assertEquals("true", closed.headers().firstValue("Stream-Closed").orElseThrow());

        assertEquals(409, http.post("/s/tag", "late", "Content-Type", "text/plain").statusCode());
        assertEquals(afterClose, http.head("/s/tag").headers().firstValue("ETag").orElseThrow());
    }

    @Test
    void conditional_get_returns_304() throws Exception {
        http.put("/s/etag", null, "Content-Type", "text/plain");
        http.post("/s/etag", "abc", "Content-Type", "text/plain");

        var first = http.get("/s/etag?offset=-1");
        String etag = first.headers().firstValue("ETag").orElseThrow();

        var second = http.get("/s/etag?offset=-1", "If-None-Match", etag);
        assertEquals(304, second.statusCode());

        http.post("/s/etag", "d", "Content-Type", "text/plain");
        assertEquals(200, http.get("/s/etag?offset=-1", "If-None-Match", etag).statusCode());
    }

    @Test
    void closed_stream_rejects_appends_with_final_offset() throws Exception {
        http.put("/s/closed", null, "Content-Type", "text/plain");
        http.post("/s/closed", "abc", "Content-Type", "text/plain");

        var close = http.post("/s/closed", null, "Stream-Closed", "true");
        assertEquals(204, close.statusCode());
        assertEquals("true", close.headers().firstValue("Stream-Closed").orElseThrow());

        var rejected = http.post("/s/closed", "more", "Content-Type", "text/plain");
        assertEquals(409, rejected.statusCode());
        assertEquals("true", rejected.headers().firstValue("Stream-Closed").orElseThrow());
        assertEquals(Offset.ZERO.advance(3).render(), rejected.headers().firstValue("Stream-Next-Offset").orElseThrow());

        var read = http.get("/s/closed?offset=-1");
        assertEquals("true", read.headers().firstValue("Stream-Closed").orElseThrow());
    }

    @Test
    void delete_removes_stream() throws Exception {
        http.put("/s/del", null, "Content-Type", "text/plain");
        assertEquals(204, http.delete("/s/del").statusCode());
        assertEquals(404, http.head("/s/del").statusCode());
    }

    @Test
    void large_bodies_are_gzipped_when_accepted() throws Exception {
        http.put("/s/gz", null, "Content-Type", "text/plain");
        String big = "x".repeat(4096);
        http.post("/s/gz", big, "Content-Type", "text/plain");

        HttpResponse<byte[]> resp = http.client().send(
                http.request("/s/gz?offset=-1", "Accept-Encoding", "gzip").GET().build(),
                HttpResponse.BodyHandlers.ofByteArray());
        assertEquals("gzip", resp.headers().firstValue("Content-Encoding").orElseThrow());
        try (var in = new GZIPInputStream(new java.io.ByteArrayInputStream(resp.body()))) {
            assertEquals(big, new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    @Test
    void gzip_request_bodies_are_decoded() throws Exception {
        http.put("/s/gzin", null, "Content-Type", "text/plain");
        var buf = new ByteArrayOutputStream();
        try (var gz = new GZIPOutputStream(buf)) {
            gz.write("compressed".getBytes(StandardCharsets.UTF_8));
        }
        var req = http.request("/s/gzin", "Content-Type", "text/plain", "Content-Encoding", "gzip")
                .POST(HttpRequest.BodyPublishers.ofByteArray(buf.toByteArray()))
                .build();
        assertEquals(204, http.send(req).statusCode());
        assertEquals("compressed", http.get("/s/gzin?offset=-1").body());
    }

    @Test
    void too_large_body_returns_413() throws Exception {
        http.put("/s/big", null, "Content-Type", "text/plain");
        String big = "x".repeat(WriteHandler.MAX_BODY_BYTES + 1);
        var resp = http.post("/s/big", big, "Content-Type", "text/plain");
        assertEquals(413, resp.statusCode());
    }

    @Test
    void gzip_body_inflating_past_the_limit_returns_413() throws Exception {
        http.put("/s/bomb", null, "Content-Type", "text/plain");
        var buf = new ByteArrayOutputStream();
        byte[] zeros = new byte[1 << 20];
        try (var gz = new GZIPOutputStream(buf)) {
            for (int i = 0; i < 64; i++) {
                gz.write(zeros);
            }
        }
        assertTrue(buf.size() < WriteHandler.MAX_BODY_BYTES);

        var req = http.request("/s/bomb", "Content-Type", "text/plain", "Content-Encoding", "gzip")
                .POST(HttpRequest.BodyPublishers.ofByteArray(buf.toByteArray()))
                .build();
        assertEquals(413, http.send(req).statusCode());
        assertEquals("", http.get("/s/bomb?offset=-1").body());
    }

    @Test
    void options_preflight_is_204_with_cors() throws Exception {
        var resp = http.send(http.request("/s/any").method("OPTIONS", HttpRequest.BodyPublishers.noBody()).build());
        assertEquals(204, resp.statusCode());
        assertEquals("*", resp.headers().firstValue("access-control-allow-origin").orElseThrow());
    }
}

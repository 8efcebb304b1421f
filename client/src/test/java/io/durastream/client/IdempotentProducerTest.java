package io.durastream.client;

import io.durastream.server.ServerConfig;
import io.durastream.server.ServerContext;
import io.durastream.server.WebServer;
import io.durastream.server.fault.InjectedFault;
import io.durastream.storage.InMemoryStreamStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end specs for IdempotentProducer: retries, fencing, close.
 */
class IdempotentProducerTest {

    private static final int PORT = 18095; // test-only port
    private static final String PATH = "/producer/s";

    private WebServer server;
    private StreamClient client;
    private RetryPolicy fastRetry;

    @BeforeEach
    void startServer() throws Exception {
        server = new WebServer(PORT, new ServerContext(new InMemoryStreamStore(), ServerConfig.defaults().withPort(PORT)));
        server.start();
        client = new StreamClient("http://localhost:" + PORT);
        client.create(PATH, "text/plain");
        fastRetry = RetryPolicy.defaults().withDelays(1, 10);
    }

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    void appends_are_sequenced() throws Exception {
        var producer = new IdempotentProducer(client, PATH, "w", 0, "text/plain", fastRetry);
        producer.append(StreamClient.utf8("a"));
        producer.append(StreamClient.utf8("b"));

        assertEquals(2, producer.nextSeq());
        assertEquals("ab", client.read(PATH, "-1").text());
    }

    @Test
    void server_errors_are_retried_with_the_same_seq() throws Exception {
        server.context().faults().install(PATH, InjectedFault.status(503).withCount(2));
        var producer = new IdempotentProducer(client, PATH, "w", 0, "text/plain", fastRetry);

        AppendAck ack = producer.append(StreamClient.utf8("once"));

        assertFalse(ack.duplicate());
        assertEquals(1, producer.nextSeq());
        assertEquals("once", client.read(PATH, "-1").text());
    }

    @Test
    void lost_response_retry_is_deduplicated() throws Exception {
        // first attempt is applied, then its response is dropped by the client
        var producer = new IdempotentProducer(client, PATH, "w", 0, "text/plain", fastRetry);
        producer.append(StreamClient.utf8("x"));

        var twin = new IdempotentProducer(client, PATH, "w", 0, "text/plain", fastRetry);
        AppendAck again = twin.append(StreamClient.utf8("x"));

        assertTrue(again.duplicate());
        assertEquals("x", client.read(PATH, "-1").text());
    }

    @Test
    void newer_epoch_fences_older_producer() throws Exception {
        var old = new IdempotentProducer(client, PATH, "w", 0, "text/plain", fastRetry);
        old.append(StreamClient.utf8("1"));

        var restarted = new IdempotentProducer(client, PATH, "w", 0, "text/plain", fastRetry);
        restarted.bumpEpoch();
        restarted.append(StreamClient.utf8("2"));

        var ex = assertThrows(StreamClientException.class, () -> old.append(StreamClient.utf8("3")));
        assertEquals(403, ex.status());
        assertEquals("12", client.read(PATH, "-1").text());
    }

    @Test
    void close_is_final_for_the_producer() throws Exception {
        var producer = new IdempotentProducer(client, PATH, "w", 0, "text/plain", fastRetry);
        producer.append(StreamClient.utf8("a"));
        AppendAck closed = producer.close();

        assertTrue(closed.closed());
        assertTrue(client.head(PATH).orElseThrow().closed());
        assertThrows(IllegalStateException.class, () -> producer.append(StreamClient.utf8("b")));
    }

    @Test
    void only_transient_failures_count_as_retryable() {
        assertTrue(IdempotentProducer.isTransient(new IOException("reset")));
        assertFalse(IdempotentProducer.isTransient(new IllegalStateException("bug")));
    }
}

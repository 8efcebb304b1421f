package io.durastream.server;

import io.durastream.storage.InMemoryStreamStore;

import java.time.Clock;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for a single stream server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Wire the in-memory store, the server context and the HTTP layer.
 *  - Close live connections and stop the listener on JVM shutdown.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        var cfg = ServerConfig.fromArgs(args);

        var store = new InMemoryStreamStore(Clock.systemUTC(), Duration.ofSeconds(cfg.producerTtlSeconds()));
        var ctx = new ServerContext(store, cfg);
        var web = new WebServer(cfg.port(), ctx);

        web.start();
        System.out.printf("Stream server listening on http://%s:%d%n", "localhost", cfg.port());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                web.stop();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Error while stopping server", e);
            }
        }));
    }
}

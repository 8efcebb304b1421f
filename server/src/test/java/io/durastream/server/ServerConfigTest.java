package io.durastream.server;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    @Test
    void no_args_gives_defaults() {
        assertEquals(ServerConfig.defaults(), ServerConfig.fromArgs(new String[0]));
        assertEquals(4437, ServerConfig.defaults().port());
        assertEquals(30_000, ServerConfig.defaults().longPollTimeoutMs());
    }

    @Test
    void flags_override_defaults() {
        var cfg = ServerConfig.fromArgs(new String[]{
                "--port", "9000",
                "--long-poll-timeout-ms", "1500",
                "--compression", "false",
                "--max-page-messages", "50",
                "--producer-ttl-seconds", "60"
        });
        assertEquals(9000, cfg.port());
        assertEquals(1500, cfg.longPollTimeoutMs());
        assertFalse(cfg.compression());
        assertEquals(50, cfg.maxPageMessages());
        assertEquals(60, cfg.producerTtlSeconds());
    }

    @Test
    void invalid_values_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.defaults().withPort(70000));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.defaults().withLongPollTimeoutMs(0));
    }
}

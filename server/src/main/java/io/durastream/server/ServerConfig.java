package io.durastream.server;

import io.durastream.core.CursorOptions;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - port:                   HTTP port
 *  - longPollTimeoutMs:      how long a caught-up long-poll waits (also the SSE keep-alive interval)
 *  - compression:            gzip/deflate response bodies when the client accepts it
 *  - cursorIntervalSeconds:  Stream-Cursor interval width
 *  - maxPageMessages:        cap on messages per catch-up response, 0 = unlimited
 *  - producerTtlSeconds:     idle time after which producer state is forgotten
 */
public record ServerConfig(
        int port,
        long longPollTimeoutMs,
        boolean compression,
        int cursorIntervalSeconds,
        int maxPageMessages,
        long producerTtlSeconds
) {

    public static final int DEFAULT_PORT = 4437;
    public static final long DEFAULT_LONG_POLL_TIMEOUT_MS = 30_000;
    public static final long DEFAULT_PRODUCER_TTL_SECONDS = 7 * 24 * 3600L;

    public ServerConfig {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (longPollTimeoutMs <= 0) {
            throw new IllegalArgumentException("longPollTimeoutMs must be > 0");
        }
        if (producerTtlSeconds <= 0) {
            throw new IllegalArgumentException("producerTtlSeconds must be > 0");
        }
    }

    public static ServerConfig defaults() {
        return new ServerConfig(
                DEFAULT_PORT,
                DEFAULT_LONG_POLL_TIMEOUT_MS,
                true,
                CursorOptions.DEFAULT_INTERVAL_SECONDS,
                0,
                DEFAULT_PRODUCER_TTL_SECONDS
        );
    }

    public ServerConfig withPort(int p) {
        return new ServerConfig(p, longPollTimeoutMs, compression, cursorIntervalSeconds, maxPageMessages, producerTtlSeconds);
    }

    public ServerConfig withLongPollTimeoutMs(long ms) {
        return new ServerConfig(port, ms, compression, cursorIntervalSeconds, maxPageMessages, producerTtlSeconds);
    }

    public ServerConfig withCompression(boolean on) {
        return new ServerConfig(port, longPollTimeoutMs, on, cursorIntervalSeconds, maxPageMessages, producerTtlSeconds);
    }

    public ServerConfig withMaxPageMessages(int max) {
        return new ServerConfig(port, longPollTimeoutMs, compression, cursorIntervalSeconds, max, producerTtlSeconds);
    }

    public CursorOptions cursorOptions() {
        return CursorOptions.defaults()
                .withIntervalSeconds(cursorIntervalSeconds)
                .withMaxPageMessages(maxPageMessages);
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --port,    -p   <port>
     *   --long-poll-timeout-ms <ms>
     *   --compression   <true|false>
     *   --cursor-interval-seconds <seconds>
     *   --max-page-messages <n>
     *   --producer-ttl-seconds <seconds>
     *   --help,    -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        ServerConfig d = defaults();
        int port = d.port();
        long longPollTimeoutMs = d.longPollTimeoutMs();
        boolean compression = d.compression();
        int cursorIntervalSeconds = d.cursorIntervalSeconds();
        int maxPageMessages = d.maxPageMessages();
        long producerTtlSeconds = d.producerTtlSeconds();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--port", "-p" -> {
                    ensureValue(args, i);
                    port = parseInt(args, ++i);
                }

                case "--long-poll-timeout-ms" -> {
                    ensureValue(args, i);
                    longPollTimeoutMs = parseLong(args, ++i);
                }

                case "--compression" -> {
                    ensureValue(args, i);
                    compression = Boolean.parseBoolean(args[++i]);
                }

                case "--cursor-interval-seconds" -> {
                    ensureValue(args, i);
                    cursorIntervalSeconds = parseInt(args, ++i);
                }

                case "--max-page-messages" -> {
                    ensureValue(args, i);
                    maxPageMessages = parseInt(args, ++i);
                }

                case "--producer-ttl-seconds" -> {
                    ensureValue(args, i);
                    producerTtlSeconds = parseLong(args, ++i);
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(
                port,
                longPollTimeoutMs,
                compression,
                cursorIntervalSeconds,
                maxPageMessages,
                producerTtlSeconds
        );
    }

    private static int parseInt(String[] args, int i) {
        try {
            return Integer.parseInt(args[i]);
        } catch (NumberFormatException e) {
            System.err.println("Invalid value for " + args[i - 1] + ": " + args[i]);
            System.exit(1);
            return 0;
        }
    }

    private static long parseLong(String[] args, int i) {
        try {
            return Long.parseLong(args[i]);
        } catch (NumberFormatException e) {
            System.err.println("Invalid value for " + args[i - 1] + ": " + args[i]);
            System.exit(1);
            return 0;
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: durastream-server [options]

            Options:
              --port,    -p             HTTP port (default: 4437)
              --long-poll-timeout-ms    Long-poll wait / SSE keep-alive in ms (default: 30000)
              --compression             Compress large responses, true|false (default: true)
              --cursor-interval-seconds Stream-Cursor interval in seconds (default: 20)
              --max-page-messages       Max messages per catch-up response, 0 = unlimited (default: 0)
              --producer-ttl-seconds    Idle producer state TTL in seconds (default: 604800)
              --help,    -h             Show this help message
            """);
        System.exit(0);
    }
}

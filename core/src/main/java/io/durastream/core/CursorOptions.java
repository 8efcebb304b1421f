package io.durastream.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Read and cursor defaults.
 *
 * @param intervalSeconds  width of one cursor interval (Stream-Cursor granularity)
 * @param epoch            instant interval numbering starts from
 * @param defaultOffset    offset used when a client omits one ("-1" or "now")
 * @param maxPageMessages  upper bound on messages per catch-up response, 0 = unlimited
 */
public record CursorOptions(
        int intervalSeconds,
        Instant epoch,
        String defaultOffset,
        int maxPageMessages
) {

    public static final int DEFAULT_INTERVAL_SECONDS = 20;
    public static final Instant DEFAULT_EPOCH = Instant.parse("2024-10-09T00:00:00Z");

    public CursorOptions {
        Objects.requireNonNull(epoch, "epoch");
        Objects.requireNonNull(defaultOffset, "defaultOffset");
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("intervalSeconds must be > 0");
        }
        if (maxPageMessages < 0) {
            throw new IllegalArgumentException("maxPageMessages must be >= 0");
        }
        if (!Offset.BEGINNING.equals(defaultOffset) && !Offset.NOW.equals(defaultOffset)) {
            throw new IllegalArgumentException("defaultOffset must be -1 or now");
        }
    }

    public static CursorOptions defaults() {
        return new CursorOptions(DEFAULT_INTERVAL_SECONDS, DEFAULT_EPOCH, Offset.BEGINNING, 0);
    }

    public CursorOptions withIntervalSeconds(int seconds) {
        return new CursorOptions(seconds, epoch, defaultOffset, maxPageMessages);
    }

    public CursorOptions withMaxPageMessages(int max) {
        return new CursorOptions(intervalSeconds, epoch, defaultOffset, max);
    }
}

package io.durastream.core;

import java.time.Clock;
import java.util.Objects;
import java.util.Random;

/**
 * Generates the Stream-Cursor value returned on live reads.
 * <p>
 * The cursor is the number of whole intervals elapsed since
 * {@link CursorOptions#epoch()}. Caches key live responses on it, so it must
 * move forward even when a client keeps echoing a cursor that is already
 * current: in that case the client's value is advanced by a random jitter of
 * 1..3600 seconds worth of intervals.
 */
public final class ResponseCursor {

    private static final int MIN_JITTER_SECONDS = 1;
    private static final int MAX_JITTER_SECONDS = 3600;

    private final CursorOptions options;
    private final Clock clock;
    private final Random random;

    public ResponseCursor(CursorOptions options) {
        this(options, Clock.systemUTC(), new Random());
    }

    public ResponseCursor(CursorOptions options, Clock clock, Random random) {
        this.options = Objects.requireNonNull(options, "options");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = Objects.requireNonNull(random, "random");
    }

    /** Current interval number as a decimal string. */
    public String current() {
        long intervalMs = options.intervalSeconds() * 1000L;
        long elapsed = clock.millis() - options.epoch().toEpochMilli();
        return Long.toString(Math.floorDiv(elapsed, intervalMs));
    }

    /**
     * Cursor to send back given the one the client supplied (may be null).
     */
    public String next(String clientCursor) {
        String current = current();
        if (clientCursor == null || clientCursor.isEmpty()) {
            return current;
        }

        long clientInterval;
        try {
            clientInterval = Long.parseLong(clientCursor);
        } catch (NumberFormatException e) {
            return current;
        }

        long currentInterval = Long.parseLong(current);
        if (clientInterval < currentInterval) {
            return current;
        }
        return Long.toString(clientInterval + jitterIntervals());
    }

    private long jitterIntervals() {
        int jitterSeconds = MIN_JITTER_SECONDS + random.nextInt(MAX_JITTER_SECONDS - MIN_JITTER_SECONDS + 1);
        return Math.max(1, (jitterSeconds + options.intervalSeconds() - 1) / options.intervalSeconds());
    }
}

package io.durastream.core;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Position inside a single stream.
 * <p>
 * Wire format (fixed; client cursors persist across sessions):
 *   {@code <readSeq>_<byteOffset>}, both fields zero padded to 16 digits.
 * <p>
 * Design:
 *  - byteOffset is the cumulative number of stored bytes, so every non-empty
 *    append moves the offset strictly forward.
 *  - readSeq is reserved for segment rollover and stays 0 in the in-memory store.
 *  - Zero padding makes plain {@link String#compareTo} agree with numeric order,
 *    so callers can compare rendered offsets without decoding them.
 * <p>
 * Two sentinels exist on the wire: {@link #BEGINNING} ("-1") and {@link #NOW}
 * ("now"). They are never produced by the store, only accepted from clients.
 */
public record Offset(long readSeq, long byteOffset) implements Comparable<Offset> {

    public static final String BEGINNING = "-1";
    public static final String NOW = "now";

    /** Offset of an empty stream. */
    public static final Offset ZERO = new Offset(0, 0);

    private static final int WIDTH = 16;
    private static final Pattern CONCRETE = Pattern.compile("\\d+_\\d+");

    public Offset {
        if (readSeq < 0 || byteOffset < 0) {
            throw new IllegalArgumentException("offset components must be >= 0");
        }
    }

    /** Offset after {@code bytes} more bytes have been stored. */
    public Offset advance(int bytes) {
        if (bytes <= 0) {
            throw new IllegalArgumentException("advance requires a positive byte count, got " + bytes);
        }
        return new Offset(readSeq, byteOffset + bytes);
    }

    /** Render to the fixed wire representation. */
    public String render() {
        return pad(readSeq) + "_" + pad(byteOffset);
    }

    @Override
    public int compareTo(Offset other) {
        int c = Long.compare(readSeq, other.readSeq);
        return c != 0 ? c : Long.compare(byteOffset, other.byteOffset);
    }

    @Override
    public String toString() {
        return render();
    }

    /**
     * Parse a concrete rendered offset.
     *
     * @throws IllegalArgumentException for sentinels or malformed input
     */
    public static Offset parse(String raw) {
        Objects.requireNonNull(raw, "offset");
        if (!CONCRETE.matcher(raw).matches()) {
            throw new IllegalArgumentException("Invalid offset format: " + raw);
        }
        int sep = raw.indexOf('_');
        try {
            return new Offset(Long.parseLong(raw.substring(0, sep)), Long.parseLong(raw.substring(sep + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid offset format: " + raw, e);
        }
    }

    /** True for "-1", "now" or a concrete offset. */
    public static boolean isWellFormed(String raw) {
        return raw != null && (BEGINNING.equals(raw) || NOW.equals(raw) || CONCRETE.matcher(raw).matches());
    }

    /** True when the client asks to start from the beginning (absent or "-1"). */
    public static boolean isBeginning(String raw) {
        return raw == null || raw.isEmpty() || BEGINNING.equals(raw);
    }

    private static String pad(long v) {
        String s = Long.toString(v);
        if (s.length() >= WIDTH) {
            return s;
        }
        return "0".repeat(WIDTH - s.length()) + s;
    }
}

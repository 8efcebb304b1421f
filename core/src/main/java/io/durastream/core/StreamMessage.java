package io.durastream.core;

import java.util.Objects;

/**
 * One stored record: raw payload bytes, the offset the stream reached when
 * the record was appended, and the append wall-clock time in epoch millis.
 * <p>
 * Messages are never mutated after insertion; callers must not modify
 * {@link #data()}.
 */
public record StreamMessage(byte[] data, String offset, long timestamp) {

    public StreamMessage {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(offset, "offset");
    }

    public int size() {
        return data.length;
    }
}

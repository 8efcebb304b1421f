package io.durastream.storage;

import io.durastream.core.StreamMessage;

import java.util.List;

/**
 * Messages strictly after the requested offset.
 *
 * @param messages       immutable, in append order
 * @param upToDate       the requested offset already equalled the tail when read was called
 * @param currentOffset  the tail at the time of the call
 * @param closed         stream closed at the time of the call
 */
public record ReadResult(List<StreamMessage> messages, boolean upToDate, String currentOffset, boolean closed) {

    /** Offset the reader should continue from. */
    public String nextOffset() {
        return messages.isEmpty() ? currentOffset : messages.get(messages.size() - 1).offset();
    }
}

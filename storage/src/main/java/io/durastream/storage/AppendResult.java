package io.durastream.storage;

/**
 * Outcome of an append.
 *
 * @param offset        stream offset after the append (for duplicates: the offset the original append produced)
 * @param duplicate     true when a producer retransmit was recognised and nothing was stored
 * @param streamClosed  true when the stream is closed after this call
 */
public record AppendResult(String offset, boolean duplicate, boolean streamClosed) {
}

package io.durastream.storage;

/**
 * Outcome of a close.
 *
 * @param finalOffset    offset of the stream's tail
 * @param alreadyClosed  the stream was closed before this call
 * @param duplicate      a producer close (or earlier append) retried with an already applied tuple
 */
public record CloseResult(String finalOffset, boolean alreadyClosed, boolean duplicate) {
}

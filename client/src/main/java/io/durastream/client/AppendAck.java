package io.durastream.client;

/**
 * Server acknowledgement of an append or close.
 *
 * @param offset     Stream-Next-Offset after the request
 * @param duplicate  the server recognised a producer retransmit
 * @param closed     the stream is closed
 */
public record AppendAck(String offset, boolean duplicate, boolean closed) {
}

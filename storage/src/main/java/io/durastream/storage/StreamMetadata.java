package io.durastream.storage;

import java.time.Instant;

/**
 * Read-only snapshot of a stream's state. Taken under the stream's lock, so
 * all fields are mutually consistent.
 */
public record StreamMetadata(
        String path,
        String contentType,
        String currentOffset,
        boolean closed,
        Long ttlSeconds,
        Instant expiresAt,
        long createdAt,
        String lastWriterSeq,
        int messageCount,
        ProducerInfo closedBy
) {
}

package io.durastream.storage;

import java.time.Instant;

/**
 * Parameters for creating a stream. All fields are optional.
 *
 * @param contentType  media type of stored records; application/json enables JSON framing
 * @param ttlSeconds   lifetime counted from creation (null = none)
 * @param expiresAt    absolute expiry (null = none)
 * @param initialData  first record, appended as part of the create (null = none)
 * @param closed       create the stream already closed
 */
public record CreateOptions(
        String contentType,
        Long ttlSeconds,
        Instant expiresAt,
        byte[] initialData,
        boolean closed
) {

    public static CreateOptions defaults() {
        return new CreateOptions(null, null, null, null, false);
    }

    public static CreateOptions ofContentType(String contentType) {
        return new CreateOptions(contentType, null, null, null, false);
    }

    public CreateOptions withTtlSeconds(long ttl) {
        return new CreateOptions(contentType, ttl, expiresAt, initialData, closed);
    }

    public CreateOptions withExpiresAt(Instant at) {
        return new CreateOptions(contentType, ttlSeconds, at, initialData, closed);
    }

    public CreateOptions withInitialData(byte[] data) {
        return new CreateOptions(contentType, ttlSeconds, expiresAt, data, closed);
    }

    public CreateOptions withClosed(boolean c) {
        return new CreateOptions(contentType, ttlSeconds, expiresAt, initialData, c);
    }
}

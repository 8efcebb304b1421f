package io.durastream.storage;

import java.util.Objects;

/**
 * Base class for synchronous, deterministic store failures.
 * <p>
 * The store never retries; callers decide whether a retry is safe, using the
 * producer (id, epoch, seq) tuple as the idempotency key.
 */
public class StoreException extends RuntimeException {

    private final ErrorKind kind;

    public StoreException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public StoreException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }

    public static StoreException notFound(String path) {
        return new StoreException(ErrorKind.NOT_FOUND, "Stream not found: " + path);
    }

    public static StoreException conflict(String message) {
        return new StoreException(ErrorKind.CONFLICT, message);
    }

    public static StoreException validation(String message) {
        return new StoreException(ErrorKind.VALIDATION, message);
    }

    public static StoreException validation(String message, Throwable cause) {
        return new StoreException(ErrorKind.VALIDATION, message, cause);
    }
}

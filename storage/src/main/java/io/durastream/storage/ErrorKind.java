package io.durastream.storage;

/** Failure classes a store operation can report; the HTTP layer maps each to a status. */
public enum ErrorKind {
    NOT_FOUND,
    CONFLICT,
    ALREADY_CLOSED,
    STALE_EPOCH,
    OUT_OF_ORDER,
    VALIDATION
}

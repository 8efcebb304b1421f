package io.durastream.core.decode;

/**
 * One failed constraint.
 *
 * @param path    dotted field path ("" for the root value)
 * @param message why the value at {@code path} was rejected
 */
public record SchemaViolation(String path, String message) {

    @Override
    public String toString() {
        return (path.isEmpty() ? "/" : path) + ": " + message;
    }
}

package io.durastream.storage;

/** Append or producer close attempted on a stream that is already closed. */
public class StreamClosedException extends StoreException {

    private final String finalOffset;

    public StreamClosedException(String path, String finalOffset) {
        super(ErrorKind.ALREADY_CLOSED, "Stream is closed: " + path);
        this.finalOffset = finalOffset;
    }

    public String finalOffset() {
        return finalOffset;
    }
}

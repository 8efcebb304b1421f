package io.durastream.storage;

/** Producer sequence number is not the next expected one. */
public class SequenceGapException extends StoreException {

    private final long expectedSeq;
    private final long receivedSeq;

    public SequenceGapException(String producerId, long expectedSeq, long receivedSeq) {
        super(ErrorKind.OUT_OF_ORDER,
                "Producer sequence gap for " + producerId + ": expected " + expectedSeq + ", received " + receivedSeq);
        this.expectedSeq = expectedSeq;
        this.receivedSeq = receivedSeq;
    }

    public long expectedSeq() {
        return expectedSeq;
    }

    public long receivedSeq() {
        return receivedSeq;
    }
}

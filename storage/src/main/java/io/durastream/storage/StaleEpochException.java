package io.durastream.storage;

/** Producer epoch lower than the one already recorded for that producer. */
public class StaleEpochException extends StoreException {

    private final long currentEpoch;

    public StaleEpochException(String producerId, long receivedEpoch, long currentEpoch) {
        super(ErrorKind.STALE_EPOCH,
                "Stale producer epoch for " + producerId + ": " + receivedEpoch + " < " + currentEpoch);
        this.currentEpoch = currentEpoch;
    }

    public long currentEpoch() {
        return currentEpoch;
    }
}

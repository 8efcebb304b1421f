package io.durastream.storage;

import java.util.Objects;

/**
 * Identity of an idempotent producer for one request.
 *
 * @param producerId stable writer id
 * @param epoch      bumped by the writer on restart; never decreases
 * @param seq        per-epoch sequence, starting at 0
 */
public record ProducerInfo(String producerId, long epoch, long seq) {

    public ProducerInfo {
        Objects.requireNonNull(producerId, "producerId");
        if (producerId.isEmpty()) {
            throw new IllegalArgumentException("producerId must not be empty");
        }
        if (epoch < 0 || seq < 0) {
            throw new IllegalArgumentException("epoch and seq must be >= 0");
        }
    }
}

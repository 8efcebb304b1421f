package io.durastream.storage;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-stream producer (epoch, seq) bookkeeping for idempotent appends.
 *
 * Semantics:
 *  - epoch lower than the recorded one        -> {@link StaleEpochException}
 *  - unknown producer or higher epoch          -> accepted only with seq 0 (higher epoch resets tracking)
 *  - same epoch, seq <= recorded seq           -> duplicate, answer with the original offset
 *  - same epoch, seq == recorded seq + 1       -> accepted
 *  - anything else                              -> {@link SequenceGapException}
 *
 * Implementation notes:
 *  - Validation and commit are split so the store can fail the append after
 *    validation (e.g. JSON errors) without recording the seq.
 *  - Callers hold the owning stream's lock; the map is concurrent only so
 *    snapshots can be taken without it.
 *  - Idle producers are evicted lazily, scanning a bounded number of entries per
 *    call, after {@code ttl} without activity.
 *  - Each producer remembers the offsets of its last {@link #RECENT_WINDOW}
 *    sequence numbers; an older retransmit falls back to the latest offset.
 */
public final class ProducerRegistry {

    /** Sequence numbers per producer whose exact offsets are remembered. */
    static final int RECENT_WINDOW = 64;

    private static final int SCAN_LIMIT = 64;

    private final Map<String, ProducerState> producers = new ConcurrentHashMap<>();
    private final Clock clock;
    private final long ttlMillis;

    public ProducerRegistry(Clock clock, Duration ttl) {
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive, got: " + ttl);
        }
        this.ttlMillis = ttl.toMillis();
    }

    /** Outcome of {@link #validate}: either accepted, or a duplicate carrying the original offset. */
    public record Decision(boolean duplicate, String duplicateOffset) {
        static final Decision ACCEPT = new Decision(false, null);
    }

    /**
     * Check {@code info} against the recorded state without mutating it.
     *
     * @throws StaleEpochException  epoch went backwards
     * @throws SequenceGapException seq is not the next expected value
     */
    public Decision validate(ProducerInfo info) {
        long now = clock.millis();
        evictIdle(now);

        ProducerState state = producers.get(info.producerId());
        if (state == null || info.epoch() > state.epoch) {
            if (info.seq() != 0) {
                throw new SequenceGapException(info.producerId(), 0, info.seq());
            }
            return Decision.ACCEPT;
        }
        if (info.epoch() < state.epoch) {
            throw new StaleEpochException(info.producerId(), info.epoch(), state.epoch);
        }
        if (info.seq() <= state.lastSeq) {
            String original = state.recentOffsets.getOrDefault(info.seq(), state.lastOffset);
            return new Decision(true, original);
        }
        if (info.seq() == state.lastSeq + 1) {
            return Decision.ACCEPT;
        }
        throw new SequenceGapException(info.producerId(), state.lastSeq + 1, info.seq());
    }

    /** Record an accepted (epoch, seq) and the offset it produced. */
    public void commit(ProducerInfo info, String offset) {
        long now = clock.millis();
        ProducerState state = producers.get(info.producerId());
        if (state == null || info.epoch() > state.epoch) {
            state = new ProducerState(info.epoch());
            producers.put(info.producerId(), state);
        }
        state.lastSeq = info.seq();
        state.lastOffset = offset;
        state.lastUpdated = now;
        state.recentOffsets.put(info.seq(), offset);
    }

    /** Current (epoch, lastSeq) for a producer, or null if unknown. */
    public ProducerInfo lastAccepted(String producerId) {
        ProducerState state = producers.get(producerId);
        return state == null ? null : new ProducerInfo(producerId, state.epoch, state.lastSeq);
    }

    public int size() {
        return producers.size();
    }

    private void evictIdle(long now) {
        int scanned = 0;
        for (var it = producers.entrySet().iterator(); it.hasNext() && scanned < SCAN_LIMIT; scanned++) {
            var e = it.next();
            if (now - e.getValue().lastUpdated > ttlMillis) {
                it.remove();
            }
        }
    }

    private static final class ProducerState {
        final long epoch;
        long lastSeq = -1;
        String lastOffset;
        long lastUpdated;
        final Map<Long, String> recentOffsets = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Long, String> eldest) {
                return size() > RECENT_WINDOW;
            }
        };

        ProducerState(long epoch) {
            this.epoch = epoch;
        }
    }
}

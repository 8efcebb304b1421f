package io.durastream.server.fault;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Per-path fault table consulted before every stream request.
 * <p>
 * Consumption rules, in order:
 *  1) no fault for the path                     -> null
 *  2) fault scoped to another method            -> null, count untouched
 *  3) probability gate fails                    -> null, count untouched
 *  4) otherwise the remaining count is decremented and the fault returned;
 *     it is removed once the count reaches 0.
 */
public final class FaultInjector {
    private static final Logger log = Logger.getLogger(FaultInjector.class.getName());

    private final Map<String, Entry> faults = new HashMap<>();
    private final Random random;

    public FaultInjector() {
        this(new Random());
    }

    public FaultInjector(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /** Install (or replace) the fault for {@code path}. */
    public synchronized void install(String path, InjectedFault fault) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(fault, "fault");
        faults.put(path, new Entry(fault));
        log.info(() -> "fault installed for " + path + ": " + fault);
    }

    public synchronized void clear() {
        faults.clear();
    }

    public synchronized int size() {
        return faults.size();
    }

    /** Fault to apply to this request, or null. */
    public synchronized InjectedFault consume(String path, String method) {
        Entry entry = faults.get(path);
        if (entry == null) {
            return null;
        }
        InjectedFault fault = entry.fault;
        if (fault.method() != null && !fault.method().toUpperCase(Locale.ROOT).equals(method.toUpperCase(Locale.ROOT))) {
            return null;
        }
        if (fault.probability() != null && random.nextDouble() > fault.probability()) {
            return null;
        }
        entry.remaining--;
        if (entry.remaining <= 0) {
            faults.remove(path);
        }
        return fault;
    }

    /** Total delay for a delayed fault: delayMs plus random jitter. */
    public synchronized long delayMillis(InjectedFault fault) {
        long delay = fault.delayMs() == null ? 0 : fault.delayMs();
        if (fault.jitterMs() != null && fault.jitterMs() > 0) {
            delay += (long) (random.nextDouble() * fault.jitterMs());
        }
        return delay;
    }

    /** Apply truncation, then corruption, to a response body. */
    public synchronized byte[] mangleBody(InjectedFault fault, byte[] body) {
        byte[] out = body;
        if (fault.truncateBodyBytes() != null && out.length > fault.truncateBodyBytes()) {
            out = Arrays.copyOf(out, fault.truncateBodyBytes());
        }
        if (fault.corruptBody() && out.length > 0) {
            out = out.clone();
            out[0] = 'X';
            if (out.length > 1) {
                out[1] = 'Y';
            }
            int corrupt = Math.max(1, out.length / 10);
            for (int i = 0; i < corrupt; i++) {
                out[random.nextInt(out.length)] = 'Z';
            }
        }
        return out;
    }

    private static final class Entry {
        final InjectedFault fault;
        int remaining;

        Entry(InjectedFault fault) {
            this.fault = fault;
            this.remaining = fault.count();
        }
    }
}

package io.durastream.client;

import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Exponential backoff with full jitter.
 * <p>
 * Attempt {@code n} (0-based) that fails waits a uniformly random time in
 * {@code [0, min(initialDelay * multiplier^n, maxDelay))} before the next try.
 * A failure is retried unless
 *  - the retry budget is spent,
 *  - the {@link CancellationToken} is signalled, or
 *  - the {@code retryOn} predicate rejects it.
 * Cancellation during a wait ends the loop with a {@link CancellationException}
 * whose cause is the last failure.
 */
public final class RetryPolicy {
    private static final Logger log = Logger.getLogger(RetryPolicy.class.getName());

    /** One attempt; receives the 0-based attempt number. */
    @FunctionalInterface
    public interface Attempt<T> {
        T run(int attempt) throws Exception;
    }

    private final int maxRetries;
    private final long initialDelayMs;
    private final long maxDelayMs;
    private final double multiplier;
    private final Predicate<Exception> retryOn;
    private final Random random;

    public RetryPolicy(int maxRetries, long initialDelayMs, long maxDelayMs, double multiplier,
                       Predicate<Exception> retryOn, Random random) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (initialDelayMs < 0 || maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException("need 0 <= initialDelayMs <= maxDelayMs");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
        this.maxRetries = maxRetries;
        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.multiplier = multiplier;
        this.retryOn = Objects.requireNonNull(retryOn, "retryOn");
        this.random = Objects.requireNonNull(random, "random");
    }

    /** 3 retries, 100 ms initial delay, 10 s cap, doubling; retries every failure. */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, 100, 10_000, 2.0, e -> true, new Random());
    }

    public RetryPolicy withMaxRetries(int n) {
        return new RetryPolicy(n, initialDelayMs, maxDelayMs, multiplier, retryOn, random);
    }

    public RetryPolicy withDelays(long initialMs, long maxMs) {
        return new RetryPolicy(maxRetries, initialMs, maxMs, multiplier, retryOn, random);
    }

    public RetryPolicy retryingOn(Predicate<Exception> predicate) {
        return new RetryPolicy(maxRetries, initialDelayMs, maxDelayMs, multiplier, predicate, random);
    }

    public RetryPolicy withRandom(Random r) {
        return new RetryPolicy(maxRetries, initialDelayMs, maxDelayMs, multiplier, retryOn, r);
    }

    public int maxRetries() {
        return maxRetries;
    }

    /** Upper bound of the wait after the failed attempt {@code attempt}. */
    public long backoffCeiling(int attempt) {
        double ceiling = initialDelayMs * Math.pow(multiplier, attempt);
        return (long) Math.min(ceiling, maxDelayMs);
    }

    public <T> T execute(Attempt<T> op) throws Exception {
        return execute(op, CancellationToken.none());
    }

    public <T> T execute(Attempt<T> op, CancellationToken token) throws Exception {
        for (int attempt = 0; ; attempt++) {
            try {
                return op.run(attempt);
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                if (token.isCancelled()) {
                    throw e;
                }
                if (attempt >= maxRetries || !retryOn.test(e)) {
                    throw e;
                }
                long wait = (long) (random.nextDouble() * backoffCeiling(attempt));
                int next = attempt + 1;
                log.log(Level.FINE, "attempt " + next + " failed, retrying in " + wait + "ms", e);
                if (token.sleep(wait)) {
                    var cancelled = new CancellationException("retry cancelled after attempt " + next);
                    cancelled.initCause(e);
                    throw cancelled;
                }
            }
        }
    }
}

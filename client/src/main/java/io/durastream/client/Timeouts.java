package io.durastream.client;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Races an operation against a deadline. Losing the race is not an error:
 * the result is simply empty and the operation is interrupted.
 */
public final class Timeouts {
    private static final AtomicInteger THREADS = new AtomicInteger();
    private static final ExecutorService RUNNER = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "durastream-timeout-" + THREADS.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private Timeouts() {
        // utility
    }

    /**
     * @return the operation's result, or empty if it did not finish within {@code timeout}
     * @throws Exception whatever the operation threw, unwrapped
     */
    public static <T> Optional<T> race(Callable<T> op, Duration timeout) throws Exception {
        Future<T> future = RUNNER.submit(op);
        try {
            return Optional.ofNullable(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            return Optional.empty();
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }
}

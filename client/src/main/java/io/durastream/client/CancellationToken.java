package io.durastream.client;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation signal shared between a caller and long-running client work.
 */
public final class CancellationToken {
    private final CountDownLatch cancelled = new CountDownLatch(1);

    /** Token that is never cancelled. */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Sleep for up to {@code millis}, waking early on cancellation.
     *
     * @return true if the token was cancelled before or during the wait
     */
    public boolean sleep(long millis) throws InterruptedException {
        if (millis <= 0) {
            return isCancelled();
        }
        return cancelled.await(millis, TimeUnit.MILLISECONDS);
    }
}

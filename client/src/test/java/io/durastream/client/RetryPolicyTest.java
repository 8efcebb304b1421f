package io.durastream.client;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private static final Random ZERO_JITTER = new Random() {
        @Override
        public double nextDouble() {
            return 0.0;
        }
    };

    @Test
    void backoff_grows_exponentially_up_to_the_cap() {
        var policy = new RetryPolicy(10, 100, 1000, 2.0, e -> true, new Random());
        assertEquals(100, policy.backoffCeiling(0));
        assertEquals(200, policy.backoffCeiling(1));
        assertEquals(400, policy.backoffCeiling(2));
        assertEquals(800, policy.backoffCeiling(3));
        assertEquals(1000, policy.backoffCeiling(4));
        assertEquals(1000, policy.backoffCeiling(20));
    }

    @Test
    void succeeds_after_transient_failures() throws Exception {
        var calls = new AtomicInteger();
        var policy = RetryPolicy.defaults().withRandom(ZERO_JITTER);

        String result = policy.execute(attempt -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("flaky");
            }
            return "ok@" + attempt;
        });

        assertEquals("ok@2", result);
        assertEquals(3, calls.get());
    }

    @Test
    void gives_up_after_max_retries_with_last_error() {
        var calls = new AtomicInteger();
        var policy = RetryPolicy.defaults().withMaxRetries(2).withRandom(ZERO_JITTER);

        var ex = assertThrows(IOException.class, () -> policy.execute(attempt -> {
            calls.incrementAndGet();
            throw new IOException("down " + attempt);
        }));
        assertEquals("down 2", ex.getMessage());
        assertEquals(3, calls.get());
    }

    @Test
    void rejected_failures_are_not_retried() {
        var calls = new AtomicInteger();
        var policy = RetryPolicy.defaults().withRandom(ZERO_JITTER)
                .retryingOn(e -> !(e instanceof IllegalStateException));

        assertThrows(IllegalStateException.class, () -> policy.execute(attempt -> {
            calls.incrementAndGet();
            throw new IllegalStateException("fatal");
        }));
        assertEquals(1, calls.get());
    }

    @Test
    void already_cancelled_token_stops_retrying() {
        var token = new CancellationToken();
        token.cancel();
        var calls = new AtomicInteger();

        assertThrows(IOException.class, () -> RetryPolicy.defaults().execute(attempt -> {
            calls.incrementAndGet();
            throw new IOException("x");
        }, token));
        assertEquals(1, calls.get());
    }

    @Test
    void cancellation_during_backoff_ends_the_wait() {
        var token = new CancellationToken();
        Random alwaysMax = new Random() {
            @Override
            public double nextDouble() {
                return 0.999;
            }
        };
        var policy = new RetryPolicy(5, 5_000, 5_000, 2.0, e -> true, alwaysMax);

        long start = System.nanoTime();
        var ex = assertThrows(CancellationException.class, () -> policy.execute(attempt -> {
            new Thread(token::cancel).start();
            throw new IOException("x");
        }, token));
        long waitedMs = (System.nanoTime() - start) / 1_000_000L;

        assertInstanceOf(IOException.class, ex.getCause());
        assertTrue(waitedMs < 4_000, "waited " + waitedMs + "ms");
    }

    @Test
    void invalid_settings_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(-1, 1, 1, 2, e -> true, new Random()));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, 10, 5, 2, e -> true, new Random()));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, 1, 5, 0.5, e -> true, new Random()));
    }
}

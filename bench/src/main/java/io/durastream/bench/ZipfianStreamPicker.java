package io.durastream.bench;

import java.util.Random;

/**
 * Picks one of {@code n} stream paths with Zipfian skew: a few hot streams
 * receive most of the traffic, like chat rooms or agent sessions in practice.
 * <p>
 * Weights are precomputed once; sampling is a binary search over the CDF.
 */
public final class ZipfianStreamPicker {

    private final String prefix;
    private final double[] cdf;
    private final Random rnd;

    public ZipfianStreamPicker(String prefix, int n, double skew, long seed) {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be > 0");
        }
        if (skew <= 0.0) {
            throw new IllegalArgumentException("skew must be > 0");
        }
        this.prefix = prefix;
        this.rnd = new Random(seed);
        this.cdf = new double[n];

        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            sum += 1.0 / Math.pow(i + 1, skew);
            cdf[i] = sum;
        }
        for (int i = 0; i < n; i++) {
            cdf[i] /= sum;
        }
    }

    public int size() {
        return cdf.length;
    }

    public String path(int rank) {
        return prefix + "/" + rank;
    }

    /** Rank in [0, n); rank 0 is the hottest stream. */
    public synchronized int nextRank() {
        double u = rnd.nextDouble();
        int lo = 0;
        int hi = cdf.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (u <= cdf[mid]) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }

    public String nextPath() {
        return path(nextRank());
    }
}

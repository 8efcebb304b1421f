package io.durastream.bench;

import io.durastream.client.StreamClient;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Append/read workload driver against a single stream server.
 *
 * Usage:
 *   java -cp bench.jar io.durastream.bench.StreamBench \
 *     --base-url http://localhost:4437 \
 *     --threads 8 \
 *     --duration-seconds 30 \
 *     --streams 100 \
 *     --payload-bytes 512 \
 *     --write-ratio 0.5 \
 *     --zipf-skew 0.99
 *
 * Readers resume from the last offset they saw on each stream, so reads
 * measure incremental catch-up rather than full replays.
 *
 * Output:
 *   - Summary line to stderr.
 *   - CSV to stdout with per-op latency samples:
 *       op,success,latency_ms
 */
public final class StreamBench {
    private static final Logger log = Logger.getLogger(StreamBench.class.getName());

    private static final String CONTENT_TYPE = "application/octet-stream";

    record Sample(String op, boolean ok, double latencyMs) {
    }

    public static void main(String[] args) throws Exception {
        Map<String, String> cfg = parseArgs(args);

        String baseUrl = cfg.getOrDefault("base-url", "http://localhost:4437");
        int threads = Integer.parseInt(cfg.getOrDefault("threads", "4"));
        int durationSeconds = Integer.parseInt(cfg.getOrDefault("duration-seconds", "30"));
        int streams = Integer.parseInt(cfg.getOrDefault("streams", "100"));
        int payloadBytes = Integer.parseInt(cfg.getOrDefault("payload-bytes", "512"));
        double writeRatio = Double.parseDouble(cfg.getOrDefault("write-ratio", "0.5"));
        double zipfSkew = Double.parseDouble(cfg.getOrDefault("zipf-skew", "0.99"));

        var picker = new ZipfianStreamPicker("/bench", streams, zipfSkew, 42L);
        List<Sample> all = run(new StreamClient(baseUrl), picker, threads, durationSeconds, payloadBytes, writeRatio);
        summarizeAndPrint(all, durationSeconds);
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("--")) {
                String key = a.substring(2);
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("missing value for " + a);
                }
                out.put(key, args[++i]);
            } else {
                throw new IllegalArgumentException("unexpected arg: " + a);
            }
        }
        return out;
    }

    static List<Sample> run(StreamClient client,
                            ZipfianStreamPicker picker,
                            int threads,
                            int durationSeconds,
                            int payloadBytes,
                            double writeRatio) throws Exception {
        for (int i = 0; i < picker.size(); i++) {
            client.create(picker.path(i), CONTENT_TYPE);
        }

        byte[] payload = new byte[payloadBytes];
        Arrays.fill(payload, (byte) 'x');

        Map<String, String> readOffsets = new ConcurrentHashMap<>();
        ExecutorService exec = Executors.newFixedThreadPool(threads);
        BlockingQueue<Sample> samples = new LinkedBlockingQueue<>();
        AtomicLong failures = new AtomicLong();
        long endTime = System.nanoTime() + TimeUnit.SECONDS.toNanos(durationSeconds);

        Runnable worker = () -> {
            ThreadLocalRandom rnd = ThreadLocalRandom.current();
            while (System.nanoTime() < endTime) {
                boolean isWrite = rnd.nextDouble() < writeRatio;
                String path = picker.nextPath();

                String op = isWrite ? "APPEND" : "READ";
                long start = System.nanoTime();
                boolean ok = false;
                try {
                    if (isWrite) {
                        client.append(path, CONTENT_TYPE, payload);
                    } else {
                        var r = client.read(path, readOffsets.getOrDefault(path, "-1"));
                        if (r.nextOffset() != null) {
                            readOffsets.put(path, r.nextOffset());
                        }
                    }
                    ok = true;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                } catch (Exception e) {
                    if (failures.incrementAndGet() == 1) {
                        log.log(Level.WARNING, "first failed " + op + " on " + path, e);
                    }
                } finally {
                    double latencyMs = (System.nanoTime() - start) / 1_000_000.0;
                    samples.add(new Sample(op, ok, latencyMs));
                }
            }
        };

        for (int i = 0; i < threads; i++) {
            exec.submit(worker);
        }
        exec.shutdown();
        if (!exec.awaitTermination(durationSeconds + 5L, TimeUnit.SECONDS)) {
            exec.shutdownNow();
        }

        List<Sample> all = new ArrayList<>(samples.size());
        samples.drainTo(all);
        return all;
    }

    private static void summarizeAndPrint(List<Sample> all, int durationSeconds) {
        if (all.isEmpty()) {
            System.err.println("no samples collected");
            return;
        }

        double throughput = all.size() / (double) durationSeconds;

        List<Double> latencies = new ArrayList<>(all.size());
        for (Sample s : all) {
            if (s.ok()) {
                latencies.add(s.latencyMs());
            }
        }
        Collections.sort(latencies);

        long okCount = latencies.size();
        long errCount = all.size() - okCount;

        System.err.printf(
                "throughput=%.2f ops/s, ok=%d, err=%d, p50=%.2fms, p95=%.2fms, p99=%.2fms%n",
                throughput, okCount, errCount,
                percentile(latencies, 0.50), percentile(latencies, 0.95), percentile(latencies, 0.99)
        );

        // CSV to stdout.
        System.out.println("op,success,latency_ms");
        for (Sample s : all) {
            System.out.printf("%s,%s,%.3f%n", s.op(), s.ok() ? "1" : "0", s.latencyMs());
        }
    }

    static double percentile(List<Double> sorted, double q) {
        if (sorted.isEmpty()) return Double.NaN;
        double idx = q * (sorted.size() - 1);
        int lo = (int) Math.floor(idx);
        int hi = (int) Math.ceil(idx);
        if (lo == hi) return sorted.get(lo);
        double w = idx - lo;
        return sorted.get(lo) * (1 - w) + sorted.get(hi) * w;
    }
}

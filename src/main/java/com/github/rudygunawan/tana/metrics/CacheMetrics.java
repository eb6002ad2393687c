package com.github.rudygunawan.tana.metrics;

import com.github.rudygunawan.tana.model.RecentStats;
import com.github.rudygunawan.tana.time.Ticker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Records cache hits, misses, hit latencies and evictions, and derives rates and latency
 * percentiles from them on demand.
 *
 * <p>Statistics grow until {@link #reset()}; there is no automatic decay. Every method is
 * synchronized on this instance, so recording from cache callers races safely with the alert
 * manager reading a snapshot. Recording is never serialized with the cache's own lock.
 *
 * <p>Eviction times are read from the {@link Ticker}, which lets tests move the eviction window
 * without sleeping.
 */
public class CacheMetrics {
    private static final long NANOS_PER_MILLI = 1_000_000L;

    private final Ticker ticker;
    private long hits;
    private long misses;
    private final List<Long> latencyNanos = new ArrayList<>();
    private final List<Long> evictionTimes = new ArrayList<>();

    public CacheMetrics() {
        this(Ticker.systemTicker());
    }

    public CacheMetrics(Ticker ticker) {
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
    }

    /**
     * Records a hit served in {@code latency}.
     */
    public synchronized void recordHit(Duration latency) {
        Objects.requireNonNull(latency, "latency cannot be null");
        hits++;
        latencyNanos.add(latency.toNanos());
    }

    public synchronized void recordMiss() {
        misses++;
    }

    /**
     * Records an eviction at the ticker's current time.
     */
    public synchronized void recordEviction() {
        evictionTimes.add(ticker.read());
    }

    public synchronized long hitCount() {
        return hits;
    }

    public synchronized long missCount() {
        return misses;
    }

    /**
     * Returns {@code hitCount + missCount}.
     */
    public synchronized long totalRequests() {
        return hits + misses;
    }

    /**
     * Returns the number of evictions recorded since creation or the last reset.
     */
    public synchronized long evictionCount() {
        return evictionTimes.size();
    }

    /**
     * Returns {@code hitCount / totalRequests}, or {@code 0.0} when there were no requests.
     */
    public synchronized double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }

    /**
     * Returns {@code missCount / totalRequests}, or {@code 0.0} when there were no requests.
     */
    public synchronized double missRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) misses / total;
    }

    /**
     * Returns the mean hit latency, truncated to whole nanoseconds, or {@link Duration#ZERO} when
     * no hit has been recorded.
     */
    public synchronized Duration averageLatency() {
        if (latencyNanos.isEmpty()) {
            return Duration.ZERO;
        }
        long total = 0;
        for (long nanos : latencyNanos) {
            total += nanos;
        }
        return Duration.ofNanos(total / latencyNanos.size());
    }

    /**
     * Returns the hit latency at {@code percentile}.
     *
     * <p>Samples are sorted ascending and the one at index {@code floor((n - 1) * percentile / 100)}
     * is returned. The median of an even number of samples is the mean of the two central samples.
     *
     * @param percentile a value between 0 and 100 inclusive
     * @return the latency, or {@link Duration#ZERO} when no hit has been recorded
     * @throws IllegalArgumentException if {@code percentile} is outside [0, 100]
     */
    public synchronized Duration getLatencyPercentile(double percentile) {
        if (!(percentile >= 0 && percentile <= 100)) {
            throw new IllegalArgumentException("percentile must be between 0 and 100, was " + percentile);
        }
        if (latencyNanos.isEmpty()) {
            return Duration.ZERO;
        }
        long[] sorted = sortedLatencies();
        int n = sorted.length;
        if (percentile == 50 && n % 2 == 0) {
            long lower = sorted[n / 2 - 1];
            return Duration.ofNanos(lower + (sorted[n / 2] - lower) / 2);
        }
        int index = (int) ((n - 1) * percentile / 100);
        return Duration.ofNanos(sorted[index]);
    }

    /**
     * Takes a snapshot for threshold checks. Rates and latencies cover the whole retained history;
     * the eviction rate counts only evictions recorded within {@code window} of now.
     *
     * @param window the eviction window, typically the alert check interval
     * @throws IllegalArgumentException if {@code window} is shorter than one millisecond
     */
    public synchronized RecentStats getRecentStats(Duration window) {
        long windowMillis = Objects.requireNonNull(window, "window cannot be null").toMillis();
        if (windowMillis <= 0) {
            throw new IllegalArgumentException("window must be at least 1ms, was " + window);
        }
        long windowStart = ticker.read() - windowMillis * NANOS_PER_MILLI;
        long recentEvictions = 0;
        for (long time : evictionTimes) {
            if (time > windowStart) {
                recentEvictions++;
            }
        }
        return new RecentStats(
                hitRate(),
                missRate(),
                averageLatency(),
                getLatencyPercentile(95),
                getLatencyPercentile(99),
                recentEvictions * 60_000 / windowMillis);
    }

    /**
     * Clears all counters and samples, returning to the state right after construction.
     */
    public synchronized void reset() {
        hits = 0;
        misses = 0;
        latencyNanos.clear();
        evictionTimes.clear();
    }

    private long[] sortedLatencies() {
        long[] sorted = new long[latencyNanos.size()];
        for (int i = 0; i < sorted.length; i++) {
            sorted[i] = latencyNanos.get(i);
        }
        Arrays.sort(sorted);
        return sorted;
    }

    @Override
    public synchronized String toString() {
        return "CacheMetrics{"
                + "hits=" + hits
                + ", misses=" + misses
                + ", evictions=" + evictionTimes.size()
                + ", hitRate=" + String.format("%.2f%%", hitRate() * 100)
                + '}';
    }
}

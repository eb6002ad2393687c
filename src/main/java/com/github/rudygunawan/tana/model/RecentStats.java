package com.github.rudygunawan.tana.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Snapshot of a cache's performance as seen by the alert manager. Instances of this class are
 * immutable.
 *
 * <p>Rates and latencies cover everything recorded since the metrics were created or last reset.
 * Only {@link #evictionsPerMinute()} is restricted to the window the snapshot was taken for.
 */
public final class RecentStats {
    private final double hitRate;
    private final double missRate;
    private final Duration averageLatency;
    private final Duration p95Latency;
    private final Duration p99Latency;
    private final long evictionsPerMinute;

    /**
     * Constructs a new {@code RecentStats} instance.
     */
    public RecentStats(
            double hitRate,
            double missRate,
            Duration averageLatency,
            Duration p95Latency,
            Duration p99Latency,
            long evictionsPerMinute) {
        this.hitRate = hitRate;
        this.missRate = missRate;
        this.averageLatency = Objects.requireNonNull(averageLatency);
        this.p95Latency = Objects.requireNonNull(p95Latency);
        this.p99Latency = Objects.requireNonNull(p99Latency);
        this.evictionsPerMinute = evictionsPerMinute;
    }

    /**
     * Returns the ratio of lookups which were hits, or {@code 0.0} when there were none.
     */
    public double hitRate() {
        return hitRate;
    }

    /**
     * Returns the ratio of lookups which were misses, or {@code 0.0} when there were none.
     */
    public double missRate() {
        return missRate;
    }

    public Duration averageLatency() {
        return averageLatency;
    }

    public Duration p95Latency() {
        return p95Latency;
    }

    public Duration p99Latency() {
        return p99Latency;
    }

    /**
     * Returns the evictions inside the window, scaled to a per-minute rate.
     */
    public long evictionsPerMinute() {
        return evictionsPerMinute;
    }

    @Override
    public int hashCode() {
        return Objects.hash(hitRate, missRate, averageLatency, p95Latency, p99Latency, evictionsPerMinute);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof RecentStats)) {
            return false;
        }
        RecentStats other = (RecentStats) obj;
        return Double.compare(hitRate, other.hitRate) == 0
                && Double.compare(missRate, other.missRate) == 0
                && averageLatency.equals(other.averageLatency)
                && p95Latency.equals(other.p95Latency)
                && p99Latency.equals(other.p99Latency)
                && evictionsPerMinute == other.evictionsPerMinute;
    }

    @Override
    public String toString() {
        return "RecentStats{"
                + "hitRate=" + String.format("%.2f%%", hitRate * 100)
                + ", missRate=" + String.format("%.2f%%", missRate * 100)
                + ", averageLatency=" + averageLatency.toMillis() + "ms"
                + ", p95Latency=" + p95Latency.toMillis() + "ms"
                + ", p99Latency=" + p99Latency.toMillis() + "ms"
                + ", evictionsPerMinute=" + evictionsPerMinute
                + '}';
    }
}

package com.github.rudygunawan.tana.alert;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Thresholds and notification target for an {@link AlertManager}. Instances are immutable and are
 * created with {@link #builder(Consumer)}.
 *
 * <p>Usage example:
 * <pre>{@code
 * AlertConfig config = AlertConfig.builder(message -> log.warning(message))
 *     .hitRateThreshold(0.8)
 *     .p99LatencyThresholdMs(50)
 *     .alertCheckInterval(Duration.ofSeconds(30))
 *     .build();
 * }</pre>
 */
public final class AlertConfig {
    public static final double DEFAULT_HIT_RATE_THRESHOLD = 0.5;
    public static final double DEFAULT_MISS_RATE_THRESHOLD = 0.5;
    public static final long DEFAULT_P95_LATENCY_THRESHOLD_MS = 200;
    public static final long DEFAULT_P99_LATENCY_THRESHOLD_MS = 300;
    public static final long DEFAULT_EVICTIONS_PER_MINUTE_THRESHOLD = 1000;
    public static final long DEFAULT_AVERAGE_LATENCY_THRESHOLD_MS = 100;
    public static final Duration DEFAULT_ALERT_CHECK_INTERVAL = Duration.ofMinutes(1);

    private final Consumer<String> notifyCallback;
    private final double hitRateThreshold;
    private final double missRateThreshold;
    private final long p95LatencyThresholdMs;
    private final long p99LatencyThresholdMs;
    private final long evictionsPerMinuteThreshold;
    private final long averageLatencyThresholdMs;
    private final Duration alertCheckInterval;

    private AlertConfig(Builder builder) {
        this.notifyCallback = builder.notifyCallback;
        this.hitRateThreshold = builder.hitRateThreshold;
        this.missRateThreshold = builder.missRateThreshold;
        this.p95LatencyThresholdMs = builder.p95LatencyThresholdMs;
        this.p99LatencyThresholdMs = builder.p99LatencyThresholdMs;
        this.evictionsPerMinuteThreshold = builder.evictionsPerMinuteThreshold;
        this.averageLatencyThresholdMs = builder.averageLatencyThresholdMs;
        this.alertCheckInterval = builder.alertCheckInterval;
    }

    /**
     * Starts a configuration that sends alert messages to {@code notifyCallback}. Every threshold
     * not set explicitly keeps its default.
     *
     * @throws NullPointerException if {@code notifyCallback} is null
     */
    public static Builder builder(Consumer<String> notifyCallback) {
        return new Builder(notifyCallback);
    }

    /**
     * Returns a configuration with all default thresholds.
     */
    public static AlertConfig defaults(Consumer<String> notifyCallback) {
        return builder(notifyCallback).build();
    }

    public Consumer<String> notifyCallback() {
        return notifyCallback;
    }

    /**
     * Hit rates below this value raise an alert.
     */
    public double hitRateThreshold() {
        return hitRateThreshold;
    }

    /**
     * Miss rates above this value raise an alert.
     */
    public double missRateThreshold() {
        return missRateThreshold;
    }

    public long p95LatencyThresholdMs() {
        return p95LatencyThresholdMs;
    }

    public long p99LatencyThresholdMs() {
        return p99LatencyThresholdMs;
    }

    public long evictionsPerMinuteThreshold() {
        return evictionsPerMinuteThreshold;
    }

    public long averageLatencyThresholdMs() {
        return averageLatencyThresholdMs;
    }

    /**
     * The period between checks; also the window over which evictions are counted.
     */
    public Duration alertCheckInterval() {
        return alertCheckInterval;
    }

    @Override
    public String toString() {
        return "AlertConfig{"
                + "hitRateThreshold=" + hitRateThreshold
                + ", missRateThreshold=" + missRateThreshold
                + ", p95LatencyThresholdMs=" + p95LatencyThresholdMs
                + ", p99LatencyThresholdMs=" + p99LatencyThresholdMs
                + ", evictionsPerMinuteThreshold=" + evictionsPerMinuteThreshold
                + ", averageLatencyThresholdMs=" + averageLatencyThresholdMs
                + ", alertCheckInterval=" + alertCheckInterval
                + '}';
    }

    /**
     * Builder of {@link AlertConfig}.
     */
    public static final class Builder {
        private final Consumer<String> notifyCallback;
        private double hitRateThreshold = DEFAULT_HIT_RATE_THRESHOLD;
        private double missRateThreshold = DEFAULT_MISS_RATE_THRESHOLD;
        private long p95LatencyThresholdMs = DEFAULT_P95_LATENCY_THRESHOLD_MS;
        private long p99LatencyThresholdMs = DEFAULT_P99_LATENCY_THRESHOLD_MS;
        private long evictionsPerMinuteThreshold = DEFAULT_EVICTIONS_PER_MINUTE_THRESHOLD;
        private long averageLatencyThresholdMs = DEFAULT_AVERAGE_LATENCY_THRESHOLD_MS;
        private Duration alertCheckInterval = DEFAULT_ALERT_CHECK_INTERVAL;

        private Builder(Consumer<String> notifyCallback) {
            this.notifyCallback = Objects.requireNonNull(notifyCallback, "notifyCallback cannot be null");
        }

        /**
         * @throws IllegalArgumentException if {@code threshold} is outside [0, 1]
         */
        public Builder hitRateThreshold(double threshold) {
            this.hitRateThreshold = checkRate(threshold, "hit rate");
            return this;
        }

        /**
         * @throws IllegalArgumentException if {@code threshold} is outside [0, 1]
         */
        public Builder missRateThreshold(double threshold) {
            this.missRateThreshold = checkRate(threshold, "miss rate");
            return this;
        }

        public Builder p95LatencyThresholdMs(long thresholdMs) {
            this.p95LatencyThresholdMs = checkNotNegative(thresholdMs, "p95 latency");
            return this;
        }

        public Builder p99LatencyThresholdMs(long thresholdMs) {
            this.p99LatencyThresholdMs = checkNotNegative(thresholdMs, "p99 latency");
            return this;
        }

        public Builder evictionsPerMinuteThreshold(long threshold) {
            this.evictionsPerMinuteThreshold = checkNotNegative(threshold, "evictions per minute");
            return this;
        }

        public Builder averageLatencyThresholdMs(long thresholdMs) {
            this.averageLatencyThresholdMs = checkNotNegative(thresholdMs, "average latency");
            return this;
        }

        /**
         * @throws IllegalArgumentException if {@code interval} is shorter than one millisecond
         */
        public Builder alertCheckInterval(Duration interval) {
            Objects.requireNonNull(interval, "interval cannot be null");
            if (interval.toMillis() <= 0) {
                throw new IllegalArgumentException("alert check interval must be at least 1ms, was " + interval);
            }
            this.alertCheckInterval = interval;
            return this;
        }

        public AlertConfig build() {
            return new AlertConfig(this);
        }

        private static double checkRate(double rate, String name) {
            if (!(rate >= 0.0 && rate <= 1.0)) {
                throw new IllegalArgumentException(name + " threshold must be between 0 and 1, was " + rate);
            }
            return rate;
        }

        private static long checkNotNegative(long value, String name) {
            if (value < 0) {
                throw new IllegalArgumentException(name + " threshold must not be negative, was " + value);
            }
            return value;
        }
    }
}

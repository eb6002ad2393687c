package com.github.rudygunawan.tana.alert;

import com.github.rudygunawan.tana.metrics.CacheMetrics;
import com.github.rudygunawan.tana.model.RecentStats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically compares a {@link CacheMetrics} snapshot against the thresholds of an
 * {@link AlertConfig} and sends one message to the configured callback per threshold crossed.
 *
 * <p>Each manager owns one daemon thread, started by {@link #start()} and stopped by
 * {@link #close()}. A manager moves from {@link State#IDLE} to {@link State#MONITORING} to
 * {@link State#CLOSED} and never back.
 *
 * <p>Exceptions thrown by the callback are logged and swallowed: the remaining alerts of the same
 * check are still sent, and later checks still run.
 */
public class AlertManager implements AutoCloseable {
    /**
     * Logger for alerting. Logger name: "com.github.rudygunawan.tana.Alert"
     */
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.tana.Alert");

    /**
     * Lifecycle of a manager.
     */
    public enum State {
        IDLE,
        MONITORING,
        CLOSED
    }

    private final CacheMetrics metrics;
    private final AlertConfig config;
    private State state = State.IDLE;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> checkTask;

    public AlertManager(CacheMetrics metrics, AlertConfig config) {
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    /**
     * Starts checking every {@link AlertConfig#alertCheckInterval()}, the first check one interval
     * from now. Has no effect if already monitoring.
     *
     * @throws IllegalStateException if the manager has been closed
     */
    public synchronized void start() {
        if (state == State.CLOSED) {
            throw new IllegalStateException("alert manager is closed");
        }
        if (state == State.MONITORING) {
            return;
        }
        long periodMillis = config.alertCheckInterval().toMillis();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "tana-cache-alerts");
            t.setDaemon(true);
            return t;
        });
        checkTask = scheduler.scheduleAtFixedRate(this::runCheck, periodMillis, periodMillis,
                TimeUnit.MILLISECONDS);
        state = State.MONITORING;
    }

    /**
     * Runs one check immediately, independent of the timer.
     *
     * @return the messages sent to the callback, in check order; empty when all thresholds hold
     */
    public List<String> checkAlerts() {
        RecentStats stats = metrics.getRecentStats(config.alertCheckInterval());
        List<String> alerts = new ArrayList<>();

        if (stats.hitRate() < config.hitRateThreshold()) {
            alerts.add("Warning: Low hit rate detected. Actual: " + stats.hitRate()
                    + " (Threshold: " + config.hitRateThreshold() + ")");
        }
        if (stats.missRate() > config.missRateThreshold()) {
            alerts.add("Warning: High miss rate detected. Actual: " + stats.missRate()
                    + " (Threshold: " + config.missRateThreshold() + ")");
        }
        long p95Ms = stats.p95Latency().toMillis();
        if (p95Ms > config.p95LatencyThresholdMs()) {
            alerts.add("Warning: High p95 latency detected. Actual: " + p95Ms
                    + "ms (Threshold: " + config.p95LatencyThresholdMs() + "ms)");
        }
        long p99Ms = stats.p99Latency().toMillis();
        if (p99Ms > config.p99LatencyThresholdMs()) {
            alerts.add("Warning: High p99 latency detected. Actual: " + p99Ms
                    + "ms (Threshold: " + config.p99LatencyThresholdMs() + "ms)");
        }
        long averageMs = stats.averageLatency().toMillis();
        if (averageMs > config.averageLatencyThresholdMs()) {
            alerts.add("Warning: High average latency detected. Actual: " + averageMs
                    + "ms (Threshold: " + config.averageLatencyThresholdMs() + "ms)");
        }
        if (stats.evictionsPerMinute() > config.evictionsPerMinuteThreshold()) {
            alerts.add("Warning: High eviction rate detected. Actual: " + stats.evictionsPerMinute()
                    + " evictions/min (Threshold: " + config.evictionsPerMinuteThreshold()
                    + " evictions/min)");
        }

        for (String alert : alerts) {
            notifyCallback(alert);
        }
        return Collections.unmodifiableList(alerts);
    }

    public synchronized State state() {
        return state;
    }

    /**
     * Stops the timer and releases its thread. Idempotent. A check already running completes.
     */
    @Override
    public synchronized void close() {
        if (state == State.CLOSED) {
            return;
        }
        if (checkTask != null) {
            checkTask.cancel(false);
            scheduler.shutdown();
        }
        state = State.CLOSED;
    }

    private void runCheck() {
        // An exception escaping here would cancel all later runs of the task.
        try {
            checkAlerts();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Alert check failed", e);
        }
    }

    private void notifyCallback(String alert) {
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Cache alert raised: " + alert);
        }
        try {
            config.notifyCallback().accept(alert);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Alert callback threw exception for alert: " + alert, e);
        }
    }
}

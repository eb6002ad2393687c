package com.github.rudygunawan.tana.impl;

import com.github.rudygunawan.tana.alert.AlertConfig;
import com.github.rudygunawan.tana.alert.AlertManager;
import com.github.rudygunawan.tana.api.Cache;
import com.github.rudygunawan.tana.listener.RemovalListener;
import com.github.rudygunawan.tana.metrics.CacheMetrics;
import com.github.rudygunawan.tana.policy.EvictionPolicy;
import com.github.rudygunawan.tana.policy.RemovalCause;
import com.github.rudygunawan.tana.time.Ticker;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Thread-safe cache that records hit/miss outcomes, hit latencies and capacity evictions in a
 * {@link CacheMetrics}, and checks them against an {@link AlertConfig} on a timer.
 *
 * <p>Only {@link #get} is timed and classified. {@link #set}, {@link #clear} and {@link #keys} pass
 * straight through; capacity evictions caused by {@code set} are recorded as evictions. Entries
 * removed by {@code clear} or by ephemeral reads are not evictions.
 *
 * <p>Monitoring starts when the cache is constructed and runs until {@link #close()}. Closing stops
 * the alert timer only; the cache itself stays usable.
 *
 * <p>Usage example:
 * <pre>{@code
 * AlertConfig config = AlertConfig.builder(System.err::println)
 *     .hitRateThreshold(0.9)
 *     .build();
 *
 * try (MonitoredLruCache<String, User> users = new MonitoredLruCache<>(10_000, config)) {
 *     users.set("alice", alice);
 *     users.get("alice");
 *     double hitRate = users.metrics().hitRate();
 * }
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class MonitoredCache<K, V> implements Cache<K, V>, AutoCloseable {
    private final ConcurrentCache<K, V> cache;
    private final CacheMetrics metrics;
    private final AlertManager alertManager;
    private final Ticker ticker;

    /**
     * Creates a monitored cache and starts its alert timer.
     *
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public MonitoredCache(EvictionPolicy policy, int capacity, AlertConfig alertConfig) {
        this(policy, capacity, alertConfig, null, Ticker.systemTicker());
    }

    /**
     * Creates a monitored cache that also reports removals to {@code removalListener}, timing
     * lookups with {@code ticker}, and starts its alert timer.
     *
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public MonitoredCache(EvictionPolicy policy, int capacity, AlertConfig alertConfig,
                          RemovalListener<? super K, ? super V> removalListener, Ticker ticker) {
        Objects.requireNonNull(alertConfig, "alertConfig cannot be null");
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
        this.metrics = new CacheMetrics(ticker);
        this.cache = new ConcurrentCache<>(policy, capacity, recordingEvictions(removalListener));
        this.alertManager = new AlertManager(metrics, alertConfig);
        alertManager.start();
    }

    @Override
    public V get(K key) {
        long start = ticker.read();
        V value = cache.get(key);
        Duration elapsed = Duration.ofNanos(ticker.read() - start);
        if (value != null) {
            metrics.recordHit(elapsed);
        } else {
            metrics.recordMiss();
        }
        return value;
    }

    @Override
    public void set(K key, V value) {
        cache.set(key, value);
    }

    @Override
    public void clear() {
        cache.clear();
    }

    @Override
    public List<K> keys() {
        return cache.keys();
    }

    @Override
    public int size() {
        return cache.size();
    }

    @Override
    public int capacity() {
        return cache.capacity();
    }

    public EvictionPolicy policy() {
        return cache.policy();
    }

    /**
     * Returns the live metrics of this cache.
     */
    public CacheMetrics metrics() {
        return metrics;
    }

    /**
     * Returns the alert manager watching {@link #metrics()}.
     */
    public AlertManager alertManager() {
        return alertManager;
    }

    /**
     * Stops the alert timer.
     */
    @Override
    public void close() {
        alertManager.close();
    }

    @Override
    public String toString() {
        return cache.toString();
    }

    private RemovalListener<K, V> recordingEvictions(RemovalListener<? super K, ? super V> delegate) {
        return (K key, V value, RemovalCause cause) -> {
            if (cause.wasEvicted()) {
                metrics.recordEviction();
            }
            if (delegate != null) {
                delegate.onRemoval(key, value, cause);
            }
        };
    }
}

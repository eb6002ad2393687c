package com.github.rudygunawan.tana.builder;

import com.github.rudygunawan.tana.alert.AlertConfig;
import com.github.rudygunawan.tana.api.Cache;
import com.github.rudygunawan.tana.impl.ConcurrentCache;
import com.github.rudygunawan.tana.impl.MonitoredCache;
import com.github.rudygunawan.tana.listener.RemovalListener;
import com.github.rudygunawan.tana.policy.EvictionPolicy;
import com.github.rudygunawan.tana.time.Ticker;

/**
 * A builder of {@link Cache} instances with a fixed capacity and a chosen eviction policy,
 * optionally reporting removals and optionally monitored.
 *
 * <p>Usage example:
 * <pre>{@code
 * Cache<String, Session> sessions = CacheBuilder.newBuilder()
 *     .capacity(10_000)
 *     .evictionPolicy(EvictionPolicy.LFU)
 *     .removalListener((key, session, cause) -> session.close())
 *     .build();
 *
 * MonitoredCache<String, Token> tokens = CacheBuilder.newBuilder()
 *     .capacity(500)
 *     .evictionPolicy(EvictionPolicy.EPHEMERAL_FIFO)
 *     .buildMonitored(AlertConfig.defaults(System.err::println));
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class CacheBuilder<K, V> {
    private static final int UNSET_INT = -1;

    private int capacity = UNSET_INT;
    private EvictionPolicy evictionPolicy = EvictionPolicy.LRU;
    private RemovalListener<? super K, ? super V> removalListener;
    private Ticker ticker = Ticker.systemTicker();

    private CacheBuilder() {
    }

    /**
     * Constructs a new {@code CacheBuilder} instance with default settings.
     */
    public static CacheBuilder<Object, Object> newBuilder() {
        return new CacheBuilder<>();
    }

    /**
     * Specifies the maximum number of entries the cache may contain. Required.
     *
     * @param capacity the maximum number of entries
     * @return this builder instance
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public CacheBuilder<K, V> capacity(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, was " + capacity);
        }
        this.capacity = capacity;
        return this;
    }

    /**
     * Specifies the eviction policy. Defaults to {@link EvictionPolicy#LRU}.
     *
     * @param policy the eviction policy
     * @return this builder instance
     */
    public CacheBuilder<K, V> evictionPolicy(EvictionPolicy policy) {
        if (policy == null) {
            throw new NullPointerException("eviction policy cannot be null");
        }
        this.evictionPolicy = policy;
        return this;
    }

    /**
     * Specifies a listener notified of every entry leaving the cache.
     *
     * @param listener the removal listener
     * @return this builder instance, narrowed to the listener's types
     */
    public <K1 extends K, V1 extends V> CacheBuilder<K1, V1> removalListener(
            RemovalListener<? super K1, ? super V1> listener) {
        if (listener == null) {
            throw new NullPointerException("removal listener cannot be null");
        }
        @SuppressWarnings("unchecked")
        CacheBuilder<K1, V1> me = (CacheBuilder<K1, V1>) this;
        me.removalListener = listener;
        return me;
    }

    /**
     * Specifies the time source used to time lookups of monitored caches.
     *
     * @param ticker the time source
     * @return this builder instance
     */
    public CacheBuilder<K, V> ticker(Ticker ticker) {
        if (ticker == null) {
            throw new NullPointerException("ticker cannot be null");
        }
        this.ticker = ticker;
        return this;
    }

    /**
     * Builds a thread-safe cache.
     *
     * @throws IllegalStateException if no capacity was set
     */
    public <K1 extends K, V1 extends V> ConcurrentCache<K1, V1> build() {
        checkCapacitySet();
        return new ConcurrentCache<>(evictionPolicy, capacity, removalListener);
    }

    /**
     * Builds a cache without locking, for use confined to a single thread.
     *
     * @throws IllegalStateException if no capacity was set
     */
    public <K1 extends K, V1 extends V> Cache<K1, V1> buildSimple() {
        checkCapacitySet();
        return evictionPolicy.newCache(capacity, removalListener);
    }

    /**
     * Builds a thread-safe cache that records metrics and starts checking them against
     * {@code alertConfig}. Close the returned cache to stop the alert timer.
     *
     * @throws IllegalStateException if no capacity was set
     */
    public <K1 extends K, V1 extends V> MonitoredCache<K1, V1> buildMonitored(AlertConfig alertConfig) {
        checkCapacitySet();
        return new MonitoredCache<>(evictionPolicy, capacity, alertConfig, removalListener, ticker);
    }

    public int getCapacity() {
        return capacity;
    }

    public EvictionPolicy getEvictionPolicy() {
        return evictionPolicy;
    }

    private void checkCapacitySet() {
        if (capacity == UNSET_INT) {
            throw new IllegalStateException("capacity must be set before building a cache");
        }
    }
}

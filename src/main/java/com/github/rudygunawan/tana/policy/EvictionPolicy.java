package com.github.rudygunawan.tana.policy;

import com.github.rudygunawan.tana.api.Cache;
import com.github.rudygunawan.tana.impl.SimpleEphemeralFifoCache;
import com.github.rudygunawan.tana.impl.SimpleFifoCache;
import com.github.rudygunawan.tana.impl.SimpleLfuCache;
import com.github.rudygunawan.tana.impl.SimpleLruCache;
import com.github.rudygunawan.tana.impl.SimpleMruCache;
import com.github.rudygunawan.tana.listener.RemovalListener;

/**
 * Eviction policy for determining which entry to remove when a full cache receives a new key.
 *
 * <p>Available policies:
 * <ul>
 *   <li>{@link #FIFO} - First In First Out
 *   <li>{@link #EPHEMERAL_FIFO} - FIFO with one-time reads
 *   <li>{@link #LRU} - Least Recently Used
 *   <li>{@link #MRU} - Most Recently Used
 *   <li>{@link #LFU} - Least Frequently Used
 * </ul>
 *
 * <p>Each constant creates the single-threaded implementation of its policy; the concurrent and
 * monitored caches are written once on top of that.
 */
public enum EvictionPolicy {
    /**
     * First In First Out (FIFO) - evicts the oldest entry, regardless of access patterns.
     */
    FIFO {
        @Override
        public <K, V> Cache<K, V> newCache(int capacity, RemovalListener<? super K, ? super V> listener) {
            return new SimpleFifoCache<>(capacity, listener);
        }
    },

    /**
     * Ephemeral FIFO - FIFO eviction, and every entry is removed by the first read that finds it.
     * Suited to hand-off values such as one-time tokens.
     */
    EPHEMERAL_FIFO {
        @Override
        public <K, V> Cache<K, V> newCache(int capacity, RemovalListener<? super K, ? super V> listener) {
            return new SimpleEphemeralFifoCache<>(capacity, listener);
        }
    },

    /**
     * Least Recently Used (LRU) - evicts the entry that was read or written longest ago.
     * This is the default policy and works well for most use cases.
     */
    LRU {
        @Override
        public <K, V> Cache<K, V> newCache(int capacity, RemovalListener<? super K, ? super V> listener) {
            return new SimpleLruCache<>(capacity, listener);
        }
    },

    /**
     * Most Recently Used (MRU) - evicts the entry that was read or written last. Good for cyclic
     * scans where the item just used is the one least likely to be needed again soon.
     */
    MRU {
        @Override
        public <K, V> Cache<K, V> newCache(int capacity, RemovalListener<? super K, ? super V> listener) {
            return new SimpleMruCache<>(capacity, listener);
        }
    },

    /**
     * Least Frequently Used (LFU) - evicts the entry with the lowest read count, oldest first on
     * ties. Good for workloads where some keys are read much more often than others.
     */
    LFU {
        @Override
        public <K, V> Cache<K, V> newCache(int capacity, RemovalListener<? super K, ? super V> listener) {
            return new SimpleLfuCache<>(capacity, listener);
        }
    };

    /**
     * Creates a new single-threaded cache implementing this policy.
     *
     * @param capacity the maximum number of entries
     * @param listener notified of every removal, may be null
     * @param <K> the type of keys
     * @param <V> the type of values
     * @return a new, empty, non-thread-safe cache
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public abstract <K, V> Cache<K, V> newCache(int capacity, RemovalListener<? super K, ? super V> listener);
}

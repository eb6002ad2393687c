package com.github.rudygunawan.tana.impl;

import com.github.rudygunawan.tana.alert.AlertConfig;
import com.github.rudygunawan.tana.policy.EvictionPolicy;

/**
 * Monitored {@link LruCache}.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class MonitoredLruCache<K, V> extends MonitoredCache<K, V> {

    /**
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public MonitoredLruCache(int capacity, AlertConfig alertConfig) {
        super(EvictionPolicy.LRU, capacity, alertConfig);
    }
}

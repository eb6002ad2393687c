package com.github.rudygunawan.tana.impl;

import com.github.rudygunawan.tana.alert.AlertConfig;
import com.github.rudygunawan.tana.policy.EvictionPolicy;

/**
 * Monitored {@link LfuCache}.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class MonitoredLfuCache<K, V> extends MonitoredCache<K, V> {

    /**
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public MonitoredLfuCache(int capacity, AlertConfig alertConfig) {
        super(EvictionPolicy.LFU, capacity, alertConfig);
    }
}

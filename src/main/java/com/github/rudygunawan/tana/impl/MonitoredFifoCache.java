package com.github.rudygunawan.tana.impl;

import com.github.rudygunawan.tana.alert.AlertConfig;
import com.github.rudygunawan.tana.policy.EvictionPolicy;

/**
 * Monitored {@link FifoCache}.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class MonitoredFifoCache<K, V> extends MonitoredCache<K, V> {

    /**
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public MonitoredFifoCache(int capacity, AlertConfig alertConfig) {
        super(EvictionPolicy.FIFO, capacity, alertConfig);
    }
}

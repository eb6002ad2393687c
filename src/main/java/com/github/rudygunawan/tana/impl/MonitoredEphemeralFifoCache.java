package com.github.rudygunawan.tana.impl;

import com.github.rudygunawan.tana.alert.AlertConfig;
import com.github.rudygunawan.tana.policy.EvictionPolicy;

/**
 * Monitored {@link EphemeralFifoCache}. Every hit also consumes the entry, so a second lookup of the same key counts as a miss.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class MonitoredEphemeralFifoCache<K, V> extends MonitoredCache<K, V> {

    /**
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public MonitoredEphemeralFifoCache(int capacity, AlertConfig alertConfig) {
        super(EvictionPolicy.EPHEMERAL_FIFO, capacity, alertConfig);
    }
}

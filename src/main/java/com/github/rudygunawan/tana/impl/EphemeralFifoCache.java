package com.github.rudygunawan.tana.impl;

import com.github.rudygunawan.tana.listener.RemovalListener;
import com.github.rudygunawan.tana.policy.EvictionPolicy;

/**
 * Thread-safe FIFO cache whose entries are removed by the first read that finds them.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 * @see SimpleEphemeralFifoCache
 */
public class EphemeralFifoCache<K, V> extends ConcurrentCache<K, V> {

    public EphemeralFifoCache(int capacity) {
        super(EvictionPolicy.EPHEMERAL_FIFO, capacity);
    }

    public EphemeralFifoCache(int capacity, RemovalListener<? super K, ? super V> removalListener) {
        super(EvictionPolicy.EPHEMERAL_FIFO, capacity, removalListener);
    }
}

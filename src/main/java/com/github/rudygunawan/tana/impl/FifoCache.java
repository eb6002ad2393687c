package com.github.rudygunawan.tana.impl;

import com.github.rudygunawan.tana.listener.RemovalListener;
import com.github.rudygunawan.tana.policy.EvictionPolicy;

/**
 * Thread-safe First In First Out cache.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 * @see SimpleFifoCache
 */
public class FifoCache<K, V> extends ConcurrentCache<K, V> {

    public FifoCache(int capacity) {
        super(EvictionPolicy.FIFO, capacity);
    }

    public FifoCache(int capacity, RemovalListener<? super K, ? super V> removalListener) {
        super(EvictionPolicy.FIFO, capacity, removalListener);
    }
}

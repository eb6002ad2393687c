package com.github.rudygunawan.tana.impl;

import com.github.rudygunawan.tana.listener.RemovalListener;
import com.github.rudygunawan.tana.policy.EvictionPolicy;

/**
 * Thread-safe Least Frequently Used cache.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 * @see SimpleLfuCache
 */
public class LfuCache<K, V> extends ConcurrentCache<K, V> {

    public LfuCache(int capacity) {
        super(EvictionPolicy.LFU, capacity);
    }

    public LfuCache(int capacity, RemovalListener<? super K, ? super V> removalListener) {
        super(EvictionPolicy.LFU, capacity, removalListener);
    }
}

package com.github.rudygunawan.tana.impl;

import com.github.rudygunawan.tana.listener.RemovalListener;
import com.github.rudygunawan.tana.policy.EvictionPolicy;

/**
 * Thread-safe Most Recently Used cache.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 * @see SimpleMruCache
 */
public class MruCache<K, V> extends ConcurrentCache<K, V> {

    public MruCache(int capacity) {
        super(EvictionPolicy.MRU, capacity);
    }

    public MruCache(int capacity, RemovalListener<? super K, ? super V> removalListener) {
        super(EvictionPolicy.MRU, capacity, removalListener);
    }
}

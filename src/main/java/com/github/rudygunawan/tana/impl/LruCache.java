package com.github.rudygunawan.tana.impl;

import com.github.rudygunawan.tana.listener.RemovalListener;
import com.github.rudygunawan.tana.policy.EvictionPolicy;

/**
 * Thread-safe Least Recently Used cache.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 * @see SimpleLruCache
 */
public class LruCache<K, V> extends ConcurrentCache<K, V> {

    public LruCache(int capacity) {
        super(EvictionPolicy.LRU, capacity);
    }

    public LruCache(int capacity, RemovalListener<? super K, ? super V> removalListener) {
        super(EvictionPolicy.LRU, capacity, removalListener);
    }
}

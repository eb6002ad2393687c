package com.github.rudygunawan.tana.impl;

import com.github.rudygunawan.tana.listener.RemovalListener;

import java.util.LinkedHashMap;

/**
 * Single-threaded First In First Out cache. Lookups never change the order; when full, the entry
 * inserted longest ago is evicted. Replacing the value of an existing key keeps its position.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class SimpleFifoCache<K, V> extends AbstractSimpleCache<K, V> {

    public SimpleFifoCache(int capacity) {
        this(capacity, null);
    }

    public SimpleFifoCache(int capacity, RemovalListener<? super K, ? super V> removalListener) {
        super(capacity, new LinkedHashMap<>(), removalListener);
    }

    @Override
    public V get(K key) {
        return store.get(checkNotNull(key, "key"));
    }

    @Override
    public void set(K key, V value) {
        checkNotNull(key, "key");
        checkNotNull(value, "value");
        if (!store.containsKey(key) && isFull()) {
            evictFirst();
        }
        store.put(key, value);
    }
}

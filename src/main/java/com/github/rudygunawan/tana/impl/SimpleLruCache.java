package com.github.rudygunawan.tana.impl;

import com.github.rudygunawan.tana.listener.RemovalListener;

import java.util.LinkedHashMap;

/**
 * Single-threaded Least Recently Used cache. Both reads and writes move a key to the most recent
 * end; when full, the entry at the least recent end is evicted.
 *
 * <p>The store is an access-ordered {@link LinkedHashMap}, so {@link #keys()} lists keys from least
 * to most recently used.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class SimpleLruCache<K, V> extends AbstractSimpleCache<K, V> {

    public SimpleLruCache(int capacity) {
        this(capacity, null);
    }

    public SimpleLruCache(int capacity, RemovalListener<? super K, ? super V> removalListener) {
        super(capacity, new LinkedHashMap<>(16, 0.75f, true), removalListener);
    }

    @Override
    public V get(K key) {
        // access order: get() moves the entry to the tail
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

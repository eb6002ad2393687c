package com.github.rudygunawan.tana.impl;

import com.github.rudygunawan.tana.listener.RemovalListener;
import com.github.rudygunawan.tana.policy.RemovalCause;

import java.util.LinkedHashMap;

/**
 * Single-threaded FIFO cache whose entries can be read once. A successful {@link #get} returns the
 * value and removes the entry; a second read of the same key misses until it is set again.
 * Eviction and replacement follow {@link SimpleFifoCache}.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class SimpleEphemeralFifoCache<K, V> extends AbstractSimpleCache<K, V> {

    public SimpleEphemeralFifoCache(int capacity) {
        this(capacity, null);
    }

    public SimpleEphemeralFifoCache(int capacity, RemovalListener<? super K, ? super V> removalListener) {
        super(capacity, new LinkedHashMap<>(), removalListener);
    }

    @Override
    public V get(K key) {
        V value = store.remove(checkNotNull(key, "key"));
        if (value != null) {
            notifyRemoval(key, value, RemovalCause.CONSUMED);
        }
        return value;
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

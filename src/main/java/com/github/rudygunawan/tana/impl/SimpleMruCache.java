package com.github.rudygunawan.tana.impl;

import com.github.rudygunawan.tana.listener.RemovalListener;

import java.util.LinkedHashMap;

/**
 * Single-threaded Most Recently Used cache. Reads and writes move a key to the most recent end;
 * when full, the entry currently at the most recent end is evicted.
 *
 * <p>The eviction happens before the new key is inserted, so the key being set is never the one
 * evicted: the previous most recently used entry makes room for it, and the cache always keeps the
 * newest write.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class SimpleMruCache<K, V> extends AbstractSimpleCache<K, V> {
    // Tail of the access-ordered store, tracked so eviction does not walk the list.
    private K mostRecent;

    public SimpleMruCache(int capacity) {
        this(capacity, null);
    }

    public SimpleMruCache(int capacity, RemovalListener<? super K, ? super V> removalListener) {
        super(capacity, new LinkedHashMap<>(16, 0.75f, true), removalListener);
    }

    @Override
    public V get(K key) {
        V value = store.get(checkNotNull(key, "key"));
        if (value != null) {
            mostRecent = key;
        }
        return value;
    }

    @Override
    public void set(K key, V value) {
        checkNotNull(key, "key");
        checkNotNull(value, "value");
        if (!store.containsKey(key) && isFull()) {
            V victim = store.remove(mostRecent);
            evicted(mostRecent, victim);
        }
        store.put(key, value);
        mostRecent = key;
    }

    @Override
    public void clear() {
        mostRecent = null;
        super.clear();
    }
}

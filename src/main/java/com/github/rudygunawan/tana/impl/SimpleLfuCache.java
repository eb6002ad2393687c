package com.github.rudygunawan.tana.impl;

import com.github.rudygunawan.tana.listener.RemovalListener;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single-threaded Least Frequently Used cache. Every key carries a use count: 1 when first set,
 * incremented by each successful {@link #get}. Replacing the value of an existing key does not
 * reset its count. When full, the key with the lowest count is evicted; among keys sharing the
 * lowest count, the one inserted first goes. Counts saturate at {@link Integer#MAX_VALUE}.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class SimpleLfuCache<K, V> extends AbstractSimpleCache<K, V> {
    private final Map<K, Integer> frequencies = new HashMap<>();

    public SimpleLfuCache(int capacity) {
        this(capacity, null);
    }

    public SimpleLfuCache(int capacity, RemovalListener<? super K, ? super V> removalListener) {
        super(capacity, new LinkedHashMap<>(), removalListener);
    }

    @Override
    public V get(K key) {
        V value = store.get(checkNotNull(key, "key"));
        if (value != null) {
            frequencies.merge(key, 1, (count, one) -> count == Integer.MAX_VALUE ? count : count + one);
        }
        return value;
    }

    @Override
    public void set(K key, V value) {
        checkNotNull(key, "key");
        checkNotNull(value, "value");
        if (store.containsKey(key)) {
            store.put(key, value);
            return;
        }
        if (isFull()) {
            evictLeastFrequent();
        }
        store.put(key, value);
        frequencies.put(key, 1);
    }

    /**
     * Returns the use count of {@code key}, or 0 if it is not cached.
     */
    public int frequencyOf(K key) {
        return frequencies.getOrDefault(key, 0);
    }

    // Lets tests start a key near the saturation point without billions of reads.
    void seedFrequency(K key, int count) {
        if (!store.containsKey(key)) {
            throw new IllegalArgumentException("key is not cached: " + key);
        }
        frequencies.put(key, count);
    }

    @Override
    public void clear() {
        frequencies.clear();
        super.clear();
    }

    private void evictLeastFrequent() {
        // Store iterates in insertion order, so strict < keeps the oldest key among ties.
        K victim = null;
        int min = Integer.MAX_VALUE;
        for (K candidate : store.keySet()) {
            int count = frequencies.get(candidate);
            if (count < min) {
                min = count;
                victim = candidate;
            }
        }
        if (victim != null) {
            frequencies.remove(victim);
            evicted(victim, store.remove(victim));
        }
    }
}

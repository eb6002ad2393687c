package com.github.rudygunawan.tana.api;

import java.util.List;

/**
 * A bounded mapping from keys to values. Entries are added with {@link #set(Object, Object)} and
 * stay in the cache until evicted by the cache's eviction policy or removed by {@link #clear()}.
 *
 * <p>A cache holds at most {@link #capacity()} entries. When a new key is set on a full cache,
 * exactly one entry is evicted first; which one depends on the
 * {@link com.github.rudygunawan.tana.policy.EvictionPolicy}.
 *
 * <p>Whether an implementation is safe for concurrent use is documented by the implementation.
 * The {@code Simple*Cache} classes are not; every other implementation is.
 *
 * @param <K> the type of keys maintained by this cache
 * @param <V> the type of mapped values
 */
public interface Cache<K, V> {

    /**
     * Returns the value associated with {@code key} in this cache, or {@code null} if there is no
     * cached value for {@code key}. Depending on the eviction policy the lookup may reorder the
     * entry, count it as a use, or (for ephemeral caches) remove it.
     *
     * @param key the key whose associated value is to be returned
     * @return the value to which the specified key is mapped, or {@code null} if this cache
     *         contains no mapping for the key
     * @throws NullPointerException if {@code key} is null
     */
    V get(K key);

    /**
     * Associates {@code value} with {@code key} in this cache. If the cache previously contained a
     * value associated with {@code key}, the old value is replaced. If the key is new and the cache
     * is full, one entry is evicted before the new entry is inserted.
     *
     * @param key the key with which the specified value is to be associated
     * @param value the value to be associated with the specified key
     * @throws NullPointerException if {@code key} or {@code value} is null
     */
    void set(K key, V value);

    /**
     * Discards all entries in the cache.
     */
    void clear();

    /**
     * Returns a snapshot of the keys currently in the cache, in the order the eviction policy keeps
     * them. The returned list is immutable and does not change with the cache.
     *
     * @return the keys of this cache
     */
    List<K> keys();

    /**
     * Returns the number of entries in this cache.
     *
     * @return the number of key-value mappings in this cache
     */
    int size();

    /**
     * Returns the maximum number of entries this cache holds.
     *
     * @return the capacity, always positive
     */
    int capacity();
}

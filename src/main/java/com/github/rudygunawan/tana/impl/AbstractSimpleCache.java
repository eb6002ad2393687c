package com.github.rudygunawan.tana.impl;

import com.github.rudygunawan.tana.api.Cache;
import com.github.rudygunawan.tana.listener.RemovalListener;
import com.github.rudygunawan.tana.policy.RemovalCause;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base class of the single-threaded eviction policies. Owns the capacity, the ordered entry store
 * and the removal listener; subclasses decide how {@code get} and {@code set} reorder the store and
 * which entry is evicted.
 *
 * <p>Instances are not thread-safe. Wrap them in {@link ConcurrentCache} for shared use.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public abstract class AbstractSimpleCache<K, V> implements Cache<K, V> {
    /**
     * Logger for cache operations. Logger name: "com.github.rudygunawan.tana.Cache"
     *
     * <p>Log levels used:
     * <ul>
     *   <li>WARNING: Errors in removal listeners (operations continue)</li>
     *   <li>FINE: Evictions</li>
     * </ul>
     */
    static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.tana.Cache");

    protected final LinkedHashMap<K, V> store;
    private final int capacity;
    private final RemovalListener<? super K, ? super V> removalListener;

    /**
     * @param capacity the maximum number of entries
     * @param store the empty entry store; its iteration order is the policy's order
     * @param removalListener notified of every removal, may be null
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    protected AbstractSimpleCache(int capacity, LinkedHashMap<K, V> store,
                                  RemovalListener<? super K, ? super V> removalListener) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, was " + capacity);
        }
        this.capacity = capacity;
        this.store = store;
        this.removalListener = removalListener;
    }

    @Override
    public void clear() {
        if (removalListener == null) {
            store.clear();
            return;
        }
        List<Map.Entry<K, V>> removed = new ArrayList<>(store.entrySet());
        store.clear();
        for (Map.Entry<K, V> entry : removed) {
            notifyRemoval(entry.getKey(), entry.getValue(), RemovalCause.EXPLICIT);
        }
    }

    @Override
    public List<K> keys() {
        return Collections.unmodifiableList(new ArrayList<>(store.keySet()));
    }

    @Override
    public int size() {
        return store.size();
    }

    @Override
    public int capacity() {
        return capacity;
    }

    /**
     * Returns {@code true} when inserting a key that is not yet present requires an eviction.
     */
    protected final boolean isFull() {
        return store.size() >= capacity;
    }

    /**
     * Removes the first entry in store order and reports it as a capacity eviction.
     */
    protected final void evictFirst() {
        Iterator<Map.Entry<K, V>> it = store.entrySet().iterator();
        if (it.hasNext()) {
            Map.Entry<K, V> eldest = it.next();
            it.remove();
            evicted(eldest.getKey(), eldest.getValue());
        }
    }

    /**
     * Reports an entry the subclass has already removed from the store to satisfy capacity.
     */
    protected final void evicted(K key, V value) {
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Evicted entry due to size limit: key=" + key + ", policy="
                    + getClass().getSimpleName());
        }
        notifyRemoval(key, value, RemovalCause.SIZE);
    }

    protected final void notifyRemoval(K key, V value, RemovalCause cause) {
        if (removalListener != null) {
            try {
                removalListener.onRemoval(key, value, cause);
            } catch (Exception e) {
                LOGGER.log(Level.WARNING, "RemovalListener threw exception for key: " + key
                        + ", cause: " + cause, e);
            }
        }
    }

    static <T> T checkNotNull(T reference, String name) {
        return Objects.requireNonNull(reference, () -> name + " cannot be null");
    }

    @Override
    public String toString() {
        return store.toString();
    }
}

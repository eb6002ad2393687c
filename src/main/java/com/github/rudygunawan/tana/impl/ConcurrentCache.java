package com.github.rudygunawan.tana.impl;

import com.github.rudygunawan.tana.api.Cache;
import com.github.rudygunawan.tana.listener.RemovalListener;
import com.github.rudygunawan.tana.policy.EvictionPolicy;
import com.github.rudygunawan.tana.policy.RemovalCause;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.logging.Level;

/**
 * Thread-safe cache that serializes every operation on a single-threaded policy implementation
 * behind one lock per instance.
 *
 * <p>Locking is coarse-grained: operations on different keys of the same cache still run one at a
 * time, in lock acquisition order. Separate instances never contend. The lock is not fair.
 *
 * <p>Removal notifications raised while the lock is held are buffered and handed to the
 * {@link RemovalListener} after the lock is released, on the calling thread. A listener may
 * therefore call back into this cache.
 *
 * <p>Logging: see {@link AbstractSimpleCache#LOGGER} for the logger name.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class ConcurrentCache<K, V> implements Cache<K, V> {
    private final ReentrantLock lock = new ReentrantLock();
    // Guarded by lock
    private final List<Removal<K, V>> pending = new ArrayList<>();
    private final EvictionPolicy policy;
    private final RemovalListener<? super K, ? super V> removalListener;
    private final Cache<K, V> delegate;

    /**
     * Creates a cache with the given policy and capacity.
     *
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public ConcurrentCache(EvictionPolicy policy, int capacity) {
        this(policy, capacity, null);
    }

    /**
     * Creates a cache with the given policy and capacity that reports removals to
     * {@code removalListener}.
     *
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public ConcurrentCache(EvictionPolicy policy, int capacity,
                           RemovalListener<? super K, ? super V> removalListener) {
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        this.removalListener = removalListener;
        RemovalListener<K, V> buffering = removalListener == null ? null : this::enqueue;
        this.delegate = policy.newCache(capacity, buffering);
    }

    @Override
    public V get(K key) {
        return withLock(() -> delegate.get(key));
    }

    @Override
    public void set(K key, V value) {
        withLock(() -> {
            delegate.set(key, value);
            return null;
        });
    }

    @Override
    public void clear() {
        withLock(() -> {
            delegate.clear();
            return null;
        });
    }

    @Override
    public List<K> keys() {
        return withLock(delegate::keys);
    }

    @Override
    public int size() {
        return withLock(delegate::size);
    }

    @Override
    public int capacity() {
        return delegate.capacity();
    }

    /**
     * Returns the eviction policy of this cache.
     */
    public EvictionPolicy policy() {
        return policy;
    }

    @Override
    public String toString() {
        return withLock(delegate::toString);
    }

    private <T> T withLock(Supplier<T> operation) {
        List<Removal<K, V>> removed;
        T result;
        lock.lock();
        try {
            result = operation.get();
        } finally {
            removed = drainPending();
            lock.unlock();
        }
        dispatch(removed);
        return result;
    }

    private void enqueue(K key, V value, RemovalCause cause) {
        pending.add(new Removal<>(key, value, cause));
    }

    private List<Removal<K, V>> drainPending() {
        if (pending.isEmpty()) {
            return Collections.emptyList();
        }
        List<Removal<K, V>> drained = new ArrayList<>(pending);
        pending.clear();
        return drained;
    }

    private void dispatch(List<Removal<K, V>> removed) {
        for (Removal<K, V> removal : removed) {
            try {
                removalListener.onRemoval(removal.key, removal.value, removal.cause);
            } catch (Exception e) {
                AbstractSimpleCache.LOGGER.log(Level.WARNING, "RemovalListener threw exception for key: "
                        + removal.key + ", cause: " + removal.cause, e);
            }
        }
    }

    private static final class Removal<K, V> {
        final K key;
        final V value;
        final RemovalCause cause;

        Removal(K key, V value, RemovalCause cause) {
            this.key = key;
            this.value = value;
            this.cause = cause;
        }
    }
}

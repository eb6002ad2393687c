package com.github.rudygunawan.tana.listener;

import com.github.rudygunawan.tana.policy.RemovalCause;

/**
 * A listener notified whenever an entry leaves a cache.
 *
 * <p>Concurrent caches call the listener after releasing their lock, on the thread that performed
 * the operation. The listener may therefore call back into the cache. Single-threaded caches call
 * it inline.
 *
 * <p>Any exception thrown by the listener is logged and swallowed; the cache operation that
 * produced the notification completes regardless.
 *
 * <p><b>Example - counting capacity evictions:</b>
 * <pre>{@code
 * AtomicLong evictions = new AtomicLong();
 *
 * Cache<String, User> cache = CacheBuilder.newBuilder()
 *     .capacity(1000)
 *     .evictionPolicy(EvictionPolicy.LFU)
 *     .removalListener((key, user, cause) -> {
 *         if (cause.wasEvicted()) {
 *             evictions.incrementAndGet();
 *         }
 *     })
 *     .build();
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
@FunctionalInterface
public interface RemovalListener<K, V> {

    /**
     * Notifies the listener that an entry has been removed.
     *
     * @param key the key of the removed entry (never null)
     * @param value the value of the removed entry (never null)
     * @param cause why the entry was removed (never null)
     */
    void onRemoval(K key, V value, RemovalCause cause);
}

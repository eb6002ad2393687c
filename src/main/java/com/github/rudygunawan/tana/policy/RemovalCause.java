package com.github.rudygunawan.tana.policy;

/**
 * The reason why a cached entry was removed.
 */
public enum RemovalCause {
    /**
     * The entry was removed by {@link com.github.rudygunawan.tana.api.Cache#clear()}.
     */
    EXPLICIT,

    /**
     * The entry was read once from an ephemeral cache and removed by that read.
     */
    CONSUMED,

    /**
     * The entry was removed to make room for a new key because the cache was at capacity.
     */
    SIZE;

    /**
     * Returns {@code true} if the removal was an eviction, i.e. forced by the capacity bound
     * rather than by a caller's clear or read.
     */
    public boolean wasEvicted() {
        return this == SIZE;
    }
}

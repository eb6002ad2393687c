package com.github.rudygunawan.tana.impl;

import com.github.rudygunawan.tana.api.Cache;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class LfuCacheTest {

    @Test
    void testEvictsLeastFrequentlyRead() {
        Cache<String, Integer> cache = new LfuCache<>(2);
        cache.set("A", 1);
        cache.set("B", 1);
        cache.get("A");

        cache.set("C", 1);

        assertNull(cache.get("B"));
        assertEquals(1, cache.get("A"));
        assertEquals(1, cache.get("C"));
    }

    @Test
    void testTiesEvictOldestInsertion() {
        Cache<String, Integer> cache = new LfuCache<>(3);
        cache.set("A", 1);
        cache.set("B", 2);
        cache.set("C", 3);

        cache.set("D", 4);
        assertEquals(Arrays.asList("B", "C", "D"), cache.keys());

        // B and D tie at the lowest count once C has been read
        cache.get("C");
        cache.set("E", 5);
        assertEquals(Arrays.asList("C", "D", "E"), cache.keys());
    }

    @Test
    void testFrequencyCounting() {
        SimpleLfuCache<String, Integer> cache = new SimpleLfuCache<>(3);
        cache.set("A", 1);
        assertEquals(1, cache.frequencyOf("A"));

        cache.get("A");
        cache.get("A");
        assertEquals(3, cache.frequencyOf("A"));

        // Misses do not create counts
        cache.get("B");
        assertEquals(0, cache.frequencyOf("B"));
    }

    @Test
    void testUpdateDoesNotResetFrequency() {
        SimpleLfuCache<String, Integer> cache = new SimpleLfuCache<>(2);
        cache.set("A", 1);
        cache.get("A");
        cache.get("A");
        cache.set("B", 2);

        cache.set("A", 10);
        assertEquals(3, cache.frequencyOf("A"));

        cache.set("C", 3);
        assertNull(cache.get("B"));
        assertEquals(10, cache.get("A"));
    }

    @Test
    void testFrequencyDroppedWithKey() {
        SimpleLfuCache<String, Integer> cache = new SimpleLfuCache<>(1);
        cache.set("A", 1);
        cache.get("A");
        cache.set("B", 2);

        assertEquals(0, cache.frequencyOf("A"));

        // Re-inserted keys start over at 1
        cache.set("A", 3);
        assertEquals(1, cache.frequencyOf("A"));
        assertEquals(0, cache.frequencyOf("B"));

        cache.clear();
        assertEquals(0, cache.frequencyOf("A"));
    }

    @Test
    void testFrequencySaturatesInsteadOfWrapping() {
        SimpleLfuCache<String, Integer> cache = new SimpleLfuCache<>(2);
        cache.set("A", 1);
        cache.seedFrequency("A", Integer.MAX_VALUE - 1);

        cache.get("A");
        cache.get("A");
        cache.get("A");
        assertEquals(Integer.MAX_VALUE, cache.frequencyOf("A"));

        // The most read key must outlive keys read once
        cache.set("B", 2);
        cache.set("C", 3);
        assertEquals(Arrays.asList("A", "C"), cache.keys());
        assertEquals(1, cache.get("A"));
        assertEquals(Integer.MAX_VALUE, cache.frequencyOf("A"));
    }
}

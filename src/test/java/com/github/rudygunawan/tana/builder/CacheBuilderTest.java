package com.github.rudygunawan.tana.builder;

import com.github.rudygunawan.tana.alert.AlertConfig;
import com.github.rudygunawan.tana.api.Cache;
import com.github.rudygunawan.tana.impl.ConcurrentCache;
import com.github.rudygunawan.tana.impl.MonitoredCache;
import com.github.rudygunawan.tana.impl.SimpleLfuCache;
import com.github.rudygunawan.tana.impl.SimpleLruCache;
import com.github.rudygunawan.tana.policy.EvictionPolicy;
import com.github.rudygunawan.tana.policy.RemovalCause;
import com.github.rudygunawan.tana.time.FakeTicker;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CacheBuilderTest {

    @Test
    void testDefaultsToLru() {
        ConcurrentCache<String, Integer> cache = CacheBuilder.newBuilder()
                .capacity(2)
                .build();

        assertEquals(EvictionPolicy.LRU, cache.policy());
        assertEquals(2, cache.capacity());

        cache.set("a", 1);
        cache.set("b", 2);
        cache.get("a");
        cache.set("c", 3);
        assertNull(cache.get("b"));
    }

    @Test
    void testBuildSimple() {
        Cache<String, Integer> lru = CacheBuilder.newBuilder().capacity(3).buildSimple();
        assertTrue(lru instanceof SimpleLruCache);

        Cache<String, Integer> lfu = CacheBuilder.newBuilder()
                .capacity(3)
                .evictionPolicy(EvictionPolicy.LFU)
                .buildSimple();
        assertTrue(lfu instanceof SimpleLfuCache);
    }

    @Test
    void testRemovalListenerIsWired() {
        List<String> removed = new ArrayList<>();
        Cache<String, Integer> cache = CacheBuilder.newBuilder()
                .capacity(1)
                .evictionPolicy(EvictionPolicy.FIFO)
                .removalListener((String key, Integer value, RemovalCause cause) ->
                        removed.add(key + ":" + cause))
                .build();

        cache.set("a", 1);
        cache.set("b", 2);

        assertEquals(List.of("a:SIZE"), removed);
    }

    @Test
    void testBuildMonitoredUsesTicker() {
        AlertConfig config = AlertConfig.builder(message -> { })
                .alertCheckInterval(Duration.ofHours(1))
                .build();

        try (MonitoredCache<String, Integer> cache = CacheBuilder.newBuilder()
                .capacity(4)
                .evictionPolicy(EvictionPolicy.MRU)
                .ticker(new FakeTicker(3, TimeUnit.MILLISECONDS))
                .buildMonitored(config)) {
            cache.set("a", 1);
            cache.get("a");

            assertEquals(EvictionPolicy.MRU, cache.policy());
            assertEquals(Duration.ofMillis(3), cache.metrics().averageLatency());
        }
    }

    @Test
    void testInvalidConfiguration() {
        assertThrows(IllegalStateException.class, () -> CacheBuilder.newBuilder().build());
        assertThrows(IllegalStateException.class, () -> CacheBuilder.newBuilder().buildSimple());
        assertThrows(IllegalArgumentException.class, () -> CacheBuilder.newBuilder().capacity(0));
        assertThrows(NullPointerException.class, () -> CacheBuilder.newBuilder().evictionPolicy(null));
        assertThrows(NullPointerException.class, () -> CacheBuilder.newBuilder().removalListener(null));
        assertThrows(NullPointerException.class, () -> CacheBuilder.newBuilder().ticker(null));
        assertEquals(-1, CacheBuilder.newBuilder().getCapacity());
    }

    @Test
    void testBuilderReportsConfiguration() {
        CacheBuilder<Object, Object> builder = CacheBuilder.newBuilder();
        assertEquals(EvictionPolicy.LRU, builder.getEvictionPolicy());

        builder.capacity(42).evictionPolicy(EvictionPolicy.MRU);
        assertEquals(42, builder.getCapacity());
        assertEquals(EvictionPolicy.MRU, builder.getEvictionPolicy());
    }
}

package com.github.rudygunawan.tana.metrics;

import com.github.rudygunawan.tana.impl.MonitoredCache;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.TimeGauge;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Collections;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer integration for monitored caches.
 * Binds a {@link MonitoredCache}'s size and {@link CacheMetrics} to a MeterRegistry.
 *
 * <p>Exposes the following metrics:
 * <ul>
 *   <li>cache.size - Current number of entries
 *   <li>cache.capacity - Maximum number of entries
 *   <li>cache.hits - Total number of cache hits
 *   <li>cache.misses - Total number of cache misses
 *   <li>cache.evictions - Total number of capacity evictions
 *   <li>cache.hit.ratio - Cache hit rate (0.0 to 1.0)
 *   <li>cache.latency.average - Mean hit latency
 *   <li>cache.latency.p95 - 95th percentile hit latency
 *   <li>cache.latency.p99 - 99th percentile hit latency
 * </ul>
 *
 * <p>Every meter is tagged with {@code cache} (the given name) and {@code policy}. Counters read
 * the live metrics, so a {@link CacheMetrics#reset()} shows up as a counter going back to zero.
 *
 * <p>Usage example:
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * MonitoredLruCache<String, User> cache = new MonitoredLruCache<>(1000, alertConfig);
 *
 * MicrometerCacheMetrics.monitor(registry, cache, "userCache");
 * }</pre>
 */
public class MicrometerCacheMetrics implements MeterBinder {

    private final MonitoredCache<?, ?> cache;
    private final String cacheName;
    private final Iterable<Tag> tags;

    /**
     * Creates a new MicrometerCacheMetrics instance.
     *
     * @param cache the cache to monitor
     * @param cacheName the name of the cache for metric tags
     * @param tags additional tags to apply to all metrics
     */
    public MicrometerCacheMetrics(MonitoredCache<?, ?> cache, String cacheName, Iterable<Tag> tags) {
        this.cache = cache;
        this.cacheName = cacheName;
        this.tags = tags;
    }

    /**
     * Convenience method to monitor a cache with Micrometer.
     *
     * @param registry the meter registry
     * @param cache the cache to monitor
     * @param cacheName the name of the cache
     * @param <C> the cache type
     * @return the cache (for chaining)
     */
    public static <C extends MonitoredCache<?, ?>> C monitor(MeterRegistry registry, C cache, String cacheName) {
        return monitor(registry, cache, cacheName, Collections.emptyList());
    }

    /**
     * Convenience method to monitor a cache with Micrometer with additional tags.
     *
     * @param registry the meter registry
     * @param cache the cache to monitor
     * @param cacheName the name of the cache
     * @param tags additional tags
     * @param <C> the cache type
     * @return the cache (for chaining)
     */
    public static <C extends MonitoredCache<?, ?>> C monitor(
            MeterRegistry registry, C cache, String cacheName, Iterable<Tag> tags) {
        new MicrometerCacheMetrics(cache, cacheName, tags).bindTo(registry);
        return cache;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Tags allTags = Tags.of("cache", cacheName, "policy", cache.policy().name()).and(tags);
        CacheMetrics metrics = cache.metrics();

        Gauge.builder("cache.size", cache, MonitoredCache::size)
                .tags(allTags)
                .description("Current number of entries in the cache")
                .register(registry);

        Gauge.builder("cache.capacity", cache, MonitoredCache::capacity)
                .tags(allTags)
                .description("Maximum number of entries in the cache")
                .register(registry);

        FunctionCounter.builder("cache.hits", metrics, CacheMetrics::hitCount)
                .tags(allTags)
                .description("Total number of cache hits")
                .register(registry);

        FunctionCounter.builder("cache.misses", metrics, CacheMetrics::missCount)
                .tags(allTags)
                .description("Total number of cache misses")
                .register(registry);

        FunctionCounter.builder("cache.evictions", metrics, CacheMetrics::evictionCount)
                .tags(allTags)
                .description("Total number of capacity evictions")
                .register(registry);

        Gauge.builder("cache.hit.ratio", metrics, CacheMetrics::hitRate)
                .tags(allTags)
                .description("Cache hit ratio (0.0 to 1.0)")
                .register(registry);

        TimeGauge.builder("cache.latency.average", metrics, TimeUnit.NANOSECONDS,
                        m -> m.averageLatency().toNanos())
                .tags(allTags)
                .description("Mean latency of cache hits")
                .register(registry);

        TimeGauge.builder("cache.latency.p95", metrics, TimeUnit.NANOSECONDS,
                        m -> m.getLatencyPercentile(95).toNanos())
                .tags(allTags)
                .description("95th percentile latency of cache hits")
                .register(registry);

        TimeGauge.builder("cache.latency.p99", metrics, TimeUnit.NANOSECONDS,
                        m -> m.getLatencyPercentile(99).toNanos())
                .tags(allTags)
                .description("99th percentile latency of cache hits")
                .register(registry);
    }
}

package com.github.rudygunawan.memo.metrics;

import com.github.rudygunawan.memo.api.MemoCache;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.FunctionTimer;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Collections;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer integration for memo cache metrics.
 * Binds cache statistics to a MeterRegistry for monitoring and observability.
 *
 * <p>Exposes the following metrics:
 * <ul>
 *   <li>cache.size - Current number of entries
 *   <li>cache.capacity - Maximum number of entries (bounded caches only)
 *   <li>cache.hits - Total number of cache hits
 *   <li>cache.misses - Total number of cache misses
 *   <li>cache.evictions - Total number of evictions
 *   <li>cache.compute.failures - Total number of computations that threw
 *   <li>cache.compute.duration - Time spent in computations
 *   <li>cache.hit.ratio - Cache hit rate (0.0 to 1.0)
 * </ul>
 *
 * <p>Usage example:
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * MemoCache<Report> cache = MemoCacheBuilder.newBuilder()
 *     .maximumSize(1000)
 *     .build();
 *
 * MicrometerCacheMetrics.monitor(registry, cache, "reports");
 * }</pre>
 *
 * <p>A cache built with {@code name("reports")} can be bound with {@code monitor(registry, cache)}.

 */
public class MicrometerCacheMetrics implements MeterBinder {

    private final CacheMetrics cache;
    private final String cacheName;
    private final Iterable<Tag> tags;

    /**
     * Creates a new MicrometerCacheMetrics instance.
     *
     * @param cache the cache to monitor
     * @param cacheName the name of the cache for metric tags
     * @param tags additional tags to apply to all metrics
     */
    public MicrometerCacheMetrics(CacheMetrics cache, String cacheName, Iterable<Tag> tags) {
        this.cache = cache;
        this.cacheName = cacheName;
        this.tags = tags;
    }

    /**
     * Monitors a cache under the name it was built with.
     *
     * @param registry the meter registry
     * @param cache the cache to monitor, which must expose {@link CacheMetrics}
     * @param <C> the cache type
     * @return the cache (for chaining)
     * @throws IllegalArgumentException if the cache does not expose {@link CacheMetrics}
     */
    public static <C extends MemoCache<?>> C monitor(MeterRegistry registry, C cache) {
        return monitor(registry, cache, metricsOf(cache).getName(), Collections.emptyList());
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
    public static <C extends MemoCache<?>> C monitor(MeterRegistry registry, C cache, String cacheName) {
        return monitor(registry, cache, cacheName, Collections.emptyList());
    }

    /**
     * Convenience method to monitor a cache with Micrometer with additional tags.
     *
     * @param registry the meter registry
     * @param cache the cache to monitor, which must expose {@link CacheMetrics}
     * @param cacheName the name of the cache
     * @param tags additional tags
     * @param <C> the cache type
     * @return the cache (for chaining)
     * @throws IllegalArgumentException if the cache does not expose {@link CacheMetrics}
     */
    public static <C extends MemoCache<?>> C monitor(
            MeterRegistry registry, C cache, String cacheName, Iterable<Tag> tags) {
        new MicrometerCacheMetrics(metricsOf(cache), cacheName, tags).bindTo(registry);
        return cache;
    }

    private static CacheMetrics metricsOf(MemoCache<?> cache) {
        if (!(cache instanceof CacheMetrics)) {
            throw new IllegalArgumentException("cache does not expose metrics: " + cache.getClass().getName());
        }
        return (CacheMetrics) cache;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Tags allTags = Tags.of("cache", cacheName).and(tags);

        Gauge.builder("cache.size", cache, CacheMetrics::size)
                .tags(allTags)
                .description("Current number of entries in the cache")
                .register(registry);

        if (cache.capacity().isPresent()) {
            Gauge.builder("cache.capacity", cache, c -> c.capacity().orElse(0))
                    .tags(allTags)
                    .description("Maximum number of entries in the cache")
                    .register(registry);
        }

        FunctionCounter.builder("cache.hits", cache, CacheMetrics::hitCount)
                .tags(allTags)
                .description("Total number of cache hits")
                .register(registry);

        FunctionCounter.builder("cache.misses", cache, CacheMetrics::missCount)
                .tags(allTags)
                .description("Total number of cache misses")
                .register(registry);

        FunctionCounter.builder("cache.evictions", cache, CacheMetrics::evictionCount)
                .tags(allTags)
                .description("Total number of cache evictions")
                .register(registry);

        FunctionCounter.builder("cache.compute.failures", cache, CacheMetrics::computeFailureCount)
                .tags(allTags)
                .description("Number of computations that threw")
                .register(registry);

        FunctionTimer.builder("cache.compute.duration", cache,
                        CacheMetrics::computeCount,
                        CacheMetrics::totalComputeTimeNanos,
                        TimeUnit.NANOSECONDS)
                .tags(allTags)
                .description("Time spent computing missing results")
                .register(registry);

        // Hit ratio (derived metric)
        Gauge.builder("cache.hit.ratio", cache, c -> {
                    long hits = c.hitCount();
                    long total = hits + c.missCount();
                    return total == 0 ? 0.0 : (double) hits / total;
                })
                .tags(allTags)
                .description("Cache hit ratio (0.0 to 1.0)")
                .register(registry);
    }
}

package com.github.rudygunawan.memo;

import com.github.rudygunawan.memo.api.MemoCache;
import com.github.rudygunawan.memo.builder.MemoCacheBuilder;
import com.github.rudygunawan.memo.metrics.MicrometerCacheMetrics;
import com.github.rudygunawan.memo.model.CacheStats;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.FunctionTimer;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Micrometer metrics integration.
 */
class MicrometerMetricsTest {

    @Test
    void testBasicMetricsExposed() {
        MeterRegistry registry = new SimpleMeterRegistry();
        MemoCache<String> cache = MemoCacheBuilder.newBuilder().maximumSize(10).build();

        MicrometerCacheMetrics.monitor(registry, cache, "testCache");

        assertNotNull(registry.find("cache.size").gauge());
        assertNotNull(registry.find("cache.capacity").gauge());
        assertNotNull(registry.find("cache.hits").functionCounter());
        assertNotNull(registry.find("cache.misses").functionCounter());
        assertNotNull(registry.find("cache.evictions").functionCounter());
        assertNotNull(registry.find("cache.compute.failures").functionCounter());
        assertNotNull(registry.find("cache.compute.duration").functionTimer());
        assertNotNull(registry.find("cache.hit.ratio").gauge());
    }

    @Test
    void testUnboundedCacheHasNoCapacityGauge() {
        MeterRegistry registry = new SimpleMeterRegistry();
        MemoCache<String> cache = MemoCacheBuilder.newBuilder().unbounded().build();

        MicrometerCacheMetrics.monitor(registry, cache, "testCache");

        assertNull(registry.find("cache.capacity").gauge());
        assertNotNull(registry.find("cache.size").gauge());
    }

    @Test
    void testCountersFollowCache() throws Exception {
        MeterRegistry registry = new SimpleMeterRegistry();
        MemoCache<String> cache = MemoCacheBuilder.newBuilder().maximumSize(2).build();
        MicrometerCacheMetrics.monitor(registry, cache, "testCache");

        cache.getOrCompute(List.of("a"), () -> "A");
        cache.getOrCompute(List.of("a"), () -> "A");
        cache.getOrCompute(List.of("b"), () -> "B");
        cache.getOrCompute(List.of("c"), () -> "C");
        assertThrows(IllegalStateException.class, () -> cache.getOrCompute(List.of("d"), () -> {
            throw new IllegalStateException("boom");
        }));

        Gauge size = registry.find("cache.size").gauge();
        FunctionCounter hits = registry.find("cache.hits").functionCounter();
        FunctionCounter misses = registry.find("cache.misses").functionCounter();
        FunctionCounter evictions = registry.find("cache.evictions").functionCounter();
        FunctionCounter failures = registry.find("cache.compute.failures").functionCounter();
        FunctionTimer duration = registry.find("cache.compute.duration").functionTimer();
        Gauge capacity = registry.find("cache.capacity").gauge();
        Gauge hitRatio = registry.find("cache.hit.ratio").gauge();

        assertEquals(2.0, size.value(), 0.01);
        assertEquals(2.0, capacity.value(), 0.01);
        assertEquals(1.0, hits.count(), 0.01);
        assertEquals(3.0, misses.count(), 0.01);
        assertEquals(1.0, evictions.count(), 0.01);
        assertEquals(1.0, failures.count(), 0.01);
        assertEquals(4.0, duration.count(), 0.01);
        assertEquals(0.25, hitRatio.value(), 0.01);
    }

    @Test
    void testHitRatioWithoutRequests() {
        MeterRegistry registry = new SimpleMeterRegistry();
        MemoCache<String> cache = MemoCacheBuilder.newBuilder().build();
        MicrometerCacheMetrics.monitor(registry, cache, "testCache");

        assertEquals(0.0, registry.find("cache.hit.ratio").gauge().value(), 0.01);
    }

    @Test
    void testTagsApplied() {
        MeterRegistry registry = new SimpleMeterRegistry();
        MemoCache<String> cache = MemoCacheBuilder.newBuilder().build();

        MicrometerCacheMetrics.monitor(registry, cache, "routes", Tags.of("env", "test"));

        Gauge size = registry.find("cache.size").tags("cache", "routes", "env", "test").gauge();
        assertNotNull(size);
    }

    @Test
    void testBuilderNameIsDefaultTag() throws Exception {
        MeterRegistry registry = new SimpleMeterRegistry();
        MemoCache<String> cache = MemoCacheBuilder.newBuilder().name("routes").build();

        MicrometerCacheMetrics.monitor(registry, cache);
        cache.getOrCompute(List.of("a"), () -> "A");

        FunctionCounter misses = registry.find("cache.misses").tags("cache", "routes").functionCounter();
        assertNotNull(misses);
        assertEquals(1.0, misses.count(), 0.01);
    }

    @Test
    void testUnnamedCacheUsesDefaultName() {
        MeterRegistry registry = new SimpleMeterRegistry();
        MemoCache<String> cache = MemoCacheBuilder.newBuilder().build();

        MicrometerCacheMetrics.monitor(registry, cache);

        assertNotNull(registry.find("cache.size").tags("cache", "memo").gauge());
    }

    @Test
    void testClearResetsMetrics() throws Exception {
        MeterRegistry registry = new SimpleMeterRegistry();
        MemoCache<String> cache = MemoCacheBuilder.newBuilder().build();
        MicrometerCacheMetrics.monitor(registry, cache, "testCache");
        cache.getOrCompute(List.of("a"), Map.of("x", 1), () -> "A");

        cache.clear();

        assertEquals(0.0, registry.find("cache.misses").functionCounter().count(), 0.01);
        assertEquals(0.0, registry.find("cache.size").gauge().value(), 0.01);
        assertEquals(new CacheStats(0, 0, 0, OptionalLong.of(128), 0), cache.stats());
    }

    @Test
    void testMonitorRejectsForeignCache() {
        MemoCache<String> foreign = new MemoCache<>() {
            @Override
            public String getOrCompute(List<?> args, Map<String, ?> kwargs,
                                       java.util.concurrent.Callable<? extends String> computation) throws Exception {
                return computation.call();
            }

            @Override
            public boolean invalidate(List<?> args, Map<String, ?> kwargs) {
                return false;
            }

            @Override
            public CacheStats stats() {
                return new CacheStats(0, 0, 0, OptionalLong.empty(), 0);
            }

            @Override
            public void clear() {
            }

            @Override
            public long size() {
                return 0;
            }
        };

        assertThrows(IllegalArgumentException.class,
                () -> MicrometerCacheMetrics.monitor(new SimpleMeterRegistry(), foreign, "foreign"));
        assertThrows(IllegalArgumentException.class,
                () -> MicrometerCacheMetrics.monitor(new SimpleMeterRegistry(), foreign));
    }
}

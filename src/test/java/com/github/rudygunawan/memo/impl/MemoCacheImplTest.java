package com.github.rudygunawan.memo.impl;

import com.github.rudygunawan.memo.builder.MemoCacheBuilder;
import com.github.rudygunawan.memo.model.CacheStats;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests of recency ordering and locking that need to look inside the cache.
 */
class MemoCacheImplTest {

    private static MemoCacheImpl<String> newCache(long maximumSize) {
        return (MemoCacheImpl<String>) MemoCacheBuilder.newBuilder()
                .maximumSize(maximumSize)
                .<String>build();
    }

    private static String call(MemoCacheImpl<String> cache, long n) throws Exception {
        return cache.getOrCompute(List.of(n), () -> "v" + n);
    }

    @Test
    void testCapacityTwoOrdering() throws Exception {
        MemoCacheImpl<String> cache = newCache(2);

        call(cache, 1);
        call(cache, 2);
        assertEquals(List.of(1L, 2L), cache.keysByRecency());

        call(cache, 1);
        assertEquals(List.of(2L, 1L), cache.keysByRecency());

        call(cache, 3);
        assertEquals(List.of(1L, 3L), cache.keysByRecency());

        call(cache, 2);
        assertEquals(List.of(3L, 2L), cache.keysByRecency());
        cache.checkConsistency();
    }

    @Test
    void testMatchesAccessOrderedMapModel() throws Exception {
        final int capacity = 8;
        MemoCacheImpl<String> cache = newCache(capacity);
        Map<Long, String> model = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Long, String> eldest) {
                return size() > capacity;
            }
        };
        Random random = new Random(42);
        long expectedHits = 0;

        for (int i = 0; i < 5_000; i++) {
            long n = random.nextInt(20);
            if (model.get(n) != null) {
                expectedHits++;
            } else {
                model.put(n, "v" + n);
            }
            assertEquals("v" + n, call(cache, n));
            assertEquals(new ArrayList<Object>(model.keySet()), cache.keysByRecency(), "after call " + i);
        }

        cache.checkConsistency();
        CacheStats stats = cache.stats();
        assertEquals(expectedHits, stats.hitCount());
        assertEquals(5_000 - expectedHits, stats.missCount());
        assertEquals(stats.missCount() - capacity, stats.evictionCount());
    }

    @Test
    void testInvalidateAndReinsertKeepsStoreConsistent() throws Exception {
        MemoCacheImpl<String> cache = newCache(3);
        for (long n = 0; n < 3; n++) {
            call(cache, n);
        }

        assertTrue(cache.invalidate(List.of(1L), null));
        call(cache, 7);
        call(cache, 8);

        assertEquals(List.of(2L, 7L, 8L), cache.keysByRecency());
        cache.checkConsistency();
    }

    @Test
    @Timeout(10)
    void testConcurrentMissesComputeTwiceButStoreOnce() throws Exception {
        MemoCacheImpl<String> cache = newCache(10);
        CountDownLatch bothComputing = new CountDownLatch(2);
        AtomicInteger computations = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            List<Future<String>> results = new ArrayList<>();
            for (String tag : List.of("a", "b")) {
                Callable<String> computation = () -> {
                    computations.incrementAndGet();
                    bothComputing.countDown();
                    assertTrue(bothComputing.await(5, TimeUnit.SECONDS));
                    return tag;
                };
                results.add(executor.submit(() -> cache.getOrCompute(List.of("key"), computation)));
            }

            // Each caller gets its own result back
            assertEquals("a", results.get(0).get());
            assertEquals("b", results.get(1).get());
        } finally {
            executor.shutdown();
        }

        assertEquals(2, computations.get());
        CacheStats stats = cache.stats();
        assertEquals(2, stats.missCount());
        assertEquals(1, stats.size());

        // Whichever finished first was stored and the other was not
        String stored = cache.getOrCompute(List.of("key"), () -> "recomputed");
        assertTrue(stored.equals("a") || stored.equals("b"));
        assertEquals(1, cache.stats().hitCount());
        cache.checkConsistency();
    }

    @Test
    @Timeout(10)
    void testSlowComputationDoesNotBlockOtherCallers() throws Exception {
        MemoCacheImpl<String> cache = newCache(10);
        call(cache, 1);

        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<String> slow = executor.submit(() -> cache.getOrCompute(List.of("slow"), () -> {
                started.countDown();
                release.await();
                return "slow";
            }));
            assertTrue(started.await(5, TimeUnit.SECONDS));

            // The slow computation is still running; hits, misses and stats must not wait for it
            assertEquals("v1", call(cache, 1));
            assertEquals("v2", call(cache, 2));
            assertEquals(2, cache.stats().size());

            release.countDown();
            assertEquals("slow", slow.get());
        } finally {
            executor.shutdown();
        }

        assertEquals(3, cache.size());
    }

    @Test
    @Timeout(30)
    void testConcurrentAccessKeepsStoreConsistent() throws Exception {
        MemoCacheImpl<String> cache = newCache(16);
        int numThreads = 8;
        int numOperations = 2_000;
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch latch = new CountDownLatch(numThreads);
        AtomicInteger errors = new AtomicInteger();

        for (int t = 0; t < numThreads; t++) {
            final int seed = t;
            executor.submit(() -> {
                Random random = new Random(seed);
                try {
                    for (int i = 0; i < numOperations; i++) {
                        long n = random.nextInt(40);
                        if (!("v" + n).equals(call(cache, n))) {
                            errors.incrementAndGet();
                        }
                    }
                } catch (Exception e) {
                    errors.incrementAndGet();
                } finally {
                    latch.countDown();
                }
            });
        }

        assertTrue(latch.await(20, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(0, errors.get());
        cache.checkConsistency();
        CacheStats stats = cache.stats();
        assertEquals((long) numThreads * numOperations, stats.requestCount());
        assertEquals(16, stats.size());
    }
}

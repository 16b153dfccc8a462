package com.github.rudygunawan.memo.metrics;

import java.util.OptionalLong;

/**
 * Interface for cache implementations to provide metrics data.
 * This is used by MicrometerCacheMetrics to collect and expose metrics.
 */
public interface CacheMetrics {

    /**
     * Returns the cache name, used as the default {@code cache} tag.
     */
    String getName();

    /**
     * Returns the current number of entries in the cache.
     */
    long size();

    /**
     * Returns the maximum number of entries, or empty if the entry count is unbounded.
     */
    OptionalLong capacity();

    long hitCount();

    long missCount();

    long evictionCount();

    /**
     * Returns the number of computations that threw.
     */
    long computeFailureCount();

    /**
     * Returns the total time spent in computations, failed ones included, in nanoseconds.
     */
    long totalComputeTimeNanos();

    /**
     * Returns the number of computations run, successful or not.
     */
    default long computeCount() {
        return missCount() + computeFailureCount();
    }
}

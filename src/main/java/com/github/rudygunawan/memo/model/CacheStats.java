package com.github.rudygunawan.memo.model;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * A consistent snapshot of a memo cache's counters and size. Instances of this class are immutable.
 *
 * <p>Counters are updated according to the following rules:
 *
 * <ul>
 *   <li>When a call finds a stored result, {@code hitCount} is incremented.
 *   <li>When a call has to run its computation and the computation returns, {@code missCount} is
 *       incremented. A computation that throws does not count as a miss.
 *   <li>When a stored result is replaced to make room for a new one, {@code evictionCount} is
 *       incremented.
 * </ul>
 *
 * <p>All counters and the size are read under the cache lock, so they always belong to the same
 * moment.
 */
public class CacheStats {
    private final long hitCount;
    private final long missCount;
    private final long evictionCount;
    private final OptionalLong capacity;
    private final long size;

    /**
     * Constructs a new {@code CacheStats} instance.
     */
    public CacheStats(long hitCount, long missCount, long evictionCount, OptionalLong capacity, long size) {
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.evictionCount = evictionCount;
        this.capacity = Objects.requireNonNull(capacity, "capacity cannot be null");
        this.size = size;
    }

    /**
     * Returns {@code hitCount + missCount}.
     */
    public long requestCount() {
        return hitCount + missCount;
    }

    public long hitCount() {
        return hitCount;
    }

    /**
     * Returns {@code hitCount / requestCount}, or {@code 1.0} when {@code requestCount == 0}.
     */
    public double hitRate() {
        long requestCount = requestCount();
        return (requestCount == 0) ? 1.0 : (double) hitCount / requestCount;
    }

    public long missCount() {
        return missCount;
    }

    /**
     * Returns {@code missCount / requestCount}, or {@code 0.0} when {@code requestCount == 0}.
     */
    public double missRate() {
        long requestCount = requestCount();
        return (requestCount == 0) ? 0.0 : (double) missCount / requestCount;
    }

    public long evictionCount() {
        return evictionCount;
    }

    /**
     * Returns the maximum number of entries, {@code 0} if caching is disabled, or empty if the entry
     * count is unbounded (including caches evicting on memory pressure).
     */
    public OptionalLong capacity() {
        return capacity;
    }

    /**
     * Returns the number of stored results.
     */
    public long size() {
        return size;
    }

    /**
     * Returns the counters accumulated since {@code other} was taken. Capacity and size are this
     * snapshot's. Counters never go below zero, which happens when the cache was cleared in between.
     */
    public CacheStats minus(CacheStats other) {
        return new CacheStats(
                Math.max(0, hitCount - other.hitCount),
                Math.max(0, missCount - other.missCount),
                Math.max(0, evictionCount - other.evictionCount),
                capacity,
                size);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hitCount, missCount, evictionCount, capacity, size);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof CacheStats)) {
            return false;
        }
        CacheStats other = (CacheStats) obj;
        return hitCount == other.hitCount
                && missCount == other.missCount
                && evictionCount == other.evictionCount
                && capacity.equals(other.capacity)
                && size == other.size;
    }

    @Override
    public String toString() {
        return "CacheStats{"
                + "hitCount=" + hitCount
                + ", missCount=" + missCount
                + ", evictionCount=" + evictionCount
                + ", capacity=" + (capacity.isPresent() ? String.valueOf(capacity.getAsLong()) : "unbounded")
                + ", size=" + size
                + ", hitRate=" + String.format("%.2f%%", hitRate() * 100)
                + '}';
    }
}

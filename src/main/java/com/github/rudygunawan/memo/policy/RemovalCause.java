package com.github.rudygunawan.memo.policy;

/**
 * The reason why a memoized result was removed from the cache.
 */
public enum RemovalCause {
    /**
     * The entry was removed by {@code invalidate} or {@code clear}.
     */
    EXPLICIT,

    /**
     * The entry was the least recently used one when the cache had reached its maximum size.
     */
    SIZE,

    /**
     * The entry was the least recently used one when available memory had dropped below the
     * configured threshold.
     */
    MEMORY;

    /**
     * Returns {@code true} if the removal was decided by the eviction policy rather than requested
     * by the caller.
     */
    public boolean wasEvicted() {
        return this != EXPLICIT;
    }
}

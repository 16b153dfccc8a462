package com.github.rudygunawan.memo.builder;

import com.github.rudygunawan.memo.api.AvailableMemoryProbe;
import com.github.rudygunawan.memo.api.MemoCache;
import com.github.rudygunawan.memo.impl.MemoCacheImpl;
import com.github.rudygunawan.memo.listener.RemovalListener;
import com.github.rudygunawan.memo.policy.EvictionPolicy;

/**
 * A builder of {@link MemoCache} instances.
 *
 * <p>Exactly one eviction policy is chosen when {@link #build()} is called:
 *
 * <ul>
 *   <li>{@link #useMemoryUpTo(long)} selects memory-pressure eviction and overrides any maximum size
 *   <li>otherwise {@link #unbounded()} selects a cache that never evicts
 *   <li>otherwise the cache keeps at most {@link #maximumSize(long)} entries, 128 by default, and a
 *       maximum size of zero disables caching altogether
 * </ul>
 *
 * <p>Usage example:
 * <pre>{@code
 * MemoCache<Route> routes = MemoCacheBuilder.newBuilder()
 *     .maximumSize(10_000)
 *     .typed()
 *     .name("routes")
 *     .build();
 *
 * Route route = routes.getOrCompute(List.of(from, to), () -> planner.plan(from, to));
 * }</pre>
 *
 * @param <V> the type of memoized results
 */
public class MemoCacheBuilder<V> {
    static final long DEFAULT_MAXIMUM_SIZE = 128;
    private static final int DEFAULT_INITIAL_CAPACITY = 16;
    private static final String DEFAULT_NAME = "memo";
    private static final long UNSET = -1;

    private long maximumSize = UNSET;
    private boolean unbounded = false;
    private long memoryThresholdBytes = UNSET;
    private AvailableMemoryProbe memoryProbe;
    private boolean typed = false;
    private int initialCapacity = DEFAULT_INITIAL_CAPACITY;
    private RemovalListener<? super V> removalListener;
    private String name = DEFAULT_NAME;

    private MemoCacheBuilder() {
    }

    /**
     * Constructs a new {@code MemoCacheBuilder} instance with default settings.
     */
    public static MemoCacheBuilder<Object> newBuilder() {
        return new MemoCacheBuilder<>();
    }

    /**
     * Specifies the maximum number of results the cache may hold. Once the cache holds this many,
     * every further miss replaces the least recently used result.
     *
     * <p>When {@code size} is zero, nothing is stored: every call runs its computation and counts
     * as a miss. This can be useful in testing, or to disable caching without a code change.
     *
     * @param size the maximum size of the cache
     * @return this builder instance
     * @throws IllegalArgumentException if {@code size} is negative
     */
    public MemoCacheBuilder<V> maximumSize(long size) {
        if (size < 0) {
            throw new IllegalArgumentException("maximum size must not be negative");
        }
        this.maximumSize = size;
        this.unbounded = false;
        return this;
    }

    /**
     * Lets the cache grow without bound. Nothing is ever evicted.
     *
     * @return this builder instance
     */
    public MemoCacheBuilder<V> unbounded() {
        this.maximumSize = UNSET;
        this.unbounded = true;
        return this;
    }

    /**
     * Caches results only while at least {@code bytes} of memory are available. Once the memory
     * probe reports less right after an insertion, the next miss replaces the least recently used
     * result instead of adding one. The entry count itself is not bounded.
     *
     * <p>Setting this overrides {@link #maximumSize(long)} and {@link #unbounded()}.
     *
     * @param bytes the amount of memory that must remain available
     * @return this builder instance
     * @throws IllegalArgumentException if {@code bytes} is not positive
     * @see #memoryProbe(AvailableMemoryProbe)
     */
    public MemoCacheBuilder<V> useMemoryUpTo(long bytes) {
        if (bytes <= 0) {
            throw new IllegalArgumentException("memory threshold must be positive");
        }
        this.memoryThresholdBytes = bytes;
        return this;
    }

    /**
     * Specifies how available memory is measured for {@link #useMemoryUpTo(long)}. Defaults to
     * {@link AvailableMemoryProbe#systemMemory()}.
     *
     * @param probe the memory probe
     * @return this builder instance
     */
    public MemoCacheBuilder<V> memoryProbe(AvailableMemoryProbe probe) {
        if (probe == null) {
            throw new NullPointerException("memory probe cannot be null");
        }
        this.memoryProbe = probe;
        return this;
    }

    /**
     * Stores results separately for arguments of different types, so that {@code 3} and
     * {@code 3.0} map to different entries.
     *
     * @return this builder instance
     */
    public MemoCacheBuilder<V> typed() {
        return typed(true);
    }

    /**
     * Specifies whether arguments of different types are cached separately. Off by default, in
     * which case numeric arguments of equal value share an entry.
     *
     * @param typed whether to key on argument types as well as values
     * @return this builder instance
     */
    public MemoCacheBuilder<V> typed(boolean typed) {
        this.typed = typed;
        return this;
    }

    /**
     * Sets the number of entries the cache allocates room for up front. The storage grows as needed.
     *
     * @param initialCapacity the initial capacity
     * @return this builder instance
     * @throws IllegalArgumentException if {@code initialCapacity} is negative
     */
    public MemoCacheBuilder<V> initialCapacity(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initial capacity must not be negative");
        }
        this.initialCapacity = initialCapacity;
        return this;
    }

    /**
     * Specifies a listener notified of every result removed from the cache, whether evicted,
     * invalidated or cleared.
     *
     * <p><b>Warning:</b> all exceptions thrown by {@code listener} will be logged and then swallowed.
     *
     * @param listener the removal listener to use
     * @return this builder instance
     */
    public <V1 extends V> MemoCacheBuilder<V1> removalListener(RemovalListener<? super V1> listener) {
        if (listener == null) {
            throw new NullPointerException("removal listener cannot be null");
        }
        @SuppressWarnings("unchecked")
        MemoCacheBuilder<V1> me = (MemoCacheBuilder<V1>) this;
        me.removalListener = listener;
        return me;
    }

    /**
     * Names the cache in log messages and as the default {@code cache} metrics tag. Defaults to {@code "memo"}.
     *
     * @param name the cache name
     * @return this builder instance
     * @throws IllegalArgumentException if {@code name} is blank
     */
    public MemoCacheBuilder<V> name(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        this.name = name;
        return this;
    }

    /**
     * Builds a memo cache with the configured policy. Each call returns an independent cache.
     *
     * @return a new memo cache
     */
    public <V1 extends V> MemoCache<V1> build() {
        return new MemoCacheImpl<V1>(this);
    }

    /**
     * Resolves the eviction policy from the configured options.
     */
    public EvictionPolicy getEvictionPolicy() {
        if (memoryThresholdBytes != UNSET) {
            AvailableMemoryProbe probe = (memoryProbe != null) ? memoryProbe : AvailableMemoryProbe.systemMemory();
            return EvictionPolicy.memoryPressure(memoryThresholdBytes, probe);
        }
        if (unbounded) {
            return EvictionPolicy.unbounded();
        }
        return EvictionPolicy.fixedCapacity(maximumSize == UNSET ? DEFAULT_MAXIMUM_SIZE : maximumSize);
    }

    public boolean isTyped() {
        return typed;
    }

    public int getInitialCapacity() {
        return initialCapacity;
    }

    public RemovalListener<? super V> getRemovalListener() {
        return removalListener;
    }

    public String getName() {
        return name;
    }
}

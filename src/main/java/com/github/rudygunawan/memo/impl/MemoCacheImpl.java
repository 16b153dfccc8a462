package com.github.rudygunawan.memo.impl;

import com.github.rudygunawan.memo.api.MemoCache;
import com.github.rudygunawan.memo.builder.MemoCacheBuilder;
import com.github.rudygunawan.memo.key.KeyBuilder;
import com.github.rudygunawan.memo.listener.RemovalListener;
import com.github.rudygunawan.memo.metrics.CacheMetrics;
import com.github.rudygunawan.memo.model.CacheStats;
import com.github.rudygunawan.memo.policy.EvictionPolicy;
import com.github.rudygunawan.memo.policy.RemovalCause;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Memo cache with least-recently-used ordering and a pluggable {@link EvictionPolicy}.
 *
 * <p>One lock guards the {@link RecencyStore}, the cached fullness verdict and every counter. The
 * computation and removal listeners always run with the lock released. On a miss the lock is
 * taken twice: once for the lookup and once for the insertion after the computation returns. If
 * another thread stored the same key in between, its entry is kept and this thread's result is
 * returned without being stored.
 *
 * <p>Logging: This class uses java.util.logging. See {@link #LOGGER} for the logger name.
 *
 * @param <V> the type of memoized results
 */
public class MemoCacheImpl<V> implements MemoCache<V>, CacheMetrics {
    /**
     * Logger for cache operations. Logger name: "com.github.rudygunawan.memo.Cache"
     *
     * <p>Log levels used:
     * <ul>
     *   <li>WARNING: Failing memory probes and removal listeners (operations continue)</li>
     *   <li>FINE: Evictions and clears</li>
     *   <li>FINER: Cache construction</li>
     * </ul>
     */
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.memo.Cache");

    private final String name;
    private final KeyBuilder keyBuilder;
    private final EvictionPolicy policy;
    private final RemovalListener<? super V> removalListener;
    private final RecencyStore<V> store;
    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock
    private boolean full;
    private long hitCount;
    private long missCount;
    private long evictionCount;
    private long computeFailureCount;
    private long totalComputeTime;

    @SuppressWarnings("unchecked")
    public MemoCacheImpl(MemoCacheBuilder<?> builder) {
        this.name = builder.getName();
        this.keyBuilder = new KeyBuilder(builder.isTyped());
        this.policy = builder.getEvictionPolicy();
        this.removalListener = (RemovalListener<? super V>) builder.getRemovalListener();
        this.store = new RecencyStore<>(builder.getInitialCapacity());

        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("Created memo cache: name=" + name + ", policy=" + policy
                    + ", typed=" + keyBuilder.isTyped());
        }
    }

    @Override
    public V getOrCompute(List<?> args, Map<String, ?> kwargs, Callable<? extends V> computation)
            throws Exception {
        Objects.requireNonNull(computation, "computation cannot be null");

        if (!policy.storesResults()) {
            long startTime = System.nanoTime();
            V result = compute(computation);
            long computeTime = System.nanoTime() - startTime;
            lock.lock();
            try {
                missCount++;
                totalComputeTime += computeTime;
            } finally {
                lock.unlock();
            }
            return result;
        }

        Object key = keyBuilder.build(args, kwargs);

        lock.lock();
        try {
            int slot = store.lookupAndPromote(key);
            if (slot != RecencyStore.ABSENT) {
                hitCount++;
                return store.resultAt(slot);
            }
        } finally {
            lock.unlock();
        }

        long startTime = System.nanoTime();
        V result = compute(computation);
        long computeTime = System.nanoTime() - startTime;

        RemovedEntry<V> evicted = null;
        long sizeAfter;
        lock.lock();
        try {
            // A concurrent miss may have stored this key while we were computing. Its entry stays.
            if (!store.contains(key)) {
                if (full && store.size() > 0) {
                    evicted = store.evictAndReuse(key, result);
                    evictionCount++;
                } else {
                    store.insert(key, result);
                }
                full = policy.isFull(store.size());
            }
            missCount++;
            totalComputeTime += computeTime;
            sizeAfter = store.size();
        } finally {
            lock.unlock();
        }

        if (evicted != null) {
            RemovalCause cause = policy.evictionCause();
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Evicted entry: cache=" + name + ", key=" + evicted.key
                        + ", cause=" + cause + ", size=" + sizeAfter);
            }
            fireRemovalEvent(evicted, cause);
        }
        return result;
    }

    /**
     * Runs the computation with the lock released, recording failures before rethrowing them.
     */
    private V compute(Callable<? extends V> computation) throws Exception {
        long startTime = System.nanoTime();
        try {
            return computation.call();
        } catch (Exception e) {
            long elapsed = System.nanoTime() - startTime;
            lock.lock();
            try {
                computeFailureCount++;
                totalComputeTime += elapsed;
            } finally {
                lock.unlock();
            }
            throw e;
        }
    }

    @Override
    public boolean invalidate(List<?> args, Map<String, ?> kwargs) {
        if (!policy.storesResults()) {
            return false;
        }
        Object key = keyBuilder.build(args, kwargs);

        RemovedEntry<V> removed;
        lock.lock();
        try {
            removed = store.remove(key);
            if (removed != null) {
                full = policy.isFull(store.size());
            }
        } finally {
            lock.unlock();
        }

        if (removed == null) {
            return false;
        }
        fireRemovalEvent(removed, RemovalCause.EXPLICIT);
        return true;
    }

    @Override
    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(hitCount, missCount, evictionCount, policy.capacity(), store.size());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        List<RemovedEntry<V>> dropped;
        lock.lock();
        try {
            dropped = store.clear(removalListener != null);
            full = false;
            hitCount = 0;
            missCount = 0;
            evictionCount = 0;
            computeFailureCount = 0;
            totalComputeTime = 0;
        } finally {
            lock.unlock();
        }

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Cleared memo cache: name=" + name);
        }
        for (RemovedEntry<V> entry : dropped) {
            fireRemovalEvent(entry, RemovalCause.EXPLICIT);
        }
    }

    @Override
    public long size() {
        lock.lock();
        try {
            return store.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * Returns the stored keys from least to most recently used.
     */
    List<Object> keysByRecency() {
        lock.lock();
        try {
            return store.keysByRecency();
        } finally {
            lock.unlock();
        }
    }

    void checkConsistency() {
        lock.lock();
        try {
            store.checkConsistency();
        } finally {
            lock.unlock();
        }
    }

    private void fireRemovalEvent(RemovedEntry<V> entry, RemovalCause cause) {
        if (removalListener != null) {
            try {
                removalListener.onRemoval(entry.key, entry.result, cause);
            } catch (Exception e) {
                // Log and swallow exceptions from listener
                LOGGER.log(Level.WARNING, "RemovalListener threw exception for key: " + entry.key
                        + ", cause: " + cause, e);
            }
        }
    }

    // CacheMetrics interface implementation for Micrometer integration

    @Override
    public OptionalLong capacity() {
        return policy.capacity();
    }

    @Override
    public long hitCount() {
        lock.lock();
        try {
            return hitCount;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long missCount() {
        lock.lock();
        try {
            return missCount;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long evictionCount() {
        lock.lock();
        try {
            return evictionCount;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long computeFailureCount() {
        lock.lock();
        try {
            return computeFailureCount;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long totalComputeTimeNanos() {
        lock.lock();
        try {
            return totalComputeTime;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "MemoCacheImpl{name=" + name + ", policy=" + policy + ", typed=" + keyBuilder.isTyped() + '}';
    }
}

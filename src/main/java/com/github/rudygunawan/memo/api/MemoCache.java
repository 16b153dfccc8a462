package com.github.rudygunawan.memo.api;

import com.github.rudygunawan.memo.model.CacheStats;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Remembers the results of a computation by the arguments it was called with.
 *
 * <p>A memo cache is created once per memoized computation. Each call passes the arguments that
 * identify the result together with the computation that produces it:
 *
 * <pre>{@code
 * MemoCache<BigInteger> fib = MemoCacheBuilder.newBuilder().maximumSize(1000).build();
 *
 * BigInteger fibonacci(int n) throws Exception {
 *     return fib.getOrCompute(List.of(n), () -> n < 2
 *             ? BigInteger.valueOf(n)
 *             : fibonacci(n - 1).add(fibonacci(n - 2)));
 * }
 * }</pre>
 *
 * <p>Implementations are thread-safe. The computation always runs without any cache lock held, so
 * a slow computation never delays hits on other arguments. The price is that two threads missing
 * on the same arguments at the same time both compute; the first to finish stores its result and
 * the other returns its own result without storing it.
 *
 * @param <V> the type of memoized results
 */
public interface MemoCache<V> {

    /**
     * Returns the stored result for the given arguments, or runs {@code computation}, stores its
     * result and returns it.
     *
     * <p>Keyword arguments are order-insensitive: they are matched by name. A positional argument
     * never matches a keyword argument of equal value.
     *
     * @param args positional arguments identifying the result, {@code null} meaning none
     * @param kwargs keyword arguments identifying the result, {@code null} meaning none
     * @param computation produces the result on a miss
     * @return the stored or freshly computed result, possibly {@code null}
     * @throws com.github.rudygunawan.memo.key.UnhashableArgumentException if an argument cannot be
     *         part of a key; the computation is not run
     * @throws Exception whatever {@code computation} throws; nothing is stored
     */
    V getOrCompute(List<?> args, Map<String, ?> kwargs, Callable<? extends V> computation) throws Exception;

    /**
     * Same as {@link #getOrCompute(List, Map, Callable)} without keyword arguments.
     */
    default V getOrCompute(List<?> args, Callable<? extends V> computation) throws Exception {
        return getOrCompute(args, null, computation);
    }

    /**
     * Discards the stored result for the given arguments, if any. Statistics are not affected.
     *
     * @return {@code true} if a result was discarded
     */
    boolean invalidate(List<?> args, Map<String, ?> kwargs);

    /**
     * Returns a consistent snapshot of hits, misses, evictions, capacity and size.
     */
    CacheStats stats();

    /**
     * Discards all stored results and resets all statistics to zero.
     */
    void clear();

    /**
     * Returns the number of stored results.
     */
    long size();
}

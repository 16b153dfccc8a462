package com.github.rudygunawan.memo.listener;

import com.github.rudygunawan.memo.policy.RemovalCause;

/**
 * A listener that receives notification when a memoized result is removed from a cache.
 *
 * <p>The listener runs on the thread that caused the removal, after the cache has released its
 * lock, so it may call back into the cache. Exceptions thrown by the listener are logged and
 * swallowed.
 *
 * <p>Usage example:
 * <pre>{@code
 * MemoCache<Connection> cache = MemoCacheBuilder.newBuilder()
 *     .maximumSize(16)
 *     .removalListener((key, connection, cause) -> {
 *         try {
 *             connection.close();
 *         } catch (SQLException e) {
 *             LOGGER.log(Level.WARNING, "Failed to close connection for " + key, e);
 *         }
 *     })
 *     .build();
 * }</pre>
 *
 * @param <V> the type of memoized results
 */
@FunctionalInterface
public interface RemovalListener<V> {

    /**
     * Notifies the listener that an entry was removed.
     *
     * @param key the key the cache built from the call's arguments
     * @param result the removed result, possibly {@code null}
     * @param cause the reason for the removal
     */
    void onRemoval(Object key, V result, RemovalCause cause);
}

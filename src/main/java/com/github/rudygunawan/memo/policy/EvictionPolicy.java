package com.github.rudygunawan.memo.policy;

import com.github.rudygunawan.memo.api.AvailableMemoryProbe;

import java.util.Objects;
import java.util.OptionalLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides when a memo cache is full. A policy is chosen once when the cache is built and is asked
 * {@link #isFull(long)} right after every insertion. When the previous answer was {@code true}, the
 * next insertion reuses the least recently used entry instead of adding a new one, so a cache with
 * a maximum size of {@code n} holds exactly {@code n} entries before it starts evicting.
 *
 * <p>Available policies:
 * <ul>
 *   <li>{@link #disabled()} - nothing is stored, every call computes
 *   <li>{@link #unbounded()} - everything is stored, nothing is evicted
 *   <li>{@link #fixedCapacity(long)} - full once the entry count reaches the maximum size
 *   <li>{@link #memoryPressure(long, AvailableMemoryProbe)} - full while available memory is below a threshold
 * </ul>
 */
public abstract class EvictionPolicy {

    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.memo.Cache");

    private EvictionPolicy() {
    }

    /**
     * Returns a policy that stores nothing. Computations still run and are counted as misses.
     */
    public static EvictionPolicy disabled() {
        return Disabled.INSTANCE;
    }

    /**
     * Returns a policy that never reports the cache as full.
     */
    public static EvictionPolicy unbounded() {
        return Unbounded.INSTANCE;
    }

    /**
     * Returns a policy bounding the cache to {@code maximumSize} entries. A size of zero yields
     * {@link #disabled()}.
     *
     * @throws IllegalArgumentException if {@code maximumSize} is negative
     */
    public static EvictionPolicy fixedCapacity(long maximumSize) {
        if (maximumSize < 0) {
            throw new IllegalArgumentException("maximum size must not be negative");
        }
        return (maximumSize == 0) ? Disabled.INSTANCE : new FixedCapacity(maximumSize);
    }

    /**
     * Returns a policy that reports the cache as full while {@code probe} reports fewer than
     * {@code thresholdBytes} available. The entry count is ignored.
     *
     * @throws IllegalArgumentException if {@code thresholdBytes} is not positive
     */
    public static EvictionPolicy memoryPressure(long thresholdBytes, AvailableMemoryProbe probe) {
        if (thresholdBytes <= 0) {
            throw new IllegalArgumentException("memory threshold must be positive");
        }
        return new MemoryPressure(thresholdBytes, Objects.requireNonNull(probe, "probe cannot be null"));
    }

    /**
     * Returns whether the next insertion should evict the least recently used entry.
     *
     * @param currentSize the number of entries right after the latest insertion
     */
    public abstract boolean isFull(long currentSize);

    /**
     * Returns the configured maximum entry count, {@code 0} for a disabled cache, or empty when the
     * entry count is not bounded.
     */
    public abstract OptionalLong capacity();

    /**
     * Returns {@code false} if computed results are never stored.
     */
    public boolean storesResults() {
        return true;
    }

    /**
     * Returns the cause reported to removal listeners for entries this policy evicts.
     */
    public RemovalCause evictionCause() {
        return RemovalCause.SIZE;
    }

    private static final class Disabled extends EvictionPolicy {
        static final Disabled INSTANCE = new Disabled();

        @Override
        public boolean isFull(long currentSize) {
            return true;
        }

        @Override
        public OptionalLong capacity() {
            return OptionalLong.of(0);
        }

        @Override
        public boolean storesResults() {
            return false;
        }

        @Override
        public String toString() {
            return "Disabled";
        }
    }

    private static final class Unbounded extends EvictionPolicy {
        static final Unbounded INSTANCE = new Unbounded();

        @Override
        public boolean isFull(long currentSize) {
            return false;
        }

        @Override
        public OptionalLong capacity() {
            return OptionalLong.empty();
        }

        @Override
        public String toString() {
            return "Unbounded";
        }
    }

    private static final class FixedCapacity extends EvictionPolicy {
        private final long maximumSize;

        FixedCapacity(long maximumSize) {
            this.maximumSize = maximumSize;
        }

        @Override
        public boolean isFull(long currentSize) {
            return currentSize >= maximumSize;
        }

        @Override
        public OptionalLong capacity() {
            return OptionalLong.of(maximumSize);
        }

        @Override
        public String toString() {
            return "FixedCapacity{maximumSize=" + maximumSize + '}';
        }
    }

    private static final class MemoryPressure extends EvictionPolicy {
        private final long thresholdBytes;
        private final AvailableMemoryProbe probe;

        MemoryPressure(long thresholdBytes, AvailableMemoryProbe probe) {
            this.thresholdBytes = thresholdBytes;
            this.probe = probe;
        }

        @Override
        public boolean isFull(long currentSize) {
            try {
                return probe.availableBytes() < thresholdBytes;
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                LOGGER.log(Level.WARNING, "Memory probe failed, treating cache as not full", e);
                return false;
            }
        }

        @Override
        public OptionalLong capacity() {
            return OptionalLong.empty();
        }

        @Override
        public RemovalCause evictionCause() {
            return RemovalCause.MEMORY;
        }

        @Override
        public String toString() {
            return "MemoryPressure{thresholdBytes=" + thresholdBytes + '}';
        }
    }
}

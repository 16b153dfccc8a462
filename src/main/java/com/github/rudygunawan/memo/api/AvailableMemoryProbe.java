package com.github.rudygunawan.memo.api;

import com.github.rudygunawan.memo.memory.HeapMemoryProbe;
import com.github.rudygunawan.memo.memory.SystemMemoryProbe;

/**
 * Reports how many bytes of memory are currently available. Used by the memory-pressure eviction
 * policy, which considers the cache full once availability drops below its threshold.
 *
 * <p>The probe is queried while the cache lock is held, right after every insertion, so it should
 * be fast and must not call back into the cache. A probe that throws is treated as reporting
 * plenty of memory: the cache keeps working and simply stops evicting until the probe recovers.
 *
 * <p>Usage example:
 * <pre>{@code
 * MemoCache<Report> cache = MemoCacheBuilder.newBuilder()
 *     .useMemoryUpTo(512L * 1024 * 1024)
 *     .memoryProbe(AvailableMemoryProbe.jvmHeap())
 *     .build();
 * }</pre>
 */
@FunctionalInterface
public interface AvailableMemoryProbe {

    /**
     * Returns the number of bytes currently available.
     *
     * @throws Exception if availability cannot be determined
     */
    long availableBytes() throws Exception;

    /**
     * Returns a probe reporting memory available to the operating system.
     */
    static AvailableMemoryProbe systemMemory() {
        return SystemMemoryProbe.INSTANCE;
    }

    /**
     * Returns a probe reporting how much more heap the JVM may still allocate.
     */
    static AvailableMemoryProbe jvmHeap() {
        return HeapMemoryProbe.INSTANCE;
    }
}

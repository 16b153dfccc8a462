package com.github.rudygunawan.memo.memory;

import com.github.rudygunawan.memo.api.AvailableMemoryProbe;

/**
 * Reports how much more heap the JVM may allocate before reaching {@code -Xmx}: the maximum heap
 * size minus the heap currently in use.
 */
public final class HeapMemoryProbe implements AvailableMemoryProbe {

    public static final HeapMemoryProbe INSTANCE = new HeapMemoryProbe(Runtime.getRuntime());

    private final Runtime runtime;

    HeapMemoryProbe(Runtime runtime) {
        this.runtime = runtime;
    }

    @Override
    public long availableBytes() {
        long used = runtime.totalMemory() - runtime.freeMemory();
        return runtime.maxMemory() - used;
    }

    @Override
    public String toString() {
        return "HeapMemoryProbe";
    }
}

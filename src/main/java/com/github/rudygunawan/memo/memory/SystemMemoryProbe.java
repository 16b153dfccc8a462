package com.github.rudygunawan.memo.memory;

import com.github.rudygunawan.memo.api.AvailableMemoryProbe;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Reports memory available to the operating system.
 *
 * <p>On Linux the {@code MemAvailable} field of {@code /proc/meminfo} is used. It estimates how
 * much memory can be handed to new allocations without swapping, page cache included. Elsewhere
 * the free physical memory reported by the platform {@link OperatingSystemMXBean} is used.
 */
public final class SystemMemoryProbe implements AvailableMemoryProbe {

    public static final SystemMemoryProbe INSTANCE = new SystemMemoryProbe(Paths.get("/proc/meminfo"));

    private static final String MEM_AVAILABLE = "MemAvailable:";

    private final Path meminfo;

    /**
     * Creates a probe reading the given {@code meminfo} file when it exists.
     */
    public SystemMemoryProbe(Path meminfo) {
        this.meminfo = meminfo;
    }

    @Override
    public long availableBytes() throws IOException {
        if (Files.isReadable(meminfo)) {
            long kilobytes = parseMemAvailable(Files.readAllLines(meminfo, StandardCharsets.US_ASCII));
            if (kilobytes >= 0) {
                return kilobytes * 1024;
            }
        }
        return freePhysicalMemory();
    }

    /**
     * Returns the {@code MemAvailable} value in kilobytes, or {@code -1} if the field is missing.
     */
    static long parseMemAvailable(List<String> lines) {
        for (String line : lines) {
            if (line.startsWith(MEM_AVAILABLE)) {
                String[] fields = line.substring(MEM_AVAILABLE.length()).trim().split("\\s+");
                return Long.parseLong(fields[0]);
            }
        }
        return -1;
    }

    private static long freePhysicalMemory() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean) {
            return ((com.sun.management.OperatingSystemMXBean) os).getFreeMemorySize();
        }
        throw new IllegalStateException("free memory is not reported by " + os.getClass().getName());
    }

    @Override
    public String toString() {
        return "SystemMemoryProbe{meminfo=" + meminfo + '}';
    }
}

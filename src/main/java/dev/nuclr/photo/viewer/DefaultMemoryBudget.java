package dev.nuclr.photo.viewer;

import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * Half of the JVM's maximum heap, clamped to 512..8192 MB.
 * Falls back to a per-OS default when the heap is unbounded.
 */
@Slf4j
public final class DefaultMemoryBudget implements MemoryBudget {

    private static final int MIN_MB = 512;
    private static final int MAX_MB = 8192;
    private static final long MB = 1024L * 1024L;

    @Override
    public int appMemoryLimitMb() {
        try {
            long maxHeap = Runtime.getRuntime().maxMemory();
            if (maxHeap > 0 && maxHeap != Long.MAX_VALUE) {
                long limitMb = maxHeap / 2 / MB;
                return (int) Math.min(Math.max(limitMb, MIN_MB), MAX_MB);
            }
            return osDefault();
        } catch (RuntimeException e) {
            log.warn("Failed to get memory budget: {}", e.getMessage());
            return 2048;
        }
    }

    private static int osDefault() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.contains("win")) return 4096;
        if (os.contains("mac")) return 3072;
        return 2048;
    }
}

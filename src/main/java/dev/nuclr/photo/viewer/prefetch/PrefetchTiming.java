package dev.nuclr.photo.viewer.prefetch;

/**
 * Delays used by the prefetch queue, in milliseconds.
 *
 * @param pollIntervalMs how often to re-check whether interactive loading is idle
 * @param maxIdleWaitMs  longest wait for idle before prefetching anyway
 * @param throttleMs     pause after each prefetched item
 */
public record PrefetchTiming(long pollIntervalMs, long maxIdleWaitMs, long throttleMs) {

    public static final PrefetchTiming DEFAULT = new PrefetchTiming(120, 5000, 40);

    public PrefetchTiming {
        if (pollIntervalMs <= 0) throw new IllegalArgumentException("pollIntervalMs must be positive");
        if (maxIdleWaitMs < 0 || throttleMs < 0) throw new IllegalArgumentException("negative delay");
    }
}

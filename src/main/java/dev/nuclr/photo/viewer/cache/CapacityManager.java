package dev.nuclr.photo.viewer.cache;

import dev.nuclr.photo.viewer.ImageFile;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Enforces the count and memory ceilings of the cache.
 *
 * <p>Every decision that evicts entries (admission control, scheduled cleanup,
 * trims, clear) runs under one lock, so two evictions never race.
 * Bytes reserved for in-flight prefetches count against the ceiling during admission.
 */
@Slf4j
public class CapacityManager {

    /** Requests above this share of {@code maxSize} are "too large". */
    static final double TOO_LARGE_RATIO = 0.6;
    /** Stricter admission limit and the cleanup target, as a share of {@code maxSize}. */
    static final double SAFE_RATIO = 0.8;

    private static final long MB = 1024L * 1024L;

    private final EntryTable table;
    private final SizeEstimator estimator;
    private final Executor cleanupExecutor;

    /** Serialises all capacity adjustments. */
    private final ReentrantLock capacityLock = new ReentrantLock();
    private final AtomicLong reservedBytes = new AtomicLong();

    private volatile int maxCount;
    private volatile long maxSize;

    CapacityManager(EntryTable table, SizeEstimator estimator, Executor cleanupExecutor,
                    int maxCount, long maxSize) {
        this.table = table;
        this.estimator = estimator;
        this.cleanupExecutor = cleanupExecutor;
        this.maxCount = Math.max(1, maxCount);
        this.maxSize = Math.max(1, maxSize);
    }

    // ------------------------------------------------------------ ceilings

    public int getMaxCount() {
        return maxCount;
    }

    public long getMaxSize() {
        return maxSize;
    }

    public void setMaxCount(int maxCount) {
        this.maxCount = Math.max(1, maxCount);
        scheduleCleanup();
    }

    public void setMaxSize(long maxSize) {
        this.maxSize = Math.max(1, maxSize);
        scheduleCleanup();
    }

    public long getReservedBytes() {
        return reservedBytes.get();
    }

    // ---------------------------------------------------- admission control

    /**
     * Evict least-recently-used entries until {@code size + reserved + needBytes}
     * fits. Requests larger than 60% of the ceiling must fit under 80% of it.
     */
    public void ensureCapacity(long needBytes) {
        if (needBytes <= 0) return;

        capacityLock.lock();
        try {
            long max = maxSize;
            boolean tooLarge = needBytes > (long) (max * TOO_LARGE_RATIO);
            long limit = tooLarge ? (long) (max * SAFE_RATIO) : max;

            while (true) {
                long current = table.sizeBytes();
                long reserved = reservedBytes.get();
                if (current + reserved + needBytes <= limit) break;

                List<CacheEntry> lru = table.lruOrder();
                if (lru.isEmpty()) break;

                List<CacheEntry> victims = new ArrayList<>();
                long willFree = 0;
                for (CacheEntry e : lru) {
                    victims.add(e);
                    willFree += e.sizeBytes();
                    if (current - willFree + reserved + needBytes <= limit) break;
                }

                List<CacheEntry> removed = table.evict(victims);
                if (removed.isEmpty()) break;
                log.debug("Admission evicted {} entries for {} MB request", removed.size(), needBytes / MB);
            }
        } finally {
            capacityLock.unlock();
        }
    }

    /**
     * Claim budget for a prefetch of {@code file}.
     *
     * @return the reservation, or null when the estimate exceeds 60% of the
     *         ceiling; a refusal leaves the reserved total untouched
     */
    public Reservation reserveForPreload(ImageFile file) {
        long estimate = estimator.estimate(file);
        if (estimate <= 0) return null;

        if (estimate > (long) (maxSize * TOO_LARGE_RATIO)) {
            log.debug("Not reserving {} for prefetch: {} MB is too large for the cache", file.name(), estimate / MB);
            return null;
        }

        ensureCapacity(estimate);
        reservedBytes.addAndGet(estimate);
        return new Reservation(reservedBytes, estimate);
    }

    // -------------------------------------------------------------- cleanup

    /** Run {@link #cleanup()} on the worker executor. */
    public void scheduleCleanup() {
        try {
            cleanupExecutor.execute(() -> {
                try {
                    cleanup();
                } catch (RuntimeException e) {
                    log.error("Cache cleanup failed", e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Cleanup not scheduled, executor is shut down");
        }
    }

    /**
     * Trim to {@code maxCount}, then, if the cache is over {@code maxSize}, trim to
     * 80% of it. The most recently used entry always survives the size pass.
     */
    public void cleanup() {
        capacityLock.lock();
        try {
            List<CacheEntry> lru = table.lruOrder();
            long size = 0;
            for (CacheEntry e : lru) size += e.sizeBytes();

            List<CacheEntry> victims = new ArrayList<>();
            int next = 0;

            int overCount = lru.size() - maxCount;
            while (next < overCount) {
                CacheEntry e = lru.get(next++);
                victims.add(e);
                size -= e.sizeBytes();
            }

            long max = maxSize;
            if (size > max) {
                long target = (long) (max * SAFE_RATIO);
                while (size > target && next < lru.size() - 1) {
                    CacheEntry e = lru.get(next++);
                    victims.add(e);
                    size -= e.sizeBytes();
                }
            }

            if (victims.isEmpty()) return;
            List<CacheEntry> removed = table.evict(victims);
            if (!removed.isEmpty()) {
                log.info("Cache cleanup completed: removed {} items, current cache: {} items, {} MB",
                        removed.size(), table.count(), table.sizeBytes() / MB);
            }
        } finally {
            capacityLock.unlock();
        }
    }

    /**
     * Evict least-recently-used entries until the cache holds at most
     * {@code targetRatio} (clamped to 0.1..0.9) of {@code maxSize}.
     */
    public TrimResult trimOnMemoryWarning(double targetRatio) {
        double ratio = Math.min(Math.max(targetRatio, 0.1), 0.9);
        capacityLock.lock();
        try {
            long before = table.sizeBytes();
            long target = (long) (maxSize * ratio);
            if (before <= target || table.count() == 0) {
                return new TrimResult(before, before);
            }

            List<CacheEntry> victims = new ArrayList<>();
            long willFree = 0;
            for (CacheEntry e : table.lruOrder()) {
                victims.add(e);
                willFree += e.sizeBytes();
                if (before - willFree <= target) break;
            }
            table.evict(victims);

            long after = table.sizeBytes();
            log.info("Memory warning trim: {} MB -> {} MB", before / MB, after / MB);
            return new TrimResult(before, after);
        } finally {
            capacityLock.unlock();
        }
    }

    /** Remove every entry. */
    public int clear() {
        capacityLock.lock();
        try {
            return table.removeAll().size();
        } finally {
            capacityLock.unlock();
        }
    }
}

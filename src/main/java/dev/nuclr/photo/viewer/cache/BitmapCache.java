package dev.nuclr.photo.viewer.cache;

import dev.nuclr.photo.viewer.ImageFile;
import dev.nuclr.photo.viewer.UiDispatcher;
import dev.nuclr.photo.viewer.decode.ImageDecoder;
import dev.nuclr.photo.viewer.metadata.MetadataProvider;
import lombok.extern.slf4j.Slf4j;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Bounded cache of decoded bitmaps keyed by normalized absolute path.
 *
 * <p>A miss runs admission control, decodes, inserts the result and schedules
 * a cleanup pass. Concurrent misses on the same key share a single decode.
 * Evicted bitmaps are released and announced on the {@link UiDispatcher}.
 *
 * <p>Create one instance per application and inject it where needed.
 */
@Slf4j
public class BitmapCache {

    private final ImageDecoder decoder;
    private final Executor worker;
    private final CacheStatusNotifier notifier;
    private final EntryTable table;
    private final SizeEstimator estimator;
    private final CapacityManager capacity;

    /** Decodes in progress, so a second miss on the same key waits instead of decoding again. */
    private final ConcurrentHashMap<String, CompletableFuture<BufferedImage>> inFlight = new ConcurrentHashMap<>();

    public BitmapCache(ImageDecoder decoder,
                       MetadataProvider metadata,
                       UiDispatcher dispatcher,
                       Executor worker,
                       int maxCount,
                       long maxSize) {
        this.decoder = decoder;
        this.worker = worker;
        this.notifier = new CacheStatusNotifier(dispatcher);
        this.table = new EntryTable(notifier);
        this.estimator = new SizeEstimator(metadata, table, decoder::isStripAlpha);
        this.capacity = new CapacityManager(table, estimator, worker, maxCount, maxSize);
    }

    // ------------------------------------------------------------ loading

    /** Asynchronous {@link #getOrLoad}. */
    public CompletableFuture<BufferedImage> getBitmap(ImageFile file) {
        return CompletableFuture.supplyAsync(() -> getOrLoad(file), worker);
    }

    /**
     * Return the cached bitmap for {@code file}, decoding and inserting it on a miss.
     *
     * @return the bitmap, or null if the file could not be decoded
     */
    public BufferedImage getOrLoad(ImageFile file) {
        return load(file, true);
    }

    /** Fire-and-forget load; failures are logged. */
    public void preload(ImageFile file) {
        try {
            worker.execute(() -> {
                try {
                    getOrLoad(file);
                } catch (RuntimeException e) {
                    log.warn("Failed to preload image ({})", file.name(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Preload of {} dropped, executor is shut down", file.name());
        }
    }

    /**
     * Load {@code file} on the calling thread against budget already claimed by
     * {@code reservation}, skipping admission control.
     */
    public BufferedImage preloadReserved(ImageFile file, Reservation reservation) {
        if (reservation == null || reservation.isReleased()) {
            throw new IllegalStateException("Reserved preload needs a live reservation");
        }
        return load(file, false);
    }

    /** @see CapacityManager#reserveForPreload */
    public Reservation reserveForPreload(ImageFile file) {
        return capacity.reserveForPreload(file);
    }

    private BufferedImage load(ImageFile file, boolean admit) {
        String key = file.cacheKey();

        CacheEntry hit = table.touch(key);
        if (hit != null) {
            log.debug("Cache hit: {}", file.name());
            return hit.image();
        }

        CompletableFuture<BufferedImage> mine = new CompletableFuture<>();
        CompletableFuture<BufferedImage> running = inFlight.putIfAbsent(key, mine);
        if (running != null) {
            log.debug("Waiting for in-flight decode of {}", file.name());
            return running.join();
        }

        try {
            // Another thread may have inserted between the first lookup and claiming the key.
            hit = table.touch(key);
            BufferedImage image = hit != null ? hit.image() : decodeAndInsert(file, key, admit);
            mine.complete(image);
            return image;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    private BufferedImage decodeAndInsert(ImageFile file, String key, boolean admit) {
        if (admit) {
            capacity.ensureCapacity(estimator.estimate(file));
        }

        BufferedImage image = decoder.decode(file);
        if (image == null) return null;

        table.insert(new CacheEntry(key, image, table.nextTick()));
        capacity.scheduleCleanup();
        return image;
    }

    // ------------------------------------------------------------ queries

    public boolean isInCache(String path) {
        return table.contains(path);
    }

    public boolean isInCache(Path path) {
        return table.contains(ImageFile.keyOf(path));
    }

    public boolean isInCache(ImageFile file) {
        return table.contains(file.cacheKey());
    }

    public CacheStats stats() {
        return new CacheStats(table.count(), table.sizeBytes(), capacity.getMaxCount(), capacity.getMaxSize());
    }

    /** Entry for {@code path} without counting as an access. */
    CacheEntry peekEntry(String path) {
        return table.peek(path);
    }

    // ------------------------------------------------------------ mutation

    public void remove(String path) {
        if (table.remove(path) != null) {
            log.debug("Removed from cache: {}", path);
        }
    }

    public void remove(Path path) {
        remove(ImageFile.keyOf(path));
    }

    public void clear() {
        int removed = capacity.clear();
        log.info("Cache cleared ({} items)", removed);
    }

    public int getMaxCount() {
        return capacity.getMaxCount();
    }

    public long getMaxSize() {
        return capacity.getMaxSize();
    }

    /** Change the count ceiling; a cleanup pass follows asynchronously. */
    public void setMaxCount(int maxCount) {
        capacity.setMaxCount(maxCount);
    }

    /** Change the memory ceiling in bytes; a cleanup pass follows asynchronously. */
    public void setMaxSize(long maxSize) {
        capacity.setMaxSize(maxSize);
    }

    public long getReservedBytes() {
        return capacity.getReservedBytes();
    }

    /** @see CapacityManager#trimOnMemoryWarning */
    public TrimResult trimOnMemoryWarning(double targetRatio) {
        return capacity.trimOnMemoryWarning(targetRatio);
    }

    // ------------------------------------------------------------ events

    public void addCacheStatusListener(CacheStatusListener listener) {
        notifier.addListener(listener);
    }

    public void removeCacheStatusListener(CacheStatusListener listener) {
        notifier.removeListener(listener);
    }
}

package dev.nuclr.photo.viewer;

import dev.nuclr.photo.viewer.cache.BitmapCache;
import dev.nuclr.photo.viewer.decode.DecodePipeline;
import dev.nuclr.photo.viewer.decode.FormatDecoder;
import dev.nuclr.photo.viewer.decode.HeifFormatDecoder;
import dev.nuclr.photo.viewer.decode.PdfboxFormatDecoder;
import dev.nuclr.photo.viewer.metadata.ImageMetadataProvider;
import dev.nuclr.photo.viewer.metadata.MetadataProvider;
import dev.nuclr.photo.viewer.prefetch.PrefetchCoordinator;
import dev.nuclr.photo.viewer.prefetch.PrefetchHost;
import dev.nuclr.photo.viewer.prefetch.PrefetchTiming;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds and owns the cache, decode pipeline and worker pools.
 *
 * <p>Construct once at startup and hand the pieces to the views that need them.
 * {@link #close()} stops all background work.
 */
@Slf4j
public final class PhotoViewerServices implements AutoCloseable {

    private final PhotoViewerSettings settings;
    private final DecodePipeline decodePipeline;
    private final BitmapCache bitmapCache;
    private final ExecutorService cacheWorkers;
    private final ExecutorService prefetchWorkers;

    public PhotoViewerServices(PhotoViewerSettings settings, UiDispatcher dispatcher) {
        this(settings, dispatcher, new ImageMetadataProvider(),
                List.of(new HeifFormatDecoder(), new PdfboxFormatDecoder(settings.getPdfDpi())));
    }

    /**
     * @param formatDecoders alternate-format decoders, checked in order; pass a
     *                       platform HEIF decoder ahead of the default to enable it
     */
    public PhotoViewerServices(PhotoViewerSettings settings,
                               UiDispatcher dispatcher,
                               MetadataProvider metadata,
                               List<FormatDecoder> formatDecoders) {
        this.settings = settings;
        this.cacheWorkers = Executors.newCachedThreadPool(named("photo-cache"));
        this.prefetchWorkers = Executors.newCachedThreadPool(named("photo-prefetch"));
        this.decodePipeline = new DecodePipeline(metadata, formatDecoders, settings.isStripAlpha());
        this.bitmapCache = new BitmapCache(decodePipeline, metadata, dispatcher, cacheWorkers,
                settings.getCacheMaxCount(), settings.getCacheMaxBytes());
        log.info("Photo viewer services started: {}", bitmapCache.stats().describe());
    }

    public PhotoViewerSettings settings() {
        return settings;
    }

    public BitmapCache bitmapCache() {
        return bitmapCache;
    }

    public DecodePipeline decodePipeline() {
        return decodePipeline;
    }

    /** A prefetcher for one browsing view, sharing this instance's cache and pools. */
    public PrefetchCoordinator newPrefetchCoordinator(PrefetchHost host) {
        return new PrefetchCoordinator(bitmapCache, host, settings, PrefetchTiming.DEFAULT, prefetchWorkers);
    }

    /** Push the current settings into the running cache; ceiling changes trigger a cleanup. */
    public void applySettings() {
        decodePipeline.setStripAlpha(settings.isStripAlpha());
        bitmapCache.setMaxCount(settings.getCacheMaxCount());
        bitmapCache.setMaxSize(settings.getCacheMaxBytes());
    }

    @Override
    public void close() {
        prefetchWorkers.shutdownNow();
        cacheWorkers.shutdown();
        try {
            if (!cacheWorkers.awaitTermination(2, TimeUnit.SECONDS)) {
                cacheWorkers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cacheWorkers.shutdownNow();
        }
        bitmapCache.clear();
        log.info("Photo viewer services stopped");
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}

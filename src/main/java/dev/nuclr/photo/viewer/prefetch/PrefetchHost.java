package dev.nuclr.photo.viewer.prefetch;

import dev.nuclr.photo.viewer.ImageFile;

import java.util.List;

/**
 * The browsing state the prefetcher reads from the UI layer.
 * Called from prefetch worker threads; implementations must be thread-safe.
 */
public interface PrefetchHost {

    /** Current, filtered file list in display order. */
    List<? extends ImageFile> files();

    /** Index of the displayed image in {@link #files()}, or -1. */
    int currentIndex();

    /** True while the displayed image is still being decoded for the viewer. */
    boolean isCurrentImageLoading();

    /** True while the thumbnail strip is busy loading. */
    boolean isThumbnailLoadingBusy();
}

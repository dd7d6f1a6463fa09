package dev.nuclr.photo.viewer.prefetch;

import dev.nuclr.photo.viewer.ImageFile;
import dev.nuclr.photo.viewer.PhotoViewerSettings;
import dev.nuclr.photo.viewer.cache.BitmapCache;
import dev.nuclr.photo.viewer.cache.Reservation;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the images around the user's position warm in the {@link BitmapCache}.
 *
 * <p>Two independent intents: around the current image (on navigation) and
 * around the middle of the visible range (when scrolling settles). Starting an
 * intent cancels that intent's previous run. Only one queue drains at a time,
 * and each item first waits until the viewer and thumbnail strip are idle, for
 * at most {@link PrefetchTiming#maxIdleWaitMs()}.
 *
 * <p>Failures and refusals are logged at debug level and never surface to the UI.
 */
@Slf4j
public class PrefetchCoordinator implements AutoCloseable {

    private final BitmapCache cache;
    private final PrefetchHost host;
    private final PhotoViewerSettings settings;
    private final PrefetchTiming timing;
    private final Executor executor;

    private final AtomicReference<CancellationSource> aroundCurrent = new AtomicReference<>();
    private final AtomicReference<CancellationSource> visibleCenter = new AtomicReference<>();

    /** Set while a queue is draining; shared by both intents. */
    private final AtomicBoolean busy = new AtomicBoolean();

    public PrefetchCoordinator(BitmapCache cache,
                               PrefetchHost host,
                               PhotoViewerSettings settings,
                               PrefetchTiming timing,
                               Executor executor) {
        this.cache = cache;
        this.host = host;
        this.settings = settings;
        this.timing = timing;
        this.executor = executor;
    }

    // ------------------------------------------------------------ triggers

    /** Call after the displayed image changes. */
    public void notifyCurrentChanged() {
        CancellationSource cts = restart(aroundCurrent);
        submit("around-current", () -> runAroundCurrent(cts.token()));
    }

    /** Call when a scrolling view has stopped with {@code [first, last]} visible. */
    public void notifyVisibleRangeSettled(int first, int last) {
        CancellationSource cts = restart(visibleCenter);
        submit("visible-center", () -> runVisibleCenter(first, last, cts.token()));
    }

    /** Cancel both intents. Runs in progress stop at their next check. */
    @Override
    public void close() {
        cancel(aroundCurrent);
        cancel(visibleCenter);
    }

    boolean isBusy() {
        return busy.get();
    }

    private static CancellationSource restart(AtomicReference<CancellationSource> slot) {
        CancellationSource next = new CancellationSource();
        CancellationSource previous = slot.getAndSet(next);
        if (previous != null) previous.cancel();
        return next;
    }

    private static void cancel(AtomicReference<CancellationSource> slot) {
        CancellationSource cts = slot.getAndSet(null);
        if (cts != null) cts.cancel();
    }

    private void submit(String intent, Runnable run) {
        try {
            executor.execute(() -> {
                try {
                    run.run();
                } catch (CancellationException e) {
                    log.debug("{} prefetch cancelled", intent);
                } catch (RuntimeException e) {
                    log.warn("{} prefetch aborted", intent, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("{} prefetch not started, executor is shut down", intent);
        }
    }

    // ------------------------------------------------------------ planning

    void runAroundCurrent(CancellationToken token) {
        List<? extends ImageFile> files = host.files();
        int current = host.currentIndex();
        List<Integer> plan = PrefetchPlanner.aroundCurrent(current, files.size(),
                settings.getPrefetchForwardCount(), settings.getPrefetchBackwardCount());
        drain("around-current", select(files, plan), token);
    }

    void runVisibleCenter(int first, int last, CancellationToken token) {
        List<? extends ImageFile> files = host.files();
        List<Integer> plan = PrefetchPlanner.visibleCenter(first, last, files.size(),
                settings.getVisibleCenterCount());
        drain("visible-center", select(files, plan), token);
    }

    private static List<ImageFile> select(List<? extends ImageFile> files, List<Integer> indices) {
        List<ImageFile> selected = new ArrayList<>(indices.size());
        for (int i : indices) selected.add(files.get(i));
        return selected;
    }

    // ------------------------------------------------------------ queue

    private void drain(String intent, List<ImageFile> queue, CancellationToken token) {
        if (queue.isEmpty()) return;

        while (!busy.compareAndSet(false, true)) {
            token.sleep(timing.pollIntervalMs());
        }
        try {
            int loaded = 0;
            for (ImageFile file : queue) {
                if (token.isCancelled()) {
                    log.debug("{} prefetch cancelled after {} items", intent, loaded);
                    return;
                }
                waitForHighPriorityIdle(token);
                token.throwIfCancelled();

                if (cache.isInCache(file)) continue;
                if (prefetchOne(file)) loaded++;

                token.sleep(timing.throttleMs());
            }
            log.debug("{} prefetch finished: {} of {} loaded", intent, loaded, queue.size());
        } finally {
            busy.set(false);
        }
    }

    private boolean prefetchOne(ImageFile file) {
        try (Reservation reservation = cache.reserveForPreload(file)) {
            if (reservation == null) return false;
            return cache.preloadReserved(file, reservation) != null;
        } catch (RuntimeException e) {
            log.debug("Prefetch of {} failed: {}", file.name(), e.getMessage());
            return false;
        }
    }

    /** Poll until interactive loading is idle, giving up after the configured ceiling. */
    private void waitForHighPriorityIdle(CancellationToken token) {
        long waited = 0;
        while (!token.isCancelled()) {
            if (!isHighPriorityBusy()) return;
            token.sleep(timing.pollIntervalMs());
            waited += timing.pollIntervalMs();
            if (waited >= timing.maxIdleWaitMs()) {
                log.debug("Interactive loading still busy after {} ms, prefetching anyway", waited);
                return;
            }
        }
    }

    private boolean isHighPriorityBusy() {
        try {
            return host.isCurrentImageLoading() || host.isThumbnailLoadingBusy();
        } catch (RuntimeException e) {
            log.debug("Host busy check failed: {}", e.getMessage());
            return false;
        }
    }
}

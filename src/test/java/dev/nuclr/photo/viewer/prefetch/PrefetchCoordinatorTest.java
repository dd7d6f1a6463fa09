package dev.nuclr.photo.viewer.prefetch;

import dev.nuclr.photo.viewer.FixedMetadata;
import dev.nuclr.photo.viewer.ImageFile;
import dev.nuclr.photo.viewer.PhotoViewerSettings;
import dev.nuclr.photo.viewer.QueuedDispatcher;
import dev.nuclr.photo.viewer.StubImageFile;
import dev.nuclr.photo.viewer.cache.BitmapCache;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PrefetchCoordinatorTest {

    private static final PrefetchTiming FAST = new PrefetchTiming(5, 100, 1);

    @TempDir
    Path dir;

    private final List<String> decoded = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, CountDownLatch> blockers = new ConcurrentHashMap<>();
    private final Map<String, RuntimeException> failures = new ConcurrentHashMap<>();
    private final FixedMetadata metadata = new FixedMetadata().withDefaultDimensions(10, 10);
    private final TestHost host = new TestHost(20);

    private PhotoViewerSettings settings;
    private ExecutorService executor;

    @BeforeEach
    public void setUp() {
        settings = new PhotoViewerSettings(dir.resolve("photo-viewer.properties"), () -> 2048);
        settings.setCacheMaxCount(30);
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    public void tearDown() {
        blockers.values().forEach(CountDownLatch::countDown);
        executor.shutdownNow();
    }

    private BitmapCache cache(long maxSize) {
        return cache(30, maxSize);
    }

    private BitmapCache cache(int maxCount, long maxSize) {
        return new BitmapCache(file -> {
            decoded.add(file.name());
            CountDownLatch blocker = blockers.get(file.name());
            if (blocker != null) {
                try {
                    blocker.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            RuntimeException failure = failures.get(file.name());
            if (failure != null) throw failure;
            return new BufferedImage(10, 10, BufferedImage.TYPE_INT_ARGB);
        }, metadata, new QueuedDispatcher(), Runnable::run, maxCount, maxSize);
    }

    private PrefetchCoordinator coordinator(BitmapCache cache) {
        return new PrefetchCoordinator(cache, host, settings, FAST, executor);
    }

    private void waitFor(BooleanSupplier condition) throws InterruptedException {
        for (int i = 0; i < 50 && !condition.getAsBoolean(); i++) Thread.sleep(100);
    }

    @Test
    public void aroundCurrentLoadsNearestFirst() {
        settings.setPrefetchForwardCount(3);
        settings.setPrefetchBackwardCount(2);
        host.current = 5;
        BitmapCache cache = cache(512L * 1024 * 1024);
        PrefetchCoordinator prefetch = coordinator(cache);

        prefetch.runAroundCurrent(CancellationToken.NONE);

        assertEquals(List.of("f4.jpg", "f6.jpg", "f3.jpg", "f7.jpg", "f8.jpg"), decoded);
        assertTrue(cache.isInCache(host.file(8)));
        assertFalse(prefetch.isBusy());
        assertEquals(0, cache.getReservedBytes());
    }

    @Test
    public void defaultSettingsKeepCurrentImageAndNeighbours() {
        PhotoViewerSettings defaults = new PhotoViewerSettings(dir.resolve("defaults.properties"), () -> 2048);
        TestHost browsing = new TestHost(30);
        browsing.current = 10;
        BitmapCache cache = cache(defaults.getCacheMaxCount(), defaults.getCacheMaxBytes());
        cache.getOrLoad(browsing.file(10));

        new PrefetchCoordinator(cache, browsing, defaults, FAST, executor).runAroundCurrent(CancellationToken.NONE);

        assertEquals(7, cache.getMaxCount());
        assertTrue(cache.isInCache(browsing.file(10)));
        assertTrue(cache.isInCache(browsing.file(9)));
        assertTrue(cache.isInCache(browsing.file(11)));
        assertTrue(cache.stats().count() <= cache.getMaxCount());
    }

    @Test
    public void cachedFilesAreSkipped() {
        settings.setPrefetchForwardCount(2);
        settings.setPrefetchBackwardCount(0);
        host.current = 0;
        BitmapCache cache = cache(512L * 1024 * 1024);
        cache.getOrLoad(host.file(1));
        decoded.clear();

        coordinator(cache).runAroundCurrent(CancellationToken.NONE);

        assertEquals(List.of("f2.jpg"), decoded);
    }

    @Test
    public void visibleCenterLoadsMiddleOut() {
        settings.setVisibleCenterCount(3);
        BitmapCache cache = cache(512L * 1024 * 1024);

        coordinator(cache).runVisibleCenter(0, 9, CancellationToken.NONE);

        assertEquals(List.of("f4.jpg", "f3.jpg", "f5.jpg"), decoded);
    }

    @Test
    public void oversizedFileIsSkipped() {
        settings.setPrefetchForwardCount(2);
        settings.setPrefetchBackwardCount(0);
        host.current = 0;
        metadata.withDimensions("f1.jpg", 100, 100);
        BitmapCache cache = cache(1000);

        coordinator(cache).runAroundCurrent(CancellationToken.NONE);

        assertEquals(List.of("f2.jpg"), decoded);
        assertFalse(cache.isInCache(host.file(1)));
        assertEquals(0, cache.getReservedBytes());
    }

    @Test
    public void failedItemDoesNotStopTheBatch() {
        settings.setPrefetchForwardCount(2);
        settings.setPrefetchBackwardCount(0);
        host.current = 0;
        failures.put("f1.jpg", new IllegalStateException("decoder crashed"));
        BitmapCache cache = cache(512L * 1024 * 1024);

        coordinator(cache).runAroundCurrent(CancellationToken.NONE);

        assertEquals(List.of("f1.jpg", "f2.jpg"), decoded);
        assertFalse(cache.isInCache(host.file(1)));
        assertTrue(cache.isInCache(host.file(2)));
        assertEquals(0, cache.getReservedBytes());
    }

    @Test
    public void idleWaitIsBounded() {
        settings.setPrefetchForwardCount(2);
        settings.setPrefetchBackwardCount(0);
        host.current = 0;
        host.loading = true;
        BitmapCache cache = cache(512L * 1024 * 1024);
        long start = System.nanoTime();

        coordinator(cache).runAroundCurrent(CancellationToken.NONE);

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertEquals(2, decoded.size());
        assertTrue(elapsedMs >= 2 * FAST.maxIdleWaitMs(), "elapsed " + elapsedMs);
        assertTrue(elapsedMs < 5000, "elapsed " + elapsedMs);
    }

    @Test
    public void newNavigationCancelsPreviousRun() throws Exception {
        settings.setPrefetchForwardCount(3);
        settings.setPrefetchBackwardCount(0);
        host.current = 0;
        CountDownLatch release = new CountDownLatch(1);
        blockers.put("f1.jpg", release);
        BitmapCache cache = cache(512L * 1024 * 1024);
        PrefetchCoordinator prefetch = coordinator(cache);

        prefetch.notifyCurrentChanged();
        waitFor(() -> decoded.contains("f1.jpg"));

        settings.setPrefetchForwardCount(1);
        host.current = 7;
        prefetch.notifyCurrentChanged();
        release.countDown();
        waitFor(() -> decoded.contains("f8.jpg"));
        Thread.sleep(100);

        assertEquals(List.of("f1.jpg", "f8.jpg"), decoded);
        waitFor(() -> !prefetch.isBusy());
        assertFalse(prefetch.isBusy());
    }

    @Test
    public void closeStopsRunningPrefetch() throws Exception {
        settings.setPrefetchForwardCount(3);
        settings.setPrefetchBackwardCount(0);
        host.current = 0;
        CountDownLatch release = new CountDownLatch(1);
        blockers.put("f1.jpg", release);
        BitmapCache cache = cache(512L * 1024 * 1024);
        PrefetchCoordinator prefetch = coordinator(cache);

        prefetch.notifyCurrentChanged();
        waitFor(() -> decoded.contains("f1.jpg"));
        prefetch.close();
        release.countDown();
        waitFor(() -> !prefetch.isBusy());
        Thread.sleep(100);

        assertEquals(List.of("f1.jpg"), decoded);
    }

    /** Browsing state with mutable fields, read from the prefetch worker. */
    private static final class TestHost implements PrefetchHost {

        private final List<StubImageFile> files = new ArrayList<>();
        volatile int current;
        volatile boolean loading;

        TestHost(int count) {
            for (int i = 0; i < count; i++) files.add(new StubImageFile("f" + i + ".jpg"));
        }

        ImageFile file(int index) {
            return files.get(index);
        }

        @Override
        public List<? extends ImageFile> files() {
            return files;
        }

        @Override
        public int currentIndex() {
            return current;
        }

        @Override
        public boolean isCurrentImageLoading() {
            return loading;
        }

        @Override
        public boolean isThumbnailLoadingBusy() {
            return false;
        }
    }
}

package dev.nuclr.photo.viewer;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Properties;

/**
 * Settings for the bitmap cache and prefetcher.
 * Persisted to the platform user config directory as a .properties file.
 *
 * <p>Cache defaults are derived from the {@link MemoryBudget}: half of the
 * application limit, capped at 4 GB and never below 512 MB.
 *
 * <p>The prefetch maximum is a third of the cache's count ceiling, so one
 * prefetch run can never push the displayed image out of the cache. The stored
 * prefetch counts are clamped to it on every read and follow the ceiling when
 * it changes.
 */
@Slf4j
public final class PhotoViewerSettings {

    public static final String KEY_CACHE_MAX_COUNT        = "photo.cache.maxCount";
    public static final String KEY_CACHE_MAX_MEMORY_MB    = "photo.cache.maxMemoryMb";
    public static final String KEY_CACHE_STRIP_ALPHA      = "photo.cache.stripAlpha";
    public static final String KEY_PREFETCH_FORWARD       = "photo.prefetch.forwardCount";
    public static final String KEY_PREFETCH_BACKWARD      = "photo.prefetch.backwardCount";
    public static final String KEY_PREFETCH_VISIBLE       = "photo.prefetch.visibleCenterCount";
    public static final String KEY_PDF_DPI                = "photo.pdf.dpi";

    private static final int     MIN_CACHE_COUNT        = 1;
    private static final int     MAX_CACHE_COUNT        = 400;
    private static final int     MIN_CACHE_MEMORY_MB    = 256;
    private static final int     MAX_CACHE_MEMORY_MB    = 32768;
    private static final int     MAX_PREFETCH_COUNT     = MAX_CACHE_COUNT / 3;
    private static final int     DEFAULT_FORWARD        = 10;
    private static final int     DEFAULT_BACKWARD       = 5;
    private static final int     DEFAULT_VISIBLE        = 5;
    private static final boolean DEFAULT_STRIP_ALPHA    = false;
    private static final int     DEFAULT_DPI            = 144;
    private static final int     MAX_DPI                = 200;
    private static final int     MIN_DPI                = 36;

    /** Average decoded footprint of a 33 MP photo, used to size the default count. */
    private static final int     MB_PER_PHOTO_ESTIMATE  = 132;

    private final Path file;
    private final Properties props = new Properties();
    private final int defaultMemoryMb;
    private final int defaultCount;

    public PhotoViewerSettings(Path file, MemoryBudget budget) {
        this.file = file;
        this.defaultMemoryMb = defaultMemoryMb(budget);
        this.defaultCount = defaultMemoryMb < 4096
                ? Math.max(MIN_CACHE_COUNT, defaultMemoryMb / MB_PER_PHOTO_ESTIMATE)
                : 30;
        load();
    }

    /** Settings stored in the current user's config directory. */
    public static PhotoViewerSettings forCurrentUser() {
        return new PhotoViewerSettings(settingsFile(), new DefaultMemoryBudget());
    }

    // --- Getters ---

    public int getCacheMaxCount() {
        return clamp(readInt(KEY_CACHE_MAX_COUNT, defaultCount), MIN_CACHE_COUNT, MAX_CACHE_COUNT);
    }

    public int getCacheMaxMemoryMb() {
        return clamp(readInt(KEY_CACHE_MAX_MEMORY_MB, defaultMemoryMb), MIN_CACHE_MEMORY_MB, MAX_CACHE_MEMORY_MB);
    }

    public long getCacheMaxBytes() {
        return getCacheMaxMemoryMb() * 1024L * 1024L;
    }

    public boolean isStripAlpha() {
        return Boolean.parseBoolean(props.getProperty(KEY_CACHE_STRIP_ALPHA, String.valueOf(DEFAULT_STRIP_ALPHA)));
    }

    /** A third of {@link #getCacheMaxCount()}; 0 disables prefetching ahead and behind. */
    public int getPrefetchMaximum() {
        return getCacheMaxCount() / 3;
    }

    public int getPrefetchForwardCount() {
        return clamp(readInt(KEY_PREFETCH_FORWARD, DEFAULT_FORWARD), 0, getPrefetchMaximum());
    }

    public int getPrefetchBackwardCount() {
        return clamp(readInt(KEY_PREFETCH_BACKWARD, DEFAULT_BACKWARD), 0, getPrefetchMaximum());
    }

    public int getVisibleCenterCount() {
        return clamp(readInt(KEY_PREFETCH_VISIBLE, DEFAULT_VISIBLE), 0, getPrefetchMaximum());
    }

    public int getPdfDpi() {
        return clamp(readInt(KEY_PDF_DPI, DEFAULT_DPI), MIN_DPI, MAX_DPI);
    }

    // --- Setters (also persist) ---

    public synchronized void setCacheMaxCount(int count) {
        props.setProperty(KEY_CACHE_MAX_COUNT, String.valueOf(clamp(count, MIN_CACHE_COUNT, MAX_CACHE_COUNT)));
        save();
    }

    public synchronized void setCacheMaxMemoryMb(int mb) {
        props.setProperty(KEY_CACHE_MAX_MEMORY_MB, String.valueOf(clamp(mb, MIN_CACHE_MEMORY_MB, MAX_CACHE_MEMORY_MB)));
        save();
    }

    public synchronized void setStripAlpha(boolean strip) {
        props.setProperty(KEY_CACHE_STRIP_ALPHA, String.valueOf(strip));
        save();
    }

    public synchronized void setPrefetchForwardCount(int count) {
        props.setProperty(KEY_PREFETCH_FORWARD, String.valueOf(clamp(count, 0, MAX_PREFETCH_COUNT)));
        save();
    }

    public synchronized void setPrefetchBackwardCount(int count) {
        props.setProperty(KEY_PREFETCH_BACKWARD, String.valueOf(clamp(count, 0, MAX_PREFETCH_COUNT)));
        save();
    }

    public synchronized void setVisibleCenterCount(int count) {
        props.setProperty(KEY_PREFETCH_VISIBLE, String.valueOf(clamp(count, 0, MAX_PREFETCH_COUNT)));
        save();
    }

    public synchronized void setPdfDpi(int dpi) {
        props.setProperty(KEY_PDF_DPI, String.valueOf(clamp(dpi, MIN_DPI, MAX_DPI)));
        save();
    }

    // --- Helpers ---

    private int readInt(String key, int fallback) {
        try {
            return Integer.parseInt(props.getProperty(key, String.valueOf(fallback)).trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static int clamp(int value, int min, int max) {
        return Math.min(Math.max(value, min), max);
    }

    private static int defaultMemoryMb(MemoryBudget budget) {
        try {
            int limit = budget.appMemoryLimitMb();
            if (limit <= 0) return 2048;
            return Math.max(512, Math.min(limit / 2, 4096));
        } catch (RuntimeException e) {
            log.warn("Failed to initialize memory budget: {}", e.getMessage());
            return 2048;
        }
    }

    // --- Persistence ---

    private void load() {
        if (!Files.exists(file)) return;
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        } catch (IOException e) {
            log.warn("Could not load photo viewer settings, using defaults: {}", e.getMessage());
        }
    }

    private void save() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            try (OutputStream out = Files.newOutputStream(tmp)) {
                props.store(out, "Nuclr Photo Viewer settings");
            }
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.warn("Could not save photo viewer settings: {}", e.getMessage());
        }
    }

    static Path settingsFile() {
        String os = System.getProperty("os.name", "").toLowerCase();
        Path dir;
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            dir = (appData != null)
                    ? Path.of(appData, "nuclr")
                    : Path.of(System.getProperty("user.home"), "nuclr");
        } else if (os.contains("mac")) {
            dir = Path.of(System.getProperty("user.home"), "Library", "Application Support", "nuclr");
        } else {
            String xdg = System.getenv("XDG_CONFIG_HOME");
            dir = (xdg != null)
                    ? Path.of(xdg, "nuclr")
                    : Path.of(System.getProperty("user.home"), ".config", "nuclr");
        }
        return dir.resolve("photo-viewer.properties");
    }
}

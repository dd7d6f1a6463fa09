package dev.nuclr.photo.viewer.cache;

/**
 * Snapshot of cache occupancy against its ceilings.
 */
public record CacheStats(int count, long sizeBytes, int maxCount, long maxSize) {

    private static final long MB = 1024L * 1024L;

    public String describe() {
        return "Cache: " + count + "/" + maxCount + " items, "
                + sizeBytes / MB + "/" + maxSize / MB + " MB";
    }
}

package dev.nuclr.photo.viewer.cache;

import java.awt.image.BufferedImage;
import java.awt.image.DataBuffer;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One decoded bitmap held by the cache.
 *
 * <p>The image is released (flushed) exactly once, after the entry has left
 * the table. Size is measured from the real raster, not from the pre-decode estimate.
 */
public final class CacheEntry {

    private final String key;
    private final BufferedImage image;
    private final long sizeBytes;
    private final AtomicBoolean released = new AtomicBoolean();

    private volatile long lastAccess;

    CacheEntry(String key, BufferedImage image, long sizeBytes, long lastAccess) {
        this.key = key;
        this.image = image;
        this.sizeBytes = sizeBytes;
        this.lastAccess = lastAccess;
    }

    CacheEntry(String key, BufferedImage image, long lastAccess) {
        this(key, image, byteSizeOf(image), lastAccess);
    }

    public String key() {
        return key;
    }

    public BufferedImage image() {
        return image;
    }

    public long sizeBytes() {
        return sizeBytes;
    }

    /** Logical access time; larger means more recently used. */
    public long lastAccess() {
        return lastAccess;
    }

    void touch(long tick) {
        lastAccess = tick;
    }

    public boolean isReleased() {
        return released.get();
    }

    /** @return true if this call performed the release */
    boolean release() {
        if (!released.compareAndSet(false, true)) return false;
        image.flush();
        return true;
    }

    /** Bytes held by the image's backing data buffer. */
    public static long byteSizeOf(BufferedImage image) {
        DataBuffer buffer = image.getRaster().getDataBuffer();
        long elementBits = DataBuffer.getDataTypeSize(buffer.getDataType());
        return (long) buffer.getSize() * buffer.getNumBanks() * elementBits / 8;
    }
}

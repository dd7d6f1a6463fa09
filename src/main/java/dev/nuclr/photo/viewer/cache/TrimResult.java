package dev.nuclr.photo.viewer.cache;

/**
 * Cache size before and after a memory-warning trim.
 */
public record TrimResult(long beforeBytes, long afterBytes) {

    public long freedBytes() {
        return beforeBytes - afterBytes;
    }
}

package dev.nuclr.photo.viewer.cache;

/**
 * Told when a path enters or leaves the cache.
 * Invoked through the cache's {@link dev.nuclr.photo.viewer.UiDispatcher}.
 */
@FunctionalInterface
public interface CacheStatusListener {

    void onCacheStatusChanged(String path, boolean cached);
}

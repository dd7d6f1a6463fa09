package dev.nuclr.photo.viewer.cache;

import dev.nuclr.photo.viewer.UiDispatcher;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Delivers status events and releases evicted bitmaps on the UI dispatcher,
 * keeping both off the thread that removed the entries.
 */
@Slf4j
final class CacheStatusNotifier {

    private final UiDispatcher dispatcher;
    private final List<CacheStatusListener> listeners = new CopyOnWriteArrayList<>();

    CacheStatusNotifier(UiDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    void addListener(CacheStatusListener listener) {
        listeners.add(listener);
    }

    void removeListener(CacheStatusListener listener) {
        listeners.remove(listener);
    }

    void cached(String key) {
        dispatcher.post(() -> fire(key, true));
    }

    /** One "not cached" event per entry, then release of every image. */
    void evicted(List<CacheEntry> removed) {
        if (removed.isEmpty()) return;
        List<CacheEntry> batch = List.copyOf(removed);
        dispatcher.post(() -> {
            for (CacheEntry e : batch) fire(e.key(), false);
        });
        dispatcher.post(() -> {
            for (CacheEntry e : batch) e.release();
        });
    }

    /** Release an entry overwritten by a newer one for the same key; no event. */
    void replaced(CacheEntry old) {
        dispatcher.post(old::release);
    }

    private void fire(String key, boolean cached) {
        for (CacheStatusListener l : listeners) {
            try {
                l.onCacheStatusChanged(key, cached);
            } catch (RuntimeException e) {
                log.warn("Cache status listener failed for {}", key, e);
            }
        }
    }
}

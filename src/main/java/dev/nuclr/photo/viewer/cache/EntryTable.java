package dev.nuclr.photo.viewer.cache;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Key to entry table with last-access bookkeeping.
 *
 * <p>Single get/insert/remove calls are safe from any thread. Batch eviction
 * ({@link #evict}) is only called by {@link CapacityManager} under its lock.
 */
final class EntryTable {

    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final AtomicLong clock = new AtomicLong();
    private final CacheStatusNotifier notifier;

    EntryTable(CacheStatusNotifier notifier) {
        this.notifier = notifier;
    }

    long nextTick() {
        return clock.incrementAndGet();
    }

    CacheEntry peek(String key) {
        return entries.get(key);
    }

    /** Lookup that counts as an access. */
    CacheEntry touch(String key) {
        CacheEntry entry = entries.get(key);
        if (entry != null) entry.touch(nextTick());
        return entry;
    }

    boolean contains(String key) {
        return entries.containsKey(key);
    }

    /** Insert or replace; the replaced image is released, the new key is announced. */
    void insert(CacheEntry entry) {
        CacheEntry previous = entries.put(entry.key(), entry);
        if (previous != null && previous != entry) {
            notifier.replaced(previous);
        }
        notifier.cached(entry.key());
    }

    CacheEntry remove(String key) {
        CacheEntry removed = entries.remove(key);
        if (removed != null) notifier.evicted(List.of(removed));
        return removed;
    }

    int count() {
        return entries.size();
    }

    long sizeBytes() {
        long total = 0;
        for (CacheEntry e : entries.values()) total += e.sizeBytes();
        return total;
    }

    /** Snapshot of live entries, least recently used first. */
    List<CacheEntry> lruOrder() {
        // Access times keep moving under concurrent hits; sort a frozen copy of them.
        List<Stamped> stamped = new ArrayList<>(entries.size());
        for (CacheEntry e : entries.values()) stamped.add(new Stamped(e, e.lastAccess()));
        stamped.sort(Comparator.comparingLong(Stamped::access));

        List<CacheEntry> sorted = new ArrayList<>(stamped.size());
        for (Stamped s : stamped) sorted.add(s.entry());
        return sorted;
    }

    private record Stamped(CacheEntry entry, long access) {}

    /**
     * Remove the given entries if they are still the live mapping for their key.
     *
     * @return the entries actually removed
     */
    List<CacheEntry> evict(List<CacheEntry> victims) {
        List<CacheEntry> removed = new ArrayList<>(victims.size());
        for (CacheEntry e : victims) {
            if (entries.remove(e.key(), e)) removed.add(e);
        }
        notifier.evicted(removed);
        return removed;
    }

    List<CacheEntry> removeAll() {
        return evict(new ArrayList<>(entries.values()));
    }
}

package com.company.metrics.cache;

import com.company.metrics.domain.Entry;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Record sets by source id, reloaded through the {@link EntryLoader} once older than the
 * staleness window. Readers always get deep copies.
 */
@Slf4j
public class EntryCache {

    private final EntryLoader loader;
    private final Duration staleness;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, CachedEntries> cache = new HashMap<>();

    public EntryCache(EntryLoader loader, Duration staleness) {
        this(loader, staleness, Clock.systemUTC());
    }

    public EntryCache(EntryLoader loader, Duration staleness, Clock clock) {
        this.loader = loader;
        this.staleness = staleness;
        this.clock = clock;
    }

    public List<Entry> getEntries(String sourceId) {
        return getEntries(sourceId, false);
    }

    /**
     * Returns a copy of the cached entries, loading them first when absent, stale or {@code forceReload}.
     * The loader runs under the lock so one source is never loaded twice concurrently.
     */
    public List<Entry> getEntries(String sourceId, boolean forceReload) {
        lock.lock();
        try {
            Instant now = clock.instant();
            CachedEntries cached = cache.get(sourceId);
            if (forceReload || cached == null || isStale(cached, now)) {
                long start = System.currentTimeMillis();
                List<Entry> loaded = loader.load(sourceId);
                cached = new CachedEntries(List.copyOf(loaded), now);
                cache.put(sourceId, cached);
                log.info("Loaded {} entries from {} in {} ms", loaded.size(), sourceId,
                        System.currentTimeMillis() - start);
            } else {
                log.debug("Cache hit for {}", sourceId);
            }
            return copyOf(cached.getEntries());
        } finally {
            lock.unlock();
        }
    }

    public void invalidate(String sourceId) {
        lock.lock();
        try {
            if (cache.remove(sourceId) != null) {
                log.debug("Invalidated cached entries of {}", sourceId);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of entries held across all sources.
     */
    public int size() {
        lock.lock();
        try {
            return cache.values().stream().mapToInt(c -> c.getEntries().size()).sum();
        } finally {
            lock.unlock();
        }
    }

    private boolean isStale(CachedEntries cached, Instant now) {
        return Duration.between(cached.getLoadedAt(), now).compareTo(staleness) > 0;
    }

    private static List<Entry> copyOf(List<Entry> entries) {
        List<Entry> copy = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            copy.add(entry.copy());
        }
        return copy;
    }

    @Value
    private static class CachedEntries {
        List<Entry> entries;
        Instant loadedAt;
    }
}

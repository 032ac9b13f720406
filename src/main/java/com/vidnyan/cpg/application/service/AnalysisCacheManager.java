package com.vidnyan.cpg.application.service;

import com.vidnyan.cpg.config.EngineProperties;
import com.vidnyan.cpg.domain.cache.CacheEntry;
import com.vidnyan.cpg.domain.cache.CacheStats;
import com.vidnyan.cpg.domain.cache.CacheType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owner of the query, analysis and CPG caches.
 * <p>
 * Lookups run concurrently; inserts, evictions and compression are serialized on this instance.
 * Each cache has its own TTL, checked on lookup. When a cache reaches its entry ceiling the
 * least recently accessed fraction of it is evicted before the insert.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisCacheManager {

    private final EngineProperties properties;
    private final Clock clock;

    private final Map<CacheType, Map<String, CacheEntry>> caches = initCaches();
    private final Map<CacheType, Counters> counters = initCounters();

    public synchronized void put(CacheType type, String key, Object value) {
        Map<String, CacheEntry> cache = caches.get(type);
        if (!cache.containsKey(key) && cache.size() >= properties.getCache().getMaxEntries()) {
            evictLeastRecentlyUsed(type);
        }
        cache.put(key, new CacheEntry(key, value, clock.instant()));
    }

    public Optional<Object> get(CacheType type, String key) {
        Map<String, CacheEntry> cache = caches.get(type);
        Counters stats = counters.get(type);
        CacheEntry entry = cache.get(key);
        Instant now = clock.instant();
        if (entry == null) {
            stats.misses.incrementAndGet();
            return Optional.empty();
        }
        if (entry.isExpired(now, ttlMs(type))) {
            removeIfSame(type, key, entry);
            stats.misses.incrementAndGet();
            return Optional.empty();
        }
        Object value = entry.value();
        if (value == null) {
            // compressed value reclaimed by the collector
            removeIfSame(type, key, entry);
            stats.misses.incrementAndGet();
            return Optional.empty();
        }
        entry.touch(now);
        stats.hits.incrementAndGet();
        return Optional.of(value);
    }

    public <T> Optional<T> get(CacheType type, String key, Class<T> valueType) {
        return get(type, key).filter(valueType::isInstance).map(valueType::cast);
    }

    public synchronized boolean invalidate(CacheType type, String key) {
        return caches.get(type).remove(key) != null;
    }

    public synchronized int clear(CacheType type) {
        Map<String, CacheEntry> cache = caches.get(type);
        int removed = cache.size();
        cache.clear();
        counters.get(type).evictions.addAndGet(removed);
        if (removed > 0) {
            log.debug("Cleared {} cache ({} entries)", type, removed);
        }
        return removed;
    }

    public synchronized int clearAll() {
        int removed = 0;
        for (CacheType type : CacheType.values()) {
            removed += clear(type);
        }
        return removed;
    }

    /**
     * Compress entries accessed fewer than {@code accessThreshold} times and older than {@code minAge}.
     * @return number of entries newly compressed
     */
    public synchronized int compressIdle(CacheType type, int accessThreshold, Duration minAge) {
        Instant cutoff = clock.instant().minus(minAge);
        int compressed = 0;
        for (CacheEntry entry : caches.get(type).values()) {
            if (entry.accessCount() < accessThreshold && entry.insertedAt().isBefore(cutoff) && entry.compress()) {
                compressed++;
            }
        }
        return compressed;
    }

    /**
     * Remove entries not accessed within {@code maxIdle}.
     */
    public synchronized int evictIdle(CacheType type, Duration maxIdle) {
        Instant cutoff = clock.instant().minus(maxIdle);
        List<String> stale = caches.get(type).values().stream()
                .filter(e -> e.lastAccess().isBefore(cutoff))
                .map(CacheEntry::key)
                .toList();
        stale.forEach(caches.get(type)::remove);
        counters.get(type).evictions.addAndGet(stale.size());
        return stale.size();
    }

    public int size(CacheType type) {
        return caches.get(type).size();
    }

    public Map<CacheType, CacheStats> stats() {
        Map<CacheType, CacheStats> stats = new EnumMap<>(CacheType.class);
        for (CacheType type : CacheType.values()) {
            Counters c = counters.get(type);
            int compressed = (int) caches.get(type).values().stream().filter(CacheEntry::isCompressed).count();
            stats.put(type, new CacheStats(type, size(type), c.hits.get(), c.misses.get(), c.evictions.get(), compressed));
        }
        return stats;
    }

    long ttlMs(CacheType type) {
        EngineProperties.Cache cache = properties.getCache();
        return switch (type) {
            case QUERY -> cache.getQueryTtlMs();
            case ANALYSIS -> cache.getAnalysisTtlMs();
            case CPG -> cache.getCpgTtlMs();
        };
    }

    private void evictLeastRecentlyUsed(CacheType type) {
        Map<String, CacheEntry> cache = caches.get(type);
        int toEvict = Math.max(1, (int) Math.ceil(cache.size() * properties.getCache().getEvictionFraction()));
        List<String> victims = cache.values().stream()
                .sorted(Comparator.comparing(CacheEntry::lastAccess))
                .limit(toEvict)
                .map(CacheEntry::key)
                .toList();
        victims.forEach(cache::remove);
        counters.get(type).evictions.addAndGet(victims.size());
        log.debug("Evicted {} least recently used entries from {} cache", victims.size(), type);
    }

    private synchronized void removeIfSame(CacheType type, String key, CacheEntry entry) {
        if (caches.get(type).remove(key, entry)) {
            counters.get(type).evictions.incrementAndGet();
        }
    }

    private static Map<CacheType, Map<String, CacheEntry>> initCaches() {
        Map<CacheType, Map<String, CacheEntry>> map = new EnumMap<>(CacheType.class);
        for (CacheType type : CacheType.values()) {
            map.put(type, new ConcurrentHashMap<>());
        }
        return map;
    }

    private static Map<CacheType, Counters> initCounters() {
        Map<CacheType, Counters> map = new EnumMap<>(CacheType.class);
        for (CacheType type : CacheType.values()) {
            map.put(type, new Counters());
        }
        return map;
    }

    private static final class Counters {
        private final AtomicLong hits = new AtomicLong();
        private final AtomicLong misses = new AtomicLong();
        private final AtomicLong evictions = new AtomicLong();
    }
}

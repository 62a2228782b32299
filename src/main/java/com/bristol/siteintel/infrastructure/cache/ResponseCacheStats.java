package com.bristol.siteintel.infrastructure.cache;

import com.github.benmanes.caffeine.cache.stats.CacheStats;

/**
 * @param activeEntries entries still inside their TTL
 * @param storedEntries entries held, including those only servable as stale
 */
public record ResponseCacheStats(
        long hits,
        long misses,
        double hitRate,
        long staleHits,
        long evictions,
        long activeEntries,
        long storedEntries
) {

    static ResponseCacheStats of(CacheStats stats, long staleHits, long activeEntries, long storedEntries) {
        return new ResponseCacheStats(stats.hitCount(), stats.missCount(), stats.hitRate(), staleHits,
                stats.evictionCount(), activeEntries, storedEntries);
    }
}

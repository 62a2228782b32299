package com.bristol.siteintel.infrastructure.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.stats.ConcurrentStatsCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Caffeine-backed response cache. Each entry is held for its own TTL plus the stale retention window and
 * reads decide freshness against the entry's expiry. Time comes from the supplied clock.
 */
public class CaffeineResponseCache<V> implements ResponseCache<V> {

    private static final Logger logger = LoggerFactory.getLogger(CaffeineResponseCache.class);

    private static final Duration LONGEST_HOLD = Duration.ofDays(365L * 100);

    private final Cache<CacheKey, CacheEntry<V>> entries;
    private final ConcurrentStatsCounter statsCounter = new ConcurrentStatsCounter();
    private final LongAdder staleHits = new LongAdder();
    private final Clock clock;

    public CaffeineResponseCache(Clock clock, Duration staleRetention, long maximumSize) {
        this.clock = Objects.requireNonNull(clock, "clock");
        if (staleRetention == null || staleRetention.isNegative()) {
            throw new IllegalArgumentException("staleRetention must be zero or positive");
        }
        this.entries = Caffeine.newBuilder()
                .ticker(() -> epochNanos(clock.instant()))
                .executor(Runnable::run)
                .maximumSize(maximumSize)
                .expireAfter(new HoldForTtlAndRetention<V>(staleRetention))
                .recordStats(() -> statsCounter)
                .build();
    }

    @Override
    public Optional<V> get(CacheKey key) {
        var entry = entries.asMap().get(key);
        if (entry == null || !entry.isFresh(clock.instant())) {
            statsCounter.recordMisses(1);
            logger.debug("Cache MISS for {}", key);
            return Optional.empty();
        }
        statsCounter.recordHits(1);
        logger.debug("Cache HIT for {}", key);
        return Optional.of(entry.value());
    }

    @Override
    public void put(CacheKey key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be zero or positive, got " + ttl);
        }
        var now = clock.instant();
        entries.put(key, new CacheEntry<>(key, value, now, now.plus(ttl)));
        logger.debug("Cached {} for {}", key, ttl);
    }

    @Override
    public Optional<CacheEntry<V>> getStale(CacheKey key) {
        var entry = entries.asMap().get(key);
        if (entry == null) {
            return Optional.empty();
        }
        staleHits.increment();
        return Optional.of(entry);
    }

    @Override
    public int clear(String prefixOrNull) {
        boolean everything = prefixOrNull == null || prefixOrNull.isEmpty();
        var map = entries.asMap();
        int removed = 0;
        for (var key : map.keySet()) {
            if ((everything || key.startsWith(prefixOrNull)) && map.remove(key) != null) {
                removed++;
            }
        }
        if (everything) {
            logger.info("Cleared entire response cache ({} entries)", removed);
        } else {
            logger.info("Cleared {} cache entries with prefix '{}'", removed, prefixOrNull);
        }
        return removed;
    }

    @Override
    public int evictExpired() {
        long before = statsCounter.snapshot().evictionCount();
        entries.cleanUp();
        return (int) (statsCounter.snapshot().evictionCount() - before);
    }

    @Override
    public ResponseCacheStats getStats() {
        var now = clock.instant();
        long active = entries.asMap().values().stream().filter(entry -> entry.isFresh(now)).count();
        return ResponseCacheStats.of(entries.stats(), staleHits.sum(), active, entries.estimatedSize());
    }

    private static long epochNanos(Instant instant) {
        return TimeUnit.SECONDS.toNanos(instant.getEpochSecond()) + instant.getNano();
    }

    private static final class HoldForTtlAndRetention<V> implements Expiry<CacheKey, CacheEntry<V>> {

        private final Duration staleRetention;

        private HoldForTtlAndRetention(Duration staleRetention) {
            this.staleRetention = staleRetention;
        }

        @Override
        public long expireAfterCreate(CacheKey key, CacheEntry<V> entry, long currentTime) {
            // One nanosecond past the window keeps the last stale instant readable
            var hold = Duration.between(entry.storedAt(), entry.expiresAt()).plus(staleRetention).plusNanos(1);
            return hold.compareTo(LONGEST_HOLD) > 0 ? LONGEST_HOLD.toNanos() : hold.toNanos();
        }

        @Override
        public long expireAfterUpdate(CacheKey key, CacheEntry<V> entry, long currentTime, long currentDuration) {
            return expireAfterCreate(key, entry, currentTime);
        }

        @Override
        public long expireAfterRead(CacheKey key, CacheEntry<V> entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}

package com.bristol.siteintel.infrastructure.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * TTL cache for normalized upstream responses.
 */
public interface ResponseCache<V> {

    /**
     * Value for the key, empty when absent or expired.
     */
    Optional<V> get(CacheKey key);

    void put(CacheKey key, V value, Duration ttl);

    /**
     * Entry for the key even if expired, as long as it is still inside the stale retention window.
     */
    Optional<CacheEntry<V>> getStale(CacheKey key);

    /**
     * Removes every entry, or only those whose key starts with the prefix.
     *
     * @return number of removed entries
     */
    int clear(String prefixOrNull);

    /**
     * Runs pending maintenance, dropping entries past the stale retention window.
     *
     * @return number of removed entries
     */
    int evictExpired();

    ResponseCacheStats getStats();
}

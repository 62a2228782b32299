package com.bristol.siteintel.infrastructure.cache;

import java.time.Instant;

/**
 * Immutable cache entry. Visible to readers while {@code now <= expiresAt}.
 */
public record CacheEntry<V>(CacheKey key, V value, Instant storedAt, Instant expiresAt) {

    public boolean isFresh(Instant now) {
        return !now.isAfter(expiresAt);
    }
}

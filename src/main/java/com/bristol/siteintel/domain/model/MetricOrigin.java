package com.bristol.siteintel.domain.model;

public enum MetricOrigin {
    /** Fetched from the upstream for this request */
    FRESH,
    /** Served from an unexpired cache entry */
    CACHED,
    /** Served from an expired entry because the upstream was unavailable */
    STALE
}

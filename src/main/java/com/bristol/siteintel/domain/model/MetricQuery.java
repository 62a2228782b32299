package com.bristol.siteintel.domain.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Validated and defaulted parameters for one upstream. These parameters identify the cache entry.
 */
public record MetricQuery(String upstreamId, Map<String, String> params) {

    public MetricQuery {
        Objects.requireNonNull(upstreamId, "upstreamId");
        params = Collections.unmodifiableMap(new TreeMap<>(params));
    }

    public String param(String name) {
        return params.get(name);
    }

    public int intParam(String name) {
        return Integer.parseInt(params.get(name));
    }
}

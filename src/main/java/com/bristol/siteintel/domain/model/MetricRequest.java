package com.bristol.siteintel.domain.model;

import java.util.Map;

public record MetricRequest(String upstreamId, Map<String, String> params) {

    public MetricRequest {
        params = params == null ? Map.of() : Map.copyOf(params);
    }
}

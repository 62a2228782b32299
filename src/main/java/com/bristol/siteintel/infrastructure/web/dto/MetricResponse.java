package com.bristol.siteintel.infrastructure.web.dto;

import com.bristol.siteintel.domain.model.MetricOrigin;
import com.bristol.siteintel.domain.model.MetricPayload;
import com.bristol.siteintel.domain.model.MetricResult;
import com.bristol.siteintel.domain.model.UpstreamFamily;

import java.time.Instant;

public record MetricResponse(
        String upstream,
        UpstreamFamily family,
        MetricOrigin origin,
        Instant asOf,
        MetricPayload data
) {
    public static MetricResponse fromResult(MetricResult result) {
        return new MetricResponse(
                result.upstreamId(),
                result.family(),
                result.origin(),
                result.asOf(),
                result.payload()
        );
    }
}

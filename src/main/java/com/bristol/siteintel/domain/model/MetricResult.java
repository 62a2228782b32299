package com.bristol.siteintel.domain.model;

import java.time.Instant;

/**
 * @param asOf when the payload was fetched from the upstream
 */
public record MetricResult(
        String upstreamId,
        UpstreamFamily family,
        MetricOrigin origin,
        Instant asOf,
        MetricPayload payload
) {
    public static MetricResult fresh(String upstreamId, UpstreamFamily family, MetricPayload payload, Instant fetchedAt) {
        return new MetricResult(upstreamId, family, MetricOrigin.FRESH, fetchedAt, payload);
    }

    public MetricResult withOrigin(MetricOrigin newOrigin) {
        return new MetricResult(upstreamId, family, newOrigin, asOf, payload);
    }
}

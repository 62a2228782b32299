package com.bristol.siteintel.infrastructure.adapter.normalizer;

import com.bristol.siteintel.domain.model.MetricPayload;
import com.bristol.siteintel.domain.model.MetricQuery;
import com.bristol.siteintel.domain.model.UpstreamFamily;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Turns the parsed body of one upstream family into a {@link MetricPayload}. Implementations are
 * pure and throw {@link com.bristol.siteintel.domain.exception.NormalizationException} on schema drift.
 */
public interface PayloadNormalizer<T extends MetricPayload> {

    UpstreamFamily family();

    T normalize(JsonNode body, MetricQuery query);
}

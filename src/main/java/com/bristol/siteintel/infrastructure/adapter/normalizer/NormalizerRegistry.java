package com.bristol.siteintel.infrastructure.adapter.normalizer;

import com.bristol.siteintel.domain.exception.NormalizationException;
import com.bristol.siteintel.domain.model.MetricPayload;
import com.bristol.siteintel.domain.model.MetricQuery;
import com.bristol.siteintel.domain.model.UpstreamFamily;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class NormalizerRegistry {

    private final Map<UpstreamFamily, PayloadNormalizer<?>> normalizers = new EnumMap<>(UpstreamFamily.class);
    private final ObjectMapper objectMapper;

    public NormalizerRegistry(List<PayloadNormalizer<?>> normalizers, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        for (var normalizer : normalizers) {
            var previous = this.normalizers.put(normalizer.family(), normalizer);
            if (previous != null) {
                throw new IllegalStateException("Two normalizers registered for family " + normalizer.family());
            }
        }
    }

    /**
     * Parses the raw body and normalizes it. A blank body is handed to the normalizer as a missing node.
     */
    public MetricPayload normalize(String rawBody, UpstreamFamily family, MetricQuery query) {
        var normalizer = normalizers.get(family);
        if (normalizer == null) {
            throw new IllegalStateException("No normalizer registered for family " + family);
        }
        return normalizer.normalize(parse(rawBody, query), query);
    }

    private JsonNode parse(String rawBody, MetricQuery query) {
        if (rawBody == null || rawBody.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            throw new NormalizationException(query.upstreamId(),
                    "Response from upstream '" + query.upstreamId() + "' is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}

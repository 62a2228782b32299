package com.bristol.siteintel.infrastructure.adapter.normalizer;

import com.bristol.siteintel.domain.exception.NormalizationException;
import com.bristol.siteintel.domain.model.MetricQuery;
import com.bristol.siteintel.domain.model.NormalizedSeries;
import com.bristol.siteintel.domain.model.UpstreamFamily;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NormalizerRegistryTest {

    private final NormalizerRegistry registry = new NormalizerRegistry(
            List.of(new LaborSeriesNormalizer(), new DemographicsSeriesNormalizer()), new ObjectMapper());

    @Test
    void shouldRouteBodyToFamilyNormalizer() {
        // Given
        var query = new MetricQuery("bls", Map.of("start", "2024-01", "end", "2024-12"));
        var body = """
                {"status": "REQUEST_SUCCEEDED", "Results": {"series": [{"data": [
                  {"year": "2024", "period": "M01", "value": "3.7"}]}]}}
                """;

        // When
        var payload = registry.normalize(body, UpstreamFamily.LABOR, query);

        // Then
        assertThat(payload).isInstanceOf(NormalizedSeries.class);
        assertThat(((NormalizedSeries) payload).points()).hasSize(1);
    }

    @Test
    void shouldHandBlankBodyToNormalizerAsMissing() {
        var query = new MetricQuery("census", Map.of("variable", "SAEMHI_PT", "from", "2015", "to", "2022"));

        var payload = registry.normalize("", UpstreamFamily.DEMOGRAPHICS, query);

        assertThat(((NormalizedSeries) payload).points()).isEmpty();
    }

    @Test
    void shouldRejectInvalidJson() {
        var query = new MetricQuery("bls", Map.of());

        assertThatThrownBy(() -> registry.normalize("<html>Service Unavailable</html>", UpstreamFamily.LABOR, query))
                .isInstanceOf(NormalizationException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    void shouldRefuseDuplicateFamilies() {
        assertThatThrownBy(() -> new NormalizerRegistry(
                List.of(new LaborSeriesNormalizer(), new LaborSeriesNormalizer()), new ObjectMapper()))
                .isInstanceOf(IllegalStateException.class);
    }
}

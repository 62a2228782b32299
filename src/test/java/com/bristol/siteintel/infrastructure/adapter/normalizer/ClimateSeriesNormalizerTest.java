package com.bristol.siteintel.infrastructure.adapter.normalizer;

import com.bristol.siteintel.domain.exception.NormalizationException;
import com.bristol.siteintel.domain.model.MetricQuery;
import com.bristol.siteintel.domain.model.SeriesPoint;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.bristol.siteintel.infrastructure.adapter.normalizer.NormalizerFixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClimateSeriesNormalizerTest {

    private final ClimateSeriesNormalizer normalizer = new ClimateSeriesNormalizer();

    private final MetricQuery query = new MetricQuery("noaa",
            Map.of("station", "GHCND:USW00013881", "datatype", "TAVG", "dataset", "GSOM"));

    @Test
    void shouldAverageObservationsWithinMonthAndIgnoreOtherDataTypes() {
        // Given
        var body = json("""
                {"metadata": {"resultset": {"count": 4}}, "results": [
                  {"date": "2024-01-01T00:00:00", "datatype": "TAVG", "station": "GHCND:USW00013881", "value": 40.0},
                  {"date": "2024-01-15T00:00:00", "datatype": "TAVG", "station": "GHCND:USW00013881", "value": 44.0},
                  {"date": "2024-01-01T00:00:00", "datatype": "PRCP", "station": "GHCND:USW00013881", "value": 3.2},
                  {"date": "2024-02-01T00:00:00", "datatype": "TAVG", "station": "GHCND:USW00013881", "value": 47.5}
                ]}
                """);

        // When
        var series = normalizer.normalize(body, query);

        // Then
        assertThat(series.label()).startsWith("Average temperature");
        assertThat(series.points()).containsExactly(
                new SeriesPoint("2024-01", 42.0),
                new SeriesPoint("2024-02", 47.5));
    }

    @Test
    void shouldReturnEmptySeriesWhenStationHasNoData() {
        var series = normalizer.normalize(json("{}"), query);

        assertThat(series.points()).isEmpty();
        assertThat(series.derived().latest()).isNull();
    }

    @Test
    void shouldFailOnUnexpectedShape() {
        assertThatThrownBy(() -> normalizer.normalize(json("{\"status\": \"400\", \"message\": \"bad\"}"), query))
                .isInstanceOf(NormalizationException.class);
    }
}

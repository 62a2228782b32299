package com.bristol.siteintel.infrastructure.adapter.normalizer;

import com.bristol.siteintel.domain.exception.NormalizationException;
import com.bristol.siteintel.domain.model.MetricQuery;
import com.bristol.siteintel.domain.model.SeriesPoint;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.bristol.siteintel.infrastructure.adapter.normalizer.NormalizerFixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrimeSeriesNormalizerTest {

    private final CrimeSeriesNormalizer normalizer = new CrimeSeriesNormalizer();

    private static MetricQuery query(String measure) {
        return new MetricQuery("fbi", Map.of(
                "state", "NC", "offense", "violent-crime", "measure", measure, "from", "2020", "to", "2022"));
    }

    private static final String BODY = """
            {"results": [
              {"year": 2022, "violent_crime": 41000, "violent_crime_rate": 380.2},
              {"data_year": 2021, "violent_crime": 43000, "violent_crime_rate": 402.5},
              {"year": 2020, "violent_crime": 40000, "violent_crime_rate": 385.0},
              {"year": 2019, "violent_crime": 39000, "violent_crime_rate": 375.0}
            ]}
            """;

    @Test
    void shouldSelectRateFieldWithinYearRange() {
        // When
        var series = normalizer.normalize(json(BODY), query("rate"));

        // Then
        assertThat(series.label()).isEqualTo("NC Violent Crime (rate per 100k)");
        assertThat(series.points()).containsExactly(
                new SeriesPoint("2020", 385.0),
                new SeriesPoint("2021", 402.5),
                new SeriesPoint("2022", 380.2));
    }

    @Test
    void shouldSelectCountField() {
        // When
        var series = normalizer.normalize(json(BODY), query("count"));

        // Then
        assertThat(series.points()).extracting(SeriesPoint::value).containsExactly(40000.0, 43000.0, 41000.0);
    }

    @Test
    void shouldFallBackToGenericRateField() {
        // Given
        var body = json("""
                {"results": [{"year": "2021", "rate": 12.5}, {"year": "2022", "rate": "13.0"}]}
                """);

        // When
        var series = normalizer.normalize(body, query("rate"));

        // Then
        assertThat(series.points()).extracting(SeriesPoint::value).containsExactly(12.5, 13.0);
    }

    @Test
    void shouldFailWithoutResults() {
        assertThatThrownBy(() -> normalizer.normalize(json("{\"error\": \"bad key\"}"), query("rate")))
                .isInstanceOf(NormalizationException.class);
    }
}

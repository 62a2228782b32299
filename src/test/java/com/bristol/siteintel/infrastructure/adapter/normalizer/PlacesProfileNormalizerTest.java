package com.bristol.siteintel.infrastructure.adapter.normalizer;

import com.bristol.siteintel.domain.exception.NormalizationException;
import com.bristol.siteintel.domain.model.CategoryCount;
import com.bristol.siteintel.domain.model.MetricQuery;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.bristol.siteintel.infrastructure.adapter.normalizer.NormalizerFixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlacesProfileNormalizerTest {

    private final PlacesProfileNormalizer normalizer = new PlacesProfileNormalizer();

    private final MetricQuery query = new MetricQuery("foursquare", Map.of("lat", "35.2", "lng", "-80.8"));

    @Test
    void shouldGroupByFirstCategoryAndWeightScore() {
        // Given
        var body = json("""
                {"results": [
                  {"name": "Harris Teeter", "distance": 300, "categories": [{"id": 17069, "name": "Grocery Store"}]},
                  {"name": "Food Lion", "distance": 900, "categories": [{"id": 17069, "name": "Grocery Store"}]},
                  {"name": "Not Just Coffee", "distance": 120, "categories": [{"id": 13032, "name": "Cafe"}, {"id": 13000, "name": "Restaurant"}]},
                  {"name": "Bookshop", "categories": [{"id": 17018, "name": "Bookstore"}]}
                ]}
                """);

        // When
        var profile = normalizer.normalize(body, query);

        // Then
        assertThat(profile.totalPlaces()).isEqualTo(4);
        assertThat(profile.categories()).extracting(CategoryCount::id).containsExactly("17069", "13032", "17018");
        assertThat(profile.categories().get(0).count()).isEqualTo(2);
        // 2 x 2.0 + 1 x 1.5 + 1 x 0.5
        assertThat(profile.amenityScore()).isEqualTo(6.0);
        assertThat(profile.places()).hasSize(4);
        assertThat(profile.places().get(3).distanceMeters()).isNull();
    }

    @Test
    void shouldRoundScoreToOneDecimal() {
        // Given
        var body = json("""
                {"results": [
                  {"name": "a", "categories": [{"id": 13003, "name": "Bar"}]},
                  {"name": "b", "categories": [{"id": 13003, "name": "Bar"}]},
                  {"name": "c", "categories": [{"id": 13003, "name": "Bar"}]}
                ]}
                """);

        // When
        var profile = normalizer.normalize(body, query);

        // Then
        assertThat(profile.amenityScore()).isEqualTo(2.4);
    }

    @Test
    void shouldCapSamplePlaces() {
        // Given
        var results = new StringBuilder("{\"results\": [");
        for (int i = 0; i < 60; i++) {
            results.append(i == 0 ? "" : ",").append("{\"name\": \"p").append(i).append("\", \"categories\": []}");
        }
        results.append("]}");

        // When
        var profile = normalizer.normalize(json(results.toString()), query);

        // Then
        assertThat(profile.totalPlaces()).isEqualTo(60);
        assertThat(profile.places()).hasSize(50);
        assertThat(profile.categories()).singleElement()
                .satisfies(category -> assertThat(category.count()).isEqualTo(60));
    }

    @Test
    void shouldFailWithoutResults() {
        assertThatThrownBy(() -> normalizer.normalize(json("{\"message\": \"Invalid auth\"}"), query))
                .isInstanceOf(NormalizationException.class);
    }
}

package com.bristol.siteintel.infrastructure.adapter.normalizer;

import com.bristol.siteintel.domain.exception.NormalizationException;
import com.bristol.siteintel.domain.model.AmenityCategories;
import com.bristol.siteintel.domain.model.AmenityProfile;
import com.bristol.siteintel.domain.model.CategoryCount;
import com.bristol.siteintel.domain.model.MetricQuery;
import com.bristol.siteintel.domain.model.PlaceSummary;
import com.bristol.siteintel.domain.model.UpstreamFamily;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Foursquare place search: {@code {"results": [{"name": "...", "distance": 120, "categories": [{"id": 13032, "name": "Cafe"}]}]}}.
 * Places are grouped by their first category.
 */
@Component
public class PlacesProfileNormalizer implements PayloadNormalizer<AmenityProfile> {

    private static final String UNCATEGORIZED_ID = "0";
    private static final String UNCATEGORIZED_NAME = "Uncategorized";

    @Override
    public UpstreamFamily family() {
        return UpstreamFamily.PLACES;
    }

    @Override
    public AmenityProfile normalize(JsonNode body, MetricQuery query) {
        var results = body.path("results");
        if (!results.isArray()) {
            throw new NormalizationException(query.upstreamId(), "Foursquare response has no results array");
        }

        Map<String, String> names = new LinkedHashMap<>();
        Map<String, Integer> counts = new LinkedHashMap<>();
        List<PlaceSummary> places = new ArrayList<>();
        for (var place : results) {
            var category = place.path("categories").path(0);
            var categoryId = category.isMissingNode() ? UNCATEGORIZED_ID : category.path("id").asText(UNCATEGORIZED_ID);
            var categoryName = category.isMissingNode() ? UNCATEGORIZED_NAME : category.path("name").asText(UNCATEGORIZED_NAME);
            names.putIfAbsent(categoryId, categoryName);
            counts.merge(categoryId, 1, Integer::sum);

            if (places.size() < AmenityProfile.MAX_PLACES) {
                var distance = place.path("distance");
                places.add(new PlaceSummary(
                        place.path("name").asText(""),
                        categoryId,
                        categoryName,
                        distance.isNumber() ? distance.intValue() : null));
            }
        }

        var categories = new ArrayList<CategoryCount>();
        counts.forEach((id, count) -> categories.add(
                new CategoryCount(id, names.get(id), count, AmenityCategories.weightOf(id))));
        categories.sort(Comparator.comparingInt(CategoryCount::count).reversed()
                .thenComparing(CategoryCount::id));

        double score = categories.stream().mapToDouble(CategoryCount::weightedScore).sum();
        return new AmenityProfile(categories, Math.round(score * 10.0) / 10.0, results.size(), places);
    }
}

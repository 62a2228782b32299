package com.bristol.siteintel.domain.model;

import java.util.List;

/**
 * Points-of-interest summary around a location. Categories are ordered by count, highest first.
 */
public record AmenityProfile(
        List<CategoryCount> categories,
        double amenityScore,
        int totalPlaces,
        List<PlaceSummary> places
) implements MetricPayload {

    public static final int MAX_PLACES = 50;

    public AmenityProfile {
        categories = List.copyOf(categories);
        places = List.copyOf(places);
        if (places.size() > MAX_PLACES) {
            throw new IllegalArgumentException("At most " + MAX_PLACES + " places are kept, got " + places.size());
        }
    }
}

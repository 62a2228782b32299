package com.bristol.siteintel.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Foursquare category ids that count towards the amenity score, with their weights.
 */
public final class AmenityCategories {

    public static final double DEFAULT_WEIGHT = 0.5;

    private static final Map<String, Double> WEIGHTS;

    static {
        var weights = new LinkedHashMap<String, Double>();
        weights.put("17069", 2.0);  // grocery
        weights.put("13032", 1.5);  // coffee
        weights.put("13000", 1.0);  // restaurants
        weights.put("13003", 0.8);  // bars
        weights.put("18021", 1.5);  // gym
        weights.put("16032", 1.2);  // park
        weights.put("17014", 1.2);  // pharmacy
        weights.put("19046", 1.3);  // transit
        WEIGHTS = Collections.unmodifiableMap(weights);
    }

    private AmenityCategories() {
    }

    public static double weightOf(String categoryId) {
        return WEIGHTS.getOrDefault(categoryId, DEFAULT_WEIGHT);
    }

    /**
     * Comma-separated ids of the weighted categories, the default search filter.
     */
    public static String defaultSearchCategories() {
        return String.join(",", WEIGHTS.keySet());
    }
}

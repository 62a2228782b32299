package com.bristol.siteintel.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A labelled time series with strictly ascending period keys. Derived metrics are computed
 * from the points on every read.
 */
public record NormalizedSeries(String label, List<SeriesPoint> points) implements MetricPayload {

    public NormalizedSeries {
        Objects.requireNonNull(label, "label");
        points = List.copyOf(points);
        for (int i = 0; i < points.size(); i++) {
            var key = points.get(i).periodKey();
            if (!PeriodKeys.isValid(key)) {
                throw new IllegalArgumentException("Invalid period key: " + key);
            }
            if (i > 0 && points.get(i - 1).periodKey().compareTo(key) >= 0) {
                throw new IllegalArgumentException(
                        "Points must be strictly ascending by period key, found " + points.get(i - 1).periodKey()
                                + " before " + key);
            }
        }
    }

    public static NormalizedSeries empty(String label) {
        return new NormalizedSeries(label, List.of());
    }

    @JsonProperty("derived")
    public DerivedMetrics derived() {
        return SeriesMetrics.derive(points);
    }
}

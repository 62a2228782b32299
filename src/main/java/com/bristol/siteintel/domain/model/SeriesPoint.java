package com.bristol.siteintel.domain.model;

import java.util.Objects;

/**
 * One observation of a series. A null value marks a period the upstream reported without data.
 */
public record SeriesPoint(String periodKey, Double value) {

    public SeriesPoint {
        Objects.requireNonNull(periodKey, "periodKey");
    }

    public boolean hasValue() {
        return value != null;
    }
}

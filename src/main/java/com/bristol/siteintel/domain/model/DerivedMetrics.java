package com.bristol.siteintel.domain.model;

public record DerivedMetrics(
        Double latest,
        Double changeAbsolute,
        Double changePercent,
        Double cagr
) {
    public static final DerivedMetrics EMPTY = new DerivedMetrics(null, null, null, null);
}

package com.bristol.siteintel.domain.model;

import java.util.List;

/**
 * Derived metrics over an ascending series. Endpoints are taken positionally: a null endpoint
 * nulls every metric that depends on it rather than falling back to a neighbouring point.
 */
public final class SeriesMetrics {

    private SeriesMetrics() {
    }

    public static DerivedMetrics derive(List<SeriesPoint> points) {
        long withValue = points.stream().filter(SeriesPoint::hasValue).count();
        if (withValue < 2) {
            return DerivedMetrics.EMPTY;
        }

        var first = points.get(0);
        var prior = points.get(points.size() - 2);
        var last = points.get(points.size() - 1);

        Double latest = last.value();
        Double changeAbsolute = latest != null && prior.hasValue() ? latest - prior.value() : null;
        Double changePercent = changeAbsolute != null && prior.value() != 0.0
                ? changeAbsolute / prior.value() * 100.0
                : null;

        return new DerivedMetrics(latest, changeAbsolute, changePercent, cagr(first, last));
    }

    static Double cagr(SeriesPoint first, SeriesPoint last) {
        if (!first.hasValue() || !last.hasValue() || first.value() <= 0 || last.value() <= 0) {
            return null;
        }
        double years = PeriodKeys.toFractionalYear(last.periodKey()) - PeriodKeys.toFractionalYear(first.periodKey());
        if (years <= 0) {
            return null;
        }
        return (Math.pow(last.value() / first.value(), 1.0 / years) - 1.0) * 100.0;
    }
}

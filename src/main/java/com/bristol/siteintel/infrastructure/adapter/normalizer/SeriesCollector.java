package com.bristol.siteintel.infrastructure.adapter.normalizer;

import com.bristol.siteintel.domain.model.NormalizedSeries;
import com.bristol.siteintel.domain.model.SeriesPoint;

import java.util.ArrayList;
import java.util.Map;
import java.util.TreeMap;

/**
 * Gathers points in any order and emits them sorted by period key. The first value seen for a period wins.
 */
class SeriesCollector {

    private final Map<String, Double> values = new TreeMap<>();

    void add(String periodKey, Double value) {
        if (!values.containsKey(periodKey)) {
            values.put(periodKey, value);
        }
    }

    NormalizedSeries toSeries(String label) {
        var points = new ArrayList<SeriesPoint>(values.size());
        values.forEach((period, value) -> points.add(new SeriesPoint(period, value)));
        return new NormalizedSeries(label, points);
    }

    /**
     * Keeps only the most recent periods.
     */
    NormalizedSeries toSeries(String label, int lastPeriods) {
        var all = toSeries(label).points();
        int from = Math.max(0, all.size() - lastPeriods);
        return new NormalizedSeries(label, all.subList(from, all.size()));
    }
}

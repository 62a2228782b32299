package com.bristol.siteintel.infrastructure.adapter.normalizer;

import com.bristol.siteintel.domain.exception.NormalizationException;
import com.bristol.siteintel.domain.model.MetricQuery;
import com.bristol.siteintel.domain.model.NormalizedSeries;
import com.bristol.siteintel.domain.model.PeriodKeys;
import com.bristol.siteintel.domain.model.UpstreamFamily;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

/**
 * HUD USPS vacancy data: {@code {"data": [{"year": 2024, "quarter": 1, "total": 1200, "vacant": 36}]}},
 * sometimes nested as {@code data.results}.
 */
@Component
public class HousingSeriesNormalizer implements PayloadNormalizer<NormalizedSeries> {

    @Override
    public UpstreamFamily family() {
        return UpstreamFamily.HOUSING;
    }

    @Override
    public NormalizedSeries normalize(JsonNode body, MetricQuery query) {
        var data = body.path("data");
        if (data.isObject()) {
            data = data.path("results");
        }
        if (!data.isArray()) {
            throw new NormalizationException(query.upstreamId(), "HUD response has no data array");
        }

        var collector = new SeriesCollector();
        for (var row : data) {
            var year = NumericValues.parse(row.path("year"));
            var quarter = NumericValues.parse(row.path("quarter"));
            if (year == null || quarter == null || quarter < 1 || quarter > 4) {
                continue;
            }
            collector.add(PeriodKeys.quarterly(year.intValue(), quarter.intValue()),
                    vacancyRate(NumericValues.parse(row.path("total")), NumericValues.parse(row.path("vacant"))));
        }
        return collector.toSeries("USPS vacancy rate (%) for ZIP " + query.param("zip"),
                query.intParam("lookbackQuarters"));
    }

    static Double vacancyRate(Double total, Double vacant) {
        if (total == null || vacant == null || total <= 0) {
            return null;
        }
        return vacant / total * 100.0;
    }
}

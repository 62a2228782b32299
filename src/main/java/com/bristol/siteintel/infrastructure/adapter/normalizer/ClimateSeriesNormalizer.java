package com.bristol.siteintel.infrastructure.adapter.normalizer;

import com.bristol.siteintel.domain.exception.NormalizationException;
import com.bristol.siteintel.domain.model.MetricQuery;
import com.bristol.siteintel.domain.model.NormalizedSeries;
import com.bristol.siteintel.domain.model.UpstreamFamily;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * NOAA CDO data: {@code {"results": [{"date": "2024-01-01T00:00:00", "datatype": "TAVG", "value": 44.1}]}}.
 * Several observations in one month are averaged. CDO answers {@code {}} when a station has no data.
 */
@Component
public class ClimateSeriesNormalizer implements PayloadNormalizer<NormalizedSeries> {

    private static final Pattern YEAR_MONTH = Pattern.compile("^(\\d{4}-\\d{2})");

    private static final Map<String, String> LABELS = Map.of(
            "TAVG", "Average temperature (F)",
            "TMAX", "Average daily maximum temperature (F)",
            "TMIN", "Average daily minimum temperature (F)",
            "PRCP", "Precipitation (in)",
            "SNOW", "Snowfall (in)");

    @Override
    public UpstreamFamily family() {
        return UpstreamFamily.CLIMATE;
    }

    @Override
    public NormalizedSeries normalize(JsonNode body, MetricQuery query) {
        var dataType = query.param("datatype");
        var label = LABELS.getOrDefault(dataType, dataType) + " at " + query.param("station");
        if (body.isObject() && body.isEmpty()) {
            return NormalizedSeries.empty(label);
        }
        var results = body.path("results");
        if (!results.isArray()) {
            throw new NormalizationException(query.upstreamId(), "NOAA response has no results array");
        }

        var monthly = new TreeMap<String, MonthlyAverage>();
        for (var row : results) {
            if (!dataType.equals(row.path("datatype").asText())) {
                continue;
            }
            var month = YEAR_MONTH.matcher(row.path("date").asText());
            if (!month.find()) {
                continue;
            }
            monthly.computeIfAbsent(month.group(1), key -> new MonthlyAverage())
                    .add(NumericValues.parse(row.path("value")));
        }

        var collector = new SeriesCollector();
        monthly.forEach((month, average) -> collector.add(month, average.value()));
        return collector.toSeries(label);
    }

    private static final class MonthlyAverage {
        private double sum;
        private int count;

        void add(Double value) {
            if (value != null) {
                sum += value;
                count++;
            }
        }

        Double value() {
            return count == 0 ? null : sum / count;
        }
    }
}

package com.bristol.siteintel.infrastructure.adapter.normalizer;

import com.bristol.siteintel.domain.exception.NormalizationException;
import com.bristol.siteintel.domain.model.MetricQuery;
import com.bristol.siteintel.domain.model.NormalizedSeries;
import com.bristol.siteintel.domain.model.PeriodKeys;
import com.bristol.siteintel.domain.model.UpstreamFamily;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * FBI CDE state estimates: {@code {"results": [{"year": 2022, "violent_crime": 41000, "violent_crime_rate": 380.2}]}}.
 */
@Component
public class CrimeSeriesNormalizer implements PayloadNormalizer<NormalizedSeries> {

    @Override
    public UpstreamFamily family() {
        return UpstreamFamily.CRIME;
    }

    @Override
    public NormalizedSeries normalize(JsonNode body, MetricQuery query) {
        var results = body.path("results");
        if (!results.isArray()) {
            throw new NormalizationException(query.upstreamId(), "FBI response has no results array");
        }

        var offenseField = query.param("offense").replace('-', '_');
        boolean rate = "rate".equals(query.param("measure"));
        var valueField = rate ? offenseField + "_rate" : offenseField;
        var fallbackField = rate ? "rate" : "actual";
        int from = query.intParam("from");
        int to = query.intParam("to");

        var collector = new SeriesCollector();
        for (var row : results) {
            var yearNode = row.has("year") ? row.path("year") : row.path("data_year");
            var year = NumericValues.parse(yearNode);
            if (year == null || year < from || year > to) {
                continue;
            }
            var valueNode = row.has(valueField) ? row.path(valueField) : row.path(fallbackField);
            collector.add(PeriodKeys.annual(year.intValue()), NumericValues.parse(valueNode));
        }
        return collector.toSeries(label(query));
    }

    private static String label(MetricQuery query) {
        var words = query.param("offense").split("-");
        var offense = new StringBuilder();
        for (var word : words) {
            if (offense.length() > 0) {
                offense.append(' ');
            }
            offense.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1));
        }
        var measure = "rate".equals(query.param("measure")) ? "rate per 100k" : "count";
        return query.param("state") + " " + offense + " (" + measure + ")";
    }
}

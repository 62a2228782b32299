package com.bristol.siteintel.infrastructure.adapter.normalizer;

import com.bristol.siteintel.domain.exception.NormalizationException;
import com.bristol.siteintel.domain.model.MetricQuery;
import com.bristol.siteintel.domain.model.NormalizedSeries;
import com.bristol.siteintel.domain.model.UpstreamFamily;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Census timeseries tables: a JSON array of rows whose first row is the header, e.g.
 * {@code [["SAEMHI_PT","NAME","time","state"],["65000","North Carolina","2021","37"]]}.
 * Census returns an empty body (HTTP 204) when nothing matches.
 */
@Component
public class DemographicsSeriesNormalizer implements PayloadNormalizer<NormalizedSeries> {

    /** Census annotation codes are large negative numbers, e.g. -666666666 */
    private static final double ANNOTATION_THRESHOLD = -100_000_000;

    private static final Pattern YEAR = Pattern.compile("^\\d{4}");

    private static final Map<String, String> LABELS = Map.of(
            "SAEMHI_PT", "Median household income ($)",
            "SAEPOVRTALL_PT", "Poverty rate, all ages (%)",
            "SAEPOVALL_PT", "People in poverty, all ages",
            "SAEPOVRT0_17_PT", "Poverty rate, under 18 (%)");

    @Override
    public UpstreamFamily family() {
        return UpstreamFamily.DEMOGRAPHICS;
    }

    @Override
    public NormalizedSeries normalize(JsonNode body, MetricQuery query) {
        var variable = query.param("variable");
        var label = LABELS.getOrDefault(variable, variable);
        if (body.isMissingNode()) {
            return NormalizedSeries.empty(label);
        }
        if (!body.isArray() || body.isEmpty() || !body.get(0).isArray()) {
            throw new NormalizationException(query.upstreamId(), "Census response is not a table with a header row");
        }

        var header = body.get(0);
        int valueColumn = columnOf(header, variable);
        int timeColumn = columnOf(header, "time");
        if (timeColumn < 0) {
            timeColumn = columnOf(header, "YEAR");
        }
        if (valueColumn < 0 || timeColumn < 0) {
            throw new NormalizationException(query.upstreamId(),
                    "Census header lacks the '" + variable + "' or time column: " + header);
        }

        int from = query.intParam("from");
        int to = query.intParam("to");
        var collector = new SeriesCollector();
        for (int i = 1; i < body.size(); i++) {
            var row = body.get(i);
            var year = YEAR.matcher(row.path(timeColumn).asText());
            if (!year.find()) {
                continue;
            }
            int yearValue = Integer.parseInt(year.group());
            if (yearValue < from || yearValue > to) {
                continue;
            }
            collector.add(year.group(), withoutAnnotation(NumericValues.parse(row.path(valueColumn))));
        }
        return collector.toSeries(label);
    }

    private static int columnOf(JsonNode header, String name) {
        for (int i = 0; i < header.size(); i++) {
            if (name.equalsIgnoreCase(header.get(i).asText())) {
                return i;
            }
        }
        return -1;
    }

    private static Double withoutAnnotation(Double value) {
        return value != null && value <= ANNOTATION_THRESHOLD ? null : value;
    }
}

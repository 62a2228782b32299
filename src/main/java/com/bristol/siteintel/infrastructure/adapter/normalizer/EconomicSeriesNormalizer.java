package com.bristol.siteintel.infrastructure.adapter.normalizer;

import com.bristol.siteintel.domain.exception.NormalizationException;
import com.bristol.siteintel.domain.model.MetricQuery;
import com.bristol.siteintel.domain.model.NormalizedSeries;
import com.bristol.siteintel.domain.model.UpstreamFamily;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * BEA Regional responses: {@code {"BEAAPI": {"Results": {"Data": [{"TimePeriod": "2022", "DataValue": "1,234"}]}}}}.
 * Errors arrive with HTTP 200 as {@code BEAAPI.Error} or {@code BEAAPI.Results.Error}.
 */
@Component
public class EconomicSeriesNormalizer implements PayloadNormalizer<NormalizedSeries> {

    static final String MSA_LABEL = "MSA Real GDP (chained $)";
    static final String COUNTY_LABEL = "County Personal Income ($)";

    private static final Pattern YEAR = Pattern.compile("^\\d{4}");

    @Override
    public UpstreamFamily family() {
        return UpstreamFamily.ECONOMIC;
    }

    @Override
    public NormalizedSeries normalize(JsonNode body, MetricQuery query) {
        var api = body.path("BEAAPI");
        if (api.isMissingNode()) {
            throw new NormalizationException(query.upstreamId(), "BEA response has no BEAAPI object");
        }
        var results = api.path("Results");
        if (results.isArray()) {
            results = results.path(0);
        }
        var error = api.has("Error") ? api.path("Error") : results.path("Error");
        if (!error.isMissingNode()) {
            throw new NormalizationException(query.upstreamId(), "BEA reported an error: " + describe(error));
        }
        var data = results.path("Data");
        if (!data.isArray()) {
            throw new NormalizationException(query.upstreamId(), "BEA response has no Results.Data array");
        }

        var collector = new SeriesCollector();
        for (var row : data) {
            var period = row.has("TimePeriod") ? row.path("TimePeriod").asText() : row.path("Year").asText();
            var year = YEAR.matcher(period);
            if (!year.find()) {
                continue;
            }
            collector.add(year.group(), NumericValues.parse(row.path("DataValue")));
        }
        return collector.toSeries("county".equals(query.param("geo")) ? COUNTY_LABEL : MSA_LABEL);
    }

    private static String describe(JsonNode error) {
        var detail = error.path("APIErrorDescription");
        if (detail.isTextual()) {
            return detail.asText();
        }
        return error.toString();
    }
}

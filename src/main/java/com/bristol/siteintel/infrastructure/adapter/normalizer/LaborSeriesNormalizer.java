package com.bristol.siteintel.infrastructure.adapter.normalizer;

import com.bristol.siteintel.domain.exception.NormalizationException;
import com.bristol.siteintel.domain.model.MetricQuery;
import com.bristol.siteintel.domain.model.NormalizedSeries;
import com.bristol.siteintel.domain.model.UpstreamFamily;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.regex.Pattern;

/**
 * BLS LAUS responses:
 * <pre>{@code
 * {"status": "REQUEST_SUCCEEDED", "message": [],
 *  "Results": {"series": [{"seriesID": "...", "data": [{"year": "2024", "period": "M03", "value": "3.8"}]}]}}
 * }</pre>
 * Only monthly periods are kept; {@code M13} is the annual average.
 */
@Component
public class LaborSeriesNormalizer implements PayloadNormalizer<NormalizedSeries> {

    static final String LABEL = "Unemployment rate (%)";

    private static final String STATUS_FAILED = "REQUEST_FAILED";
    private static final Pattern MONTHLY_PERIOD = Pattern.compile("^M(0[1-9]|1[0-2])$");
    private static final Pattern YEAR = Pattern.compile("^\\d{4}$");

    @Override
    public UpstreamFamily family() {
        return UpstreamFamily.LABOR;
    }

    @Override
    public NormalizedSeries normalize(JsonNode body, MetricQuery query) {
        if (STATUS_FAILED.equals(body.path("status").asText())) {
            throw new NormalizationException(query.upstreamId(), "BLS request failed: " + messages(body));
        }
        var series = body.path("Results").path("series");
        if (!series.isArray()) {
            throw new NormalizationException(query.upstreamId(), "BLS response has no Results.series array");
        }
        if (series.isEmpty()) {
            return NormalizedSeries.empty(LABEL);
        }
        var data = series.get(0).path("data");
        if (!data.isArray()) {
            throw new NormalizationException(query.upstreamId(), "BLS series has no data array");
        }

        var start = query.param("start");
        var end = query.param("end");
        var collector = new SeriesCollector();
        for (var observation : data) {
            var period = observation.path("period").asText();
            var year = observation.path("year").asText();
            if (!MONTHLY_PERIOD.matcher(period).matches() || !YEAR.matcher(year).matches()) {
                continue;
            }
            var periodKey = year + "-" + period.substring(1);
            if ((start != null && periodKey.compareTo(start) < 0) || (end != null && periodKey.compareTo(end) > 0)) {
                continue;
            }
            collector.add(periodKey, NumericValues.parse(observation.path("value")));
        }
        return collector.toSeries(LABEL);
    }

    private static String messages(JsonNode body) {
        var messages = new ArrayList<String>();
        body.path("message").forEach(message -> messages.add(message.asText()));
        return messages.isEmpty() ? "no message" : String.join("; ", messages);
    }
}

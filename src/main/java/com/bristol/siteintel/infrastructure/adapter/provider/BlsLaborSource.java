package com.bristol.siteintel.infrastructure.adapter.provider;

import com.bristol.siteintel.domain.model.MetricQuery;
import com.bristol.siteintel.domain.model.UpstreamFamily;
import com.bristol.siteintel.infrastructure.config.UpstreamProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * County unemployment rate from the BLS Local Area Unemployment Statistics.
 */
@Component
public class BlsLaborSource extends AbstractUpstreamSource {

    public static final String ID = "bls";

    private static final Pattern YEAR_MONTH = Pattern.compile("^\\d{4}-(0[1-9]|1[0-2])$");

    private final BlsApi api;
    private final String apiKey;

    public BlsLaborSource(BlsApi api, UpstreamProperties properties) {
        super(ID, UpstreamFamily.LABOR);
        this.api = api;
        this.apiKey = properties.instance(ID).getApiKey();
    }

    @Override
    public MetricQuery resolveQuery(Map<String, String> params) {
        var state = fipsCode(required(params, "state"), "state", 2);
        var county = fipsCode(required(params, "county"), "county", 3);
        var start = yearMonth(optional(params, "start", "2020-01"), "start");
        var end = yearMonth(optional(params, "end", "2025-12"), "end");
        if (start.compareTo(end) > 0) {
            throw invalid("Parameter 'start' must not be after 'end'");
        }
        return query(Map.of("state", state, "county", county, "start", start, "end", end));
    }

    @Override
    public CompletableFuture<String> fetch(MetricQuery query) {
        var request = new BlsApi.TimeseriesRequest(
                List.of(seriesId(query.param("state"), query.param("county"))),
                query.param("start").substring(0, 4),
                query.param("end").substring(0, 4),
                apiKey == null || apiKey.isBlank() ? null : apiKey);
        return RetrofitCalls.bodyOf(api.fetchTimeseries(request));
    }

    static String seriesId(String state, String county) {
        return "LAUCN" + state + county + "0000000003";
    }

    private String yearMonth(String value, String name) {
        if (!YEAR_MONTH.matcher(value).matches()) {
            throw invalid("Parameter '" + name + "' must be formatted YYYY-MM, got '" + value + "'");
        }
        return value;
    }
}

package com.bristol.siteintel.infrastructure.adapter.provider;

import com.bristol.siteintel.domain.model.MetricQuery;
import com.bristol.siteintel.domain.model.UpstreamFamily;
import com.bristol.siteintel.infrastructure.config.UpstreamProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * Small Area Income and Poverty Estimates from the Census timeseries API, by state or county.
 */
@Component
public class CensusDemographicsSource extends AbstractUpstreamSource {

    public static final String ID = "census";

    private static final Pattern VARIABLE = Pattern.compile("^[A-Z0-9_]+$");

    private final CensusSaipeApi api;
    private final String apiKey;

    public CensusDemographicsSource(CensusSaipeApi api, UpstreamProperties properties) {
        super(ID, UpstreamFamily.DEMOGRAPHICS);
        this.api = api;
        this.apiKey = properties.instance(ID).getApiKey();
    }

    @Override
    public MetricQuery resolveQuery(Map<String, String> params) {
        var resolved = new LinkedHashMap<String, String>();
        resolved.put("state", fipsCode(required(params, "state"), "state", 2));
        var county = optional(params, "county", null);
        if (county != null) {
            resolved.put("county", fipsCode(county, "county", 3));
        }
        var variable = optional(params, "variable", "SAEMHI_PT").toUpperCase(Locale.ROOT);
        if (!VARIABLE.matcher(variable).matches()) {
            throw invalid("Parameter 'variable' is not a Census variable name: '" + variable + "'");
        }
        resolved.put("variable", variable);
        int from = year(optional(params, "from", "2015"), "from");
        int to = year(optional(params, "to", "2022"), "to");
        requireOrdered(from, to, "from", "to");
        resolved.put("from", String.valueOf(from));
        resolved.put("to", String.valueOf(to));
        return query(resolved);
    }

    @Override
    public CompletableFuture<String> fetch(MetricQuery query) {
        var county = query.param("county");
        var forGeography = county != null ? "county:" + county : "state:" + query.param("state");
        var inGeography = county != null ? "state:" + query.param("state") : null;
        var time = "from " + query.param("from") + " to " + query.param("to");
        var key = apiKey == null || apiKey.isBlank() ? null : apiKey;
        return RetrofitCalls.bodyOf(api.estimates(
                query.param("variable") + ",NAME", forGeography, inGeography, time, key));
    }
}

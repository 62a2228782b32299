package com.bristol.siteintel.infrastructure.adapter.provider;

import com.bristol.siteintel.domain.model.MetricQuery;
import com.bristol.siteintel.domain.model.UpstreamFamily;
import com.bristol.siteintel.infrastructure.config.UpstreamProperties;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * State-level crime estimates from the FBI Crime Data Explorer.
 */
@Component
public class FbiCrimeSource extends AbstractUpstreamSource {

    public static final String ID = "fbi";

    private static final Pattern STATE = Pattern.compile("^[A-Z]{2}$");
    private static final Pattern OFFENSE = Pattern.compile("^[a-z]+(-[a-z]+)*$");

    private final FbiCrimeApi api;
    private final String apiKey;

    public FbiCrimeSource(FbiCrimeApi api, UpstreamProperties properties) {
        super(ID, UpstreamFamily.CRIME);
        this.api = api;
        this.apiKey = properties.instance(ID).getApiKey();
    }

    @Override
    public MetricQuery resolveQuery(Map<String, String> params) {
        var state = required(params, "state").toUpperCase(Locale.ROOT);
        if (!STATE.matcher(state).matches()) {
            throw invalid("Parameter 'state' must be a two-letter postal code, got '" + state + "'");
        }
        var offense = optional(params, "offense", "violent-crime").toLowerCase(Locale.ROOT);
        if (!OFFENSE.matcher(offense).matches()) {
            throw invalid("Parameter 'offense' must be a hyphenated offense name, got '" + offense + "'");
        }
        var measure = oneOf(optional(params, "measure", "rate"), "measure", "count", "rate");
        int from = year(optional(params, "from", "2014"), "from");
        int to = year(optional(params, "to", "2023"), "to");
        requireOrdered(from, to, "from", "to");
        return query(Map.of(
                "state", state,
                "offense", offense,
                "measure", measure,
                "from", String.valueOf(from),
                "to", String.valueOf(to)));
    }

    @Override
    public CompletableFuture<String> fetch(MetricQuery query) {
        return RetrofitCalls.bodyOf(api.stateEstimates(
                query.param("state"), query.intParam("from"), query.intParam("to"), apiKey));
    }
}

package com.bristol.siteintel.infrastructure.adapter.provider;

import com.bristol.siteintel.domain.model.MetricQuery;
import com.bristol.siteintel.domain.model.UpstreamFamily;
import com.bristol.siteintel.infrastructure.config.UpstreamProperties;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * Quarterly USPS address vacancy counts for a ZIP code from HUD.
 */
@Component
public class HudHousingSource extends AbstractUpstreamSource {

    public static final String ID = "hud";

    private static final Pattern ZIP = Pattern.compile("^\\d{5}$");
    private static final int MAX_LOOKBACK_QUARTERS = 40;

    private final HudUspsApi api;
    private final String token;

    public HudHousingSource(HudUspsApi api, UpstreamProperties properties) {
        super(ID, UpstreamFamily.HOUSING);
        this.api = api;
        this.token = properties.instance(ID).getApiKey();
    }

    @Override
    public MetricQuery resolveQuery(Map<String, String> params) {
        var zip = required(params, "zip");
        if (!ZIP.matcher(zip).matches()) {
            throw invalid("Parameter 'zip' must be a 5-digit ZIP code, got '" + zip + "'");
        }
        int lookback = positiveInt(optional(params, "lookbackQuarters", "8"), "lookbackQuarters", MAX_LOOKBACK_QUARTERS);
        return query(Map.of("zip", zip, "lookbackQuarters", String.valueOf(lookback)));
    }

    @Override
    public CompletableFuture<String> fetch(MetricQuery query) {
        var authorization = token == null || token.isBlank() ? null : "Bearer " + token;
        return RetrofitCalls.bodyOf(api.vacancy(authorization, 3, query.param("zip"), 0));
    }
}

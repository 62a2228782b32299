package com.bristol.siteintel.infrastructure.adapter.provider;

import com.bristol.siteintel.domain.model.MetricQuery;
import com.bristol.siteintel.domain.model.UpstreamFamily;
import com.bristol.siteintel.infrastructure.config.UpstreamProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Regional economic accounts from BEA: real GDP for a metro area or personal income for a county.
 */
@Component
public class BeaEconomicSource extends AbstractUpstreamSource {

    public static final String ID = "bea";

    static final String GEO_MSA = "msa";
    static final String GEO_COUNTY = "county";

    private final BeaRegionalApi api;
    private final String apiKey;
    private final Clock clock;

    public BeaEconomicSource(BeaRegionalApi api, UpstreamProperties properties, Clock clock) {
        super(ID, UpstreamFamily.ECONOMIC);
        this.api = api;
        this.apiKey = properties.instance(ID).getApiKey();
        this.clock = clock;
    }

    @Override
    public MetricQuery resolveQuery(Map<String, String> params) {
        var geo = oneOf(optional(params, "geo", GEO_MSA), "geo", GEO_MSA, GEO_COUNTY);
        int startYear = year(optional(params, "startYear", "2015"), "startYear");
        int endYear = year(optional(params, "endYear", String.valueOf(LocalDate.now(clock).getYear())), "endYear");
        requireOrdered(startYear, endYear, "startYear", "endYear");

        var resolved = new LinkedHashMap<String, String>();
        resolved.put("geo", geo);
        resolved.put("startYear", String.valueOf(startYear));
        resolved.put("endYear", String.valueOf(endYear));
        if (GEO_MSA.equals(geo)) {
            resolved.put("msa", fipsCode(required(params, "msa"), "msa", 5));
        } else {
            resolved.put("state", fipsCode(required(params, "state"), "state", 2));
            resolved.put("county", fipsCode(required(params, "county"), "county", 3));
        }
        return query(resolved);
    }

    @Override
    public CompletableFuture<String> fetch(MetricQuery query) {
        var params = new LinkedHashMap<String, String>();
        if (apiKey != null && !apiKey.isBlank()) {
            params.put("UserID", apiKey);
        }
        params.put("Method", "GetData");
        params.put("DataSetName", "Regional");
        params.put("LineCode", "1");
        if (GEO_MSA.equals(query.param("geo"))) {
            params.put("TableName", "CAGDP2");
            params.put("GeoFIPS", "MSA" + query.param("msa"));
        } else {
            params.put("TableName", "CAINC1");
            params.put("GeoFIPS", query.param("state") + query.param("county"));
        }
        params.put("Year", query.param("startYear") + "-" + query.param("endYear"));
        params.put("ResultFormat", "JSON");
        return RetrofitCalls.bodyOf(api.regionalData(params));
    }
}

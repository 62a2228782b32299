package com.bristol.siteintel.infrastructure.adapter.provider;

import com.bristol.siteintel.domain.model.AmenityCategories;
import com.bristol.siteintel.domain.model.MetricQuery;
import com.bristol.siteintel.domain.model.UpstreamFamily;
import com.bristol.siteintel.infrastructure.config.UpstreamProperties;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * Nearby points of interest from the Foursquare Places API.
 */
@Component
public class FoursquarePlacesSource extends AbstractUpstreamSource {

    public static final String ID = "foursquare";

    private static final Pattern CATEGORY_LIST = Pattern.compile("^\\d+(,\\d+)*$");
    private static final int MAX_RADIUS_METERS = 100_000;
    private static final int MAX_LIMIT = 50;

    private final FoursquarePlacesApi api;
    private final String apiKey;

    public FoursquarePlacesSource(FoursquarePlacesApi api, UpstreamProperties properties) {
        super(ID, UpstreamFamily.PLACES);
        this.api = api;
        this.apiKey = properties.instance(ID).getApiKey();
    }

    @Override
    public MetricQuery resolveQuery(Map<String, String> params) {
        double lat = decimal(required(params, "lat"), "lat", -90, 90);
        double lng = decimal(required(params, "lng"), "lng", -180, 180);
        int radius = positiveInt(optional(params, "radius", "1600"), "radius", MAX_RADIUS_METERS);
        int limit = positiveInt(optional(params, "limit", String.valueOf(MAX_LIMIT)), "limit", MAX_LIMIT);
        var categories = optional(params, "categories", AmenityCategories.defaultSearchCategories()).replace(" ", "");
        if (!CATEGORY_LIST.matcher(categories).matches()) {
            throw invalid("Parameter 'categories' must be a comma-separated list of category ids");
        }
        return query(Map.of(
                "lat", String.valueOf(lat),
                "lng", String.valueOf(lng),
                "radius", String.valueOf(radius),
                "limit", String.valueOf(limit),
                "categories", categories));
    }

    @Override
    public CompletableFuture<String> fetch(MetricQuery query) {
        return RetrofitCalls.bodyOf(api.search(
                apiKey,
                query.param("lat") + "," + query.param("lng"),
                query.intParam("radius"),
                query.param("categories"),
                query.intParam("limit"),
                "RELEVANCE"));
    }
}

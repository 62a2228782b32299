package com.bristol.siteintel.infrastructure.adapter.provider;

import com.bristol.siteintel.domain.model.MetricQuery;
import com.bristol.siteintel.domain.model.UpstreamFamily;
import com.bristol.siteintel.infrastructure.config.UpstreamProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * Monthly station observations from the NOAA Climate Data Online API.
 */
@Component
public class NoaaClimateSource extends AbstractUpstreamSource {

    public static final String ID = "noaa";

    private static final Pattern STATION = Pattern.compile("^[A-Z]+:[A-Z0-9]+$");
    private static final Pattern DATA_TYPE = Pattern.compile("^[A-Z0-9]{3,8}$");
    private static final int PAGE_LIMIT = 1000;

    private final NoaaClimateApi api;
    private final String token;
    private final Clock clock;

    public NoaaClimateSource(NoaaClimateApi api, UpstreamProperties properties, Clock clock) {
        super(ID, UpstreamFamily.CLIMATE);
        this.api = api;
        this.token = properties.instance(ID).getApiKey();
        this.clock = clock;
    }

    @Override
    public MetricQuery resolveQuery(Map<String, String> params) {
        var station = required(params, "station").toUpperCase(Locale.ROOT);
        if (!STATION.matcher(station).matches()) {
            throw invalid("Parameter 'station' must look like GHCND:USW00013881, got '" + station + "'");
        }
        var dataType = optional(params, "datatype", "TAVG").toUpperCase(Locale.ROOT);
        if (!DATA_TYPE.matcher(dataType).matches()) {
            throw invalid("Parameter 'datatype' is not a NOAA data type id: '" + dataType + "'");
        }
        var dataset = optional(params, "dataset", "GSOM").toUpperCase(Locale.ROOT);

        var end = date(optional(params, "endDate", LocalDate.now(clock).toString()), "endDate");
        var start = date(optional(params, "startDate", end.minusYears(1).toString()), "startDate");
        if (start.isAfter(end)) {
            throw invalid("Parameter 'startDate' must not be after 'endDate'");
        }
        return query(Map.of(
                "station", station,
                "datatype", dataType,
                "dataset", dataset,
                "startDate", start.toString(),
                "endDate", end.toString()));
    }

    @Override
    public CompletableFuture<String> fetch(MetricQuery query) {
        return RetrofitCalls.bodyOf(api.stationData(
                token,
                query.param("dataset"),
                query.param("station"),
                query.param("datatype"),
                query.param("startDate"),
                query.param("endDate"),
                "standard",
                PAGE_LIMIT));
    }

    private LocalDate date(String value, String name) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw invalid("Parameter '" + name + "' must be an ISO date (YYYY-MM-DD), got '" + value + "'");
        }
    }
}

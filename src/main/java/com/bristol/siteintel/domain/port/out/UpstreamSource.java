package com.bristol.siteintel.domain.port.out;

import com.bristol.siteintel.domain.model.MetricQuery;
import com.bristol.siteintel.domain.model.UpstreamFamily;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * One external data API. Implementations issue a single HTTP attempt per {@link #fetch} call
 * and leave retries, caching and circuit breaking to the caller.
 */
public interface UpstreamSource {

    String upstreamId();

    UpstreamFamily family();

    /**
     * Validates and defaults raw request parameters.
     *
     * @throws com.bristol.siteintel.domain.exception.InvalidMetricRequestException when a parameter is missing or malformed
     */
    MetricQuery resolveQuery(Map<String, String> params);

    /**
     * Raw response body. Completes exceptionally with an HTTP status error or an {@link java.io.IOException}.
     * Cancelling the future aborts the HTTP call.
     */
    CompletableFuture<String> fetch(MetricQuery query);
}

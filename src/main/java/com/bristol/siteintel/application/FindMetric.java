package com.bristol.siteintel.application;

import com.bristol.siteintel.domain.model.MetricResult;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Fetches one normalized metric from an upstream, going through the cache, the retry policy and
 * the upstream's circuit breaker.
 */
public interface FindMetric {

    /**
     * @throws com.bristol.siteintel.domain.exception.UnknownUpstreamException      no upstream with that id
     * @throws com.bristol.siteintel.domain.exception.InvalidMetricRequestException parameters rejected
     * @throws com.bristol.siteintel.domain.exception.UpstreamException             the upstream could not deliver
     */
    MetricResult fetchMetric(String upstreamId, Map<String, String> params);

    /**
     * Same as {@link #fetchMetric(String, Map)} but gives up after the deadline with
     * {@link com.bristol.siteintel.domain.exception.DeadlineExceededException}.
     */
    MetricResult fetchMetric(String upstreamId, Map<String, String> params, Duration deadline);

    /**
     * Completes exceptionally with the same exceptions the blocking form throws. Cancelling the
     * future cancels the upstream call.
     */
    CompletableFuture<MetricResult> fetchMetricAsync(String upstreamId, Map<String, String> params);
}

package com.bristol.siteintel.application;

import com.bristol.siteintel.domain.exception.ErrorCode;
import com.bristol.siteintel.domain.model.AggregationReport;
import com.bristol.siteintel.domain.model.MetricRequest;
import com.bristol.siteintel.domain.model.SourceOutcome;
import com.bristol.siteintel.infrastructure.config.UpstreamProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Fetches several metrics concurrently. A failing source never fails the whole aggregation.
 */
@Service
public class AggregateMetrics {

    private static final Logger logger = LoggerFactory.getLogger(AggregateMetrics.class);

    private final FindMetric findMetric;
    private final UpstreamProperties properties;

    public AggregateMetrics(FindMetric findMetric, UpstreamProperties properties) {
        this.findMetric = findMetric;
        this.properties = properties;
    }

    public AggregationReport aggregate(List<MetricRequest> requests) {
        var deadline = properties.getRequestDeadline();
        var outcomes = requests.stream()
                .map(request -> findMetric.fetchMetricAsync(request.upstreamId(), request.params())
                        .orTimeout(deadline.toMillis(), TimeUnit.MILLISECONDS)
                        .handle((result, error) -> error == null
                                ? SourceOutcome.ok(request, result)
                                : failed(request, error)))
                .toList();

        CompletableFuture.allOf(outcomes.toArray(new CompletableFuture[0])).join();

        var report = new AggregationReport(outcomes.stream().map(CompletableFuture::join).toList());
        logger.info("Aggregated {} metric request(s): {} succeeded, {} failed",
                requests.size(), report.succeeded(), report.failed());
        return report;
    }

    private static SourceOutcome failed(MetricRequest request, Throwable error) {
        var cause = ErrorCode.unwrap(error);
        var code = ErrorCode.classify(cause);
        logger.debug("Metric request for {} failed with {}: {}", request.upstreamId(), code, cause.getMessage());
        var message = code == ErrorCode.DEADLINE_EXCEEDED && cause.getMessage() == null
                ? "No result within the request deadline"
                : cause.getMessage();
        return SourceOutcome.failed(request, code.name(), message);
    }
}

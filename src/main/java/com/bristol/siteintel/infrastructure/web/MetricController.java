package com.bristol.siteintel.infrastructure.web;

import com.bristol.siteintel.application.AggregateMetrics;
import com.bristol.siteintel.application.FindMetric;
import com.bristol.siteintel.infrastructure.web.dto.AggregationRequest;
import com.bristol.siteintel.infrastructure.web.dto.AggregationResponse;
import com.bristol.siteintel.infrastructure.web.dto.MetricResponse;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/metrics")
public class MetricController {

    private static final Logger logger = LoggerFactory.getLogger(MetricController.class);

    private final FindMetric findMetric;
    private final AggregateMetrics aggregateMetrics;

    public MetricController(FindMetric findMetric, AggregateMetrics aggregateMetrics) {
        this.findMetric = findMetric;
        this.aggregateMetrics = aggregateMetrics;
    }

    @GetMapping("/{upstreamId}")
    public ResponseEntity<MetricResponse> fetchMetric(
            @PathVariable String upstreamId,
            @RequestParam Map<String, String> params
    ) {
        logger.info("Fetching metric from {} with {}", upstreamId, params);
        var result = findMetric.fetchMetric(upstreamId, params);
        return ResponseEntity.ok(MetricResponse.fromResult(result));
    }

    @PostMapping("/aggregate")
    public ResponseEntity<AggregationResponse> aggregate(@Valid @RequestBody AggregationRequest request) {
        logger.info("Aggregating {} metric request(s)", request.requests().size());
        var report = aggregateMetrics.aggregate(request.toRequests());
        return ResponseEntity.ok(AggregationResponse.fromReport(report));
    }
}

package com.bristol.siteintel.infrastructure.web.dto;

import com.bristol.siteintel.domain.model.AggregationReport;
import com.bristol.siteintel.domain.model.SourceOutcome;

import java.util.List;
import java.util.Map;

public record AggregationResponse(
        long succeeded,
        long failed,
        List<OutcomeDto> results
) {
    public static AggregationResponse fromReport(AggregationReport report) {
        var results = report.outcomes().stream()
                .map(OutcomeDto::fromOutcome)
                .toList();
        return new AggregationResponse(report.succeeded(), report.failed(), results);
    }

    public record OutcomeDto(
            String upstreamId,
            Map<String, String> params,
            SourceOutcome.Status status,
            MetricResponse metric,
            String error,
            String message
    ) {
        public static OutcomeDto fromOutcome(SourceOutcome outcome) {
            return new OutcomeDto(
                    outcome.request().upstreamId(),
                    outcome.request().params(),
                    outcome.status(),
                    outcome.result() != null ? MetricResponse.fromResult(outcome.result()) : null,
                    outcome.errorCode(),
                    outcome.message()
            );
        }
    }
}

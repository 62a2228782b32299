package com.bristol.siteintel.domain.model;

/**
 * Result of one request within an aggregation. Exactly one of {@code result} and {@code errorCode} is set.
 */
public record SourceOutcome(
        MetricRequest request,
        Status status,
        MetricResult result,
        String errorCode,
        String message
) {
    public enum Status {
        OK,
        FAILED
    }

    public static SourceOutcome ok(MetricRequest request, MetricResult result) {
        return new SourceOutcome(request, Status.OK, result, null, null);
    }

    public static SourceOutcome failed(MetricRequest request, String errorCode, String message) {
        return new SourceOutcome(request, Status.FAILED, null, errorCode, message);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}

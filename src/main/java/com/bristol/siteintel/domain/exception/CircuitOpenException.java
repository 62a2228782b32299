package com.bristol.siteintel.domain.exception;

import java.time.Duration;

/**
 * The breaker for the upstream refused the call. No request was sent.
 */
public class CircuitOpenException extends UpstreamException {

    private final Duration retryAfter;

    public CircuitOpenException(String upstreamId, Duration retryAfter, Throwable lastFailure) {
        super(upstreamId, "Circuit breaker for upstream '" + upstreamId + "' is open", lastFailure);
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.CIRCUIT_OPEN;
    }
}

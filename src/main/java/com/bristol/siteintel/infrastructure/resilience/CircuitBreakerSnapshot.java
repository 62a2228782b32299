package com.bristol.siteintel.infrastructure.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;

import java.time.Duration;
import java.time.Instant;

/**
 * @param failedCalls   failures in the current sliding window
 * @param bufferedCalls calls in the current sliding window
 */
public record CircuitBreakerSnapshot(
        String upstreamId,
        CircuitBreaker.State state,
        int consecutiveFailures,
        int failedCalls,
        int bufferedCalls,
        Instant openedAt,
        int failureThreshold,
        Duration cooldown
) {
}

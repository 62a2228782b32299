package com.bristol.siteintel.infrastructure.resilience;

import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;

/**
 * @param maxAttempts       total attempts including the first
 * @param baseDelay         delay before the second attempt, doubled for each later one
 * @param maxDelay          cap on any single delay
 * @param perAttemptTimeout budget of one attempt
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, Duration perAttemptTimeout) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(3,
            Duration.ofSeconds(1), Duration.ofSeconds(8), Duration.ofSeconds(15));

    private static final double BACKOFF_MULTIPLIER = 2.0;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.compareTo(Duration.ofMillis(1)) < 0) {
            throw new IllegalArgumentException("baseDelay must be >= 1ms, got " + baseDelay);
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay, got " + maxDelay);
        }
        if (perAttemptTimeout == null || perAttemptTimeout.isNegative() || perAttemptTimeout.isZero()) {
            throw new IllegalArgumentException("perAttemptTimeout must be positive, got " + perAttemptTimeout);
        }
    }

    /**
     * Delay after the failed attempt with the given zero-based index: {@code min(base * 2^index, max)}.
     */
    public Duration backoffDelay(int attemptIndex) {
        if (attemptIndex < 0) {
            throw new IllegalArgumentException("attemptIndex must be >= 0, got " + attemptIndex);
        }
        var intervals = IntervalFunction.ofExponentialBackoff(
                baseDelay.toMillis(), BACKOFF_MULTIPLIER, maxDelay.toMillis());
        long millis = intervals.apply(attemptIndex + 1);
        return Duration.ofMillis(Math.min(millis, maxDelay.toMillis()));
    }
}

package com.bristol.siteintel.infrastructure.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;

import java.time.Duration;

public record CircuitBreakerSettings(int failureThreshold, Duration cooldown) {

    public static final CircuitBreakerSettings DEFAULT = new CircuitBreakerSettings(5, Duration.ofMinutes(5));

    public CircuitBreakerSettings {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got " + failureThreshold);
        }
        if (cooldown == null || cooldown.isNegative() || cooldown.isZero()) {
            throw new IllegalArgumentException("cooldown must be positive, got " + cooldown);
        }
    }

    /**
     * A count window as wide as the threshold that trips only at a 100% failure rate, so the breaker opens
     * after {@code failureThreshold} consecutive failures. Half-open admits a single probe.
     */
    public CircuitBreakerConfig toConfig() {
        return CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100)
                .permittedNumberOfCallsInHalfOpenState(1)
                .waitDurationInOpenState(cooldown)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .build();
    }
}

package com.bristol.siteintel.infrastructure.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreaker.State;
import io.github.resilience4j.circuitbreaker.event.CircuitBreakerOnStateTransitionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Breaker for a single upstream, backed by a resilience4j {@link CircuitBreaker}.
 * <p>
 * Every state transition starts a new generation. An outcome is only reported to the breaker when the
 * call's permission was granted in the current generation, so a call started before the circuit opened
 * cannot decide the half-open probe.
 */
public class UpstreamCircuitBreaker {

    private static final Logger logger = LoggerFactory.getLogger(UpstreamCircuitBreaker.class);

    private final CircuitBreaker circuitBreaker;
    private final CircuitBreakerSettings settings;
    private final AtomicLong generation = new AtomicLong();
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private volatile Instant openedAt;

    UpstreamCircuitBreaker(CircuitBreaker circuitBreaker, CircuitBreakerSettings settings) {
        this.circuitBreaker = circuitBreaker;
        this.settings = settings;
        circuitBreaker.getEventPublisher()
                .onStateTransition(this::onStateTransition)
                .onError(event -> consecutiveFailures.incrementAndGet())
                .onSuccess(event -> consecutiveFailures.set(0));
    }

    /**
     * Empty when the call must not be attempted. An OPEN breaker whose cooldown has elapsed moves to
     * HALF_OPEN and grants this request as the probe.
     */
    public Optional<Permit> tryAcquirePermission() {
        if (!circuitBreaker.tryAcquirePermission()) {
            return Optional.empty();
        }
        return Optional.of(new Permit(generation.get(), System.nanoTime()));
    }

    public Duration remainingCooldown() {
        var opened = openedAt;
        if (opened == null || circuitBreaker.getState() != State.OPEN) {
            return Duration.ZERO;
        }
        var remaining = Duration.between(Instant.now(), opened.plus(settings.cooldown()));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public State getState() {
        return circuitBreaker.getState();
    }

    public String getUpstreamId() {
        return circuitBreaker.getName();
    }

    public CircuitBreakerSnapshot snapshot() {
        var metrics = circuitBreaker.getMetrics();
        return new CircuitBreakerSnapshot(getUpstreamId(), circuitBreaker.getState(), consecutiveFailures.get(),
                metrics.getNumberOfFailedCalls(), metrics.getNumberOfBufferedCalls(), openedAt,
                settings.failureThreshold(), settings.cooldown());
    }

    private void onStateTransition(CircuitBreakerOnStateTransitionEvent event) {
        generation.incrementAndGet();
        var transition = event.getStateTransition();
        var next = transition.getToState();
        if (next == State.OPEN) {
            openedAt = event.getCreationTime().toInstant();
            logger.warn("Circuit breaker for upstream {} OPEN after {} consecutive failures (was {}), cooldown {}",
                    getUpstreamId(), consecutiveFailures.get(), transition.getFromState(), settings.cooldown());
        } else {
            if (next == State.CLOSED) {
                openedAt = null;
            }
            logger.info("Circuit breaker for upstream {} {} (was {})",
                    getUpstreamId(), next, transition.getFromState());
        }
    }

    /**
     * One granted call. Exactly one of the three methods should be invoked when the call ends.
     */
    public final class Permit {

        private final long grantedIn;
        private final long startedAt;

        private Permit(long grantedIn, long startedAt) {
            this.grantedIn = grantedIn;
            this.startedAt = startedAt;
        }

        public void onSuccess() {
            if (isCurrent()) {
                circuitBreaker.onSuccess(elapsedNanos(), TimeUnit.NANOSECONDS);
            }
        }

        public void onError(Throwable failure) {
            if (isCurrent()) {
                circuitBreaker.onError(elapsedNanos(), TimeUnit.NANOSECONDS, failure);
            }
        }

        /**
         * Gives the permission back when the call ended without an outcome (cancelled).
         */
        public void release() {
            if (isCurrent()) {
                circuitBreaker.releasePermission();
            }
        }

        private boolean isCurrent() {
            if (generation.get() == grantedIn) {
                return true;
            }
            logger.debug("Ignoring outcome of an upstream {} call granted before the circuit moved to {}",
                    getUpstreamId(), circuitBreaker.getState());
            return false;
        }

        private long elapsedNanos() {
            return System.nanoTime() - startedAt;
        }
    }
}

package com.bristol.siteintel.infrastructure.resilience;

import com.bristol.siteintel.domain.exception.CircuitOpenException;
import com.bristol.siteintel.domain.exception.ErrorCode;
import com.bristol.siteintel.domain.exception.NonRetryableUpstreamException;
import com.bristol.siteintel.domain.exception.RetriesExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs upstream calls behind the upstream's circuit breaker, retrying transient failures with capped
 * exponential backoff. Backoff is scheduled, never slept, and cancelling the returned future stops
 * the attempt in flight as well as any attempt not yet started.
 */
public class RetryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    private final UpstreamCircuitBreakers breakers;
    private final FailureClassifier classifier;
    private final Executor executor;

    public RetryExecutor(UpstreamCircuitBreakers breakers, FailureClassifier classifier, Executor executor) {
        this.breakers = breakers;
        this.classifier = classifier;
        this.executor = executor;
    }

    public RetryExecutor(UpstreamCircuitBreakers breakers) {
        this(breakers, new FailureClassifier(), ForkJoinPool.commonPool());
    }

    public <T> CompletableFuture<T> execute(String upstreamId, RetryPolicy policy, UpstreamCall<T> call) {
        var execution = new Execution<>(upstreamId, policy, call, breakers.breakerFor(upstreamId));
        execution.start();
        return execution.result;
    }

    private final class Execution<T> {

        private final String upstreamId;
        private final RetryPolicy policy;
        private final UpstreamCall<T> call;
        private final UpstreamCircuitBreaker breaker;
        private final CompletableFuture<T> result = new CompletableFuture<>();

        private volatile CompletableFuture<T> inFlight;
        private volatile CompletableFuture<Void> pendingRetry;
        private volatile Throwable lastFailure;

        private Execution(String upstreamId, RetryPolicy policy, UpstreamCall<T> call, UpstreamCircuitBreaker breaker) {
            this.upstreamId = upstreamId;
            this.policy = policy;
            this.call = call;
            this.breaker = breaker;
        }

        void start() {
            // Covers caller cancellation and a caller deadline completing the future
            result.whenComplete((value, error) -> {
                if (error != null) {
                    abortOutstandingWork();
                }
            });
            attempt(0);
        }

        private void attempt(int attemptIndex) {
            if (result.isDone()) {
                return;
            }
            var granted = breaker.tryAcquirePermission();
            if (granted.isEmpty()) {
                logger.debug("Circuit for upstream {} refused attempt {}", upstreamId, attemptIndex + 1);
                result.completeExceptionally(
                        new CircuitOpenException(upstreamId, breaker.remainingCooldown(), lastFailure));
                return;
            }
            var permit = granted.get();

            logger.debug("Upstream {} attempt {}/{}", upstreamId, attemptIndex + 1, policy.maxAttempts());
            CompletableFuture<T> current;
            try {
                current = call.attempt();
            } catch (RuntimeException e) {
                current = CompletableFuture.failedFuture(e);
            }
            inFlight = current;
            if (result.isDone()) {
                current.cancel(true);
            }
            current.orTimeout(policy.perAttemptTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    .whenComplete((value, error) -> onAttemptCompleted(attemptIndex, permit, value, error));
        }

        private void onAttemptCompleted(int attemptIndex, UpstreamCircuitBreaker.Permit permit, T value,
                                        Throwable error) {
            if (error == null) {
                permit.onSuccess();
                result.complete(value);
                return;
            }
            if (result.isDone()) {
                // Cancelled by this execution after the caller gave up
                permit.release();
                return;
            }

            var kind = classifier.classify(error);
            var cause = ErrorCode.unwrap(error);
            lastFailure = cause;
            permit.onError(cause);

            if (kind == FailureKind.NON_RETRYABLE) {
                logger.warn("Upstream {} failed with a non-retryable error: {}", upstreamId, cause.toString());
                result.completeExceptionally(new NonRetryableUpstreamException(upstreamId, cause));
                return;
            }
            if (kind == FailureKind.CANCELLED) {
                logger.warn("Upstream {} attempt {} was cancelled by its source, treating it as transient",
                        upstreamId, attemptIndex + 1);
            }

            int nextIndex = attemptIndex + 1;
            if (nextIndex >= policy.maxAttempts()) {
                logger.error("Upstream {} failed after {} attempt(s), last error: {}",
                        upstreamId, policy.maxAttempts(), cause.toString());
                result.completeExceptionally(new RetriesExhaustedException(upstreamId, policy.maxAttempts(), cause));
                return;
            }

            var delay = policy.backoffDelay(attemptIndex);
            logger.warn("Upstream {} attempt {}/{} failed ({}), retrying in {}ms",
                    upstreamId, nextIndex, policy.maxAttempts(), cause.toString(), delay.toMillis());
            Executor dispatcher = task -> dispatchRetry(task, nextIndex);
            var delayed = CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS, dispatcher);
            pendingRetry = CompletableFuture.runAsync(() -> attempt(nextIndex), delayed);
            if (result.isDone()) {
                pendingRetry.cancel(false);
            }
        }

        private void dispatchRetry(Runnable task, int attemptsMade) {
            try {
                executor.execute(task);
            } catch (RejectedExecutionException e) {
                logger.error("Upstream {} retry rejected by the executor after {} attempt(s)", upstreamId, attemptsMade);
                var failure = new RetriesExhaustedException(upstreamId, attemptsMade, lastFailure);
                failure.addSuppressed(e);
                result.completeExceptionally(failure);
            }
        }

        private void abortOutstandingWork() {
            var retry = pendingRetry;
            if (retry != null) {
                retry.cancel(false);
            }
            var current = inFlight;
            if (current != null && !current.isDone()) {
                current.cancel(true);
            }
        }
    }
}

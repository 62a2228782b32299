package com.bristol.siteintel.infrastructure.resilience;

import com.bristol.siteintel.domain.exception.ErrorCode;
import com.bristol.siteintel.infrastructure.adapter.provider.UpstreamHttpException;

import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Timeouts, IO errors, HTTP 5xx and 429 are worth retrying. Everything else is not.
 */
public class FailureClassifier {

    public FailureKind classify(Throwable failure) {
        var cause = ErrorCode.unwrap(failure);
        if (cause instanceof CancellationException) {
            return FailureKind.CANCELLED;
        }
        if (cause instanceof TimeoutException || cause instanceof IOException) {
            return FailureKind.TRANSIENT;
        }
        if (cause instanceof UpstreamHttpException http) {
            return http.isRetryable() ? FailureKind.TRANSIENT : FailureKind.NON_RETRYABLE;
        }
        return FailureKind.NON_RETRYABLE;
    }
}

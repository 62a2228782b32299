package com.bristol.siteintel.domain.exception;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

public enum ErrorCode {
    CIRCUIT_OPEN,
    RETRIES_EXHAUSTED,
    UPSTREAM_REJECTED,
    DATA_UNAVAILABLE,
    DEADLINE_EXCEEDED,
    INVALID_REQUEST,
    UNKNOWN_UPSTREAM,
    CANCELLED,
    INTERNAL_ERROR;

    public static ErrorCode classify(Throwable error) {
        var cause = unwrap(error);
        if (cause instanceof UpstreamException upstream) {
            return upstream.getErrorCode();
        }
        if (cause instanceof InvalidMetricRequestException) {
            return INVALID_REQUEST;
        }
        if (cause instanceof UnknownUpstreamException) {
            return UNKNOWN_UPSTREAM;
        }
        if (cause instanceof TimeoutException) {
            return DEADLINE_EXCEEDED;
        }
        if (cause instanceof CancellationException) {
            return CANCELLED;
        }
        return INTERNAL_ERROR;
    }

    /**
     * Strips the {@link CompletionException} and {@link ExecutionException} wrappers added by futures.
     */
    public static Throwable unwrap(Throwable error) {
        var current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}

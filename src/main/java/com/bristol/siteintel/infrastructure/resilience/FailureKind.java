package com.bristol.siteintel.infrastructure.resilience;

public enum FailureKind {
    TRANSIENT,
    NON_RETRYABLE,
    CANCELLED
}

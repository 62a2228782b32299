package com.bristol.siteintel.domain.exception;

public class RetriesExhaustedException extends UpstreamException {

    private final int attempts;

    public RetriesExhaustedException(String upstreamId, int attempts, Throwable lastFailure) {
        super(upstreamId, "Upstream '" + upstreamId + "' failed after " + attempts + " attempt(s): "
                + describe(lastFailure), lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.RETRIES_EXHAUSTED;
    }

    private static String describe(Throwable failure) {
        if (failure == null) {
            return "unknown cause";
        }
        return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
    }
}

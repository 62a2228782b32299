package com.bristol.siteintel.domain.exception;

/**
 * A successful response whose body did not have the expected shape, or that reported an error inside it.
 */
public class NormalizationException extends UpstreamException {

    public NormalizationException(String upstreamId, String message) {
        super(upstreamId, message, null);
    }

    public NormalizationException(String upstreamId, String message, Throwable cause) {
        super(upstreamId, message, cause);
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.DATA_UNAVAILABLE;
    }
}

package com.bristol.siteintel.domain.exception;

/**
 * The upstream rejected the request (4xx other than 429) or the call failed in a way retries cannot fix.
 */
public class NonRetryableUpstreamException extends UpstreamException {

    public NonRetryableUpstreamException(String upstreamId, Throwable cause) {
        super(upstreamId, "Upstream '" + upstreamId + "' rejected the request: "
                + (cause != null ? cause.getMessage() : "no detail"), cause);
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.UPSTREAM_REJECTED;
    }
}

package com.bristol.siteintel.domain.exception;

/**
 * Base type for failures attributable to one upstream.
 */
public abstract class UpstreamException extends RuntimeException {

    private final String upstreamId;

    protected UpstreamException(String upstreamId, String message, Throwable cause) {
        super(message, cause);
        this.upstreamId = upstreamId;
    }

    public String getUpstreamId() {
        return upstreamId;
    }

    public abstract ErrorCode getErrorCode();
}

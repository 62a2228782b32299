package com.bristol.siteintel.domain.exception;

public class UnknownUpstreamException extends RuntimeException {

    private final String upstreamId;

    public UnknownUpstreamException(String upstreamId) {
        super("Unknown upstream '" + upstreamId + "'");
        this.upstreamId = upstreamId;
    }

    public String getUpstreamId() {
        return upstreamId;
    }
}

package com.bristol.siteintel.domain.exception;

public class InvalidMetricRequestException extends RuntimeException {

    private final String upstreamId;

    public InvalidMetricRequestException(String upstreamId, String message) {
        super(message);
        this.upstreamId = upstreamId;
    }

    public String getUpstreamId() {
        return upstreamId;
    }
}

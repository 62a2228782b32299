package com.bristol.siteintel.infrastructure.adapter.provider;

/**
 * Non-2xx response from an upstream.
 */
public class UpstreamHttpException extends RuntimeException {

    private static final int MAX_BODY_IN_MESSAGE = 200;

    private final int status;
    private final String body;

    public UpstreamHttpException(int status, String body) {
        super("HTTP " + status + (body == null || body.isBlank() ? "" : ": " + abbreviate(body)));
        this.status = status;
        this.body = body;
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }

    public boolean isRetryable() {
        return status == 429 || status >= 500;
    }

    private static String abbreviate(String body) {
        var trimmed = body.strip();
        return trimmed.length() <= MAX_BODY_IN_MESSAGE ? trimmed : trimmed.substring(0, MAX_BODY_IN_MESSAGE) + "...";
    }
}

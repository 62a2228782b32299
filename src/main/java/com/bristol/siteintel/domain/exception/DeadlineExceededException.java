package com.bristol.siteintel.domain.exception;

import java.time.Duration;

public class DeadlineExceededException extends UpstreamException {

    public DeadlineExceededException(String upstreamId, Duration deadline, Throwable cause) {
        super(upstreamId, "No result from upstream '" + upstreamId + "' within " + deadline.toMillis() + "ms", cause);
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.DEADLINE_EXCEEDED;
    }
}

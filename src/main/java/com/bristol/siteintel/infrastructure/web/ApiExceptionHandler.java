package com.bristol.siteintel.infrastructure.web;

import com.bristol.siteintel.domain.exception.CircuitOpenException;
import com.bristol.siteintel.domain.exception.DeadlineExceededException;
import com.bristol.siteintel.domain.exception.ErrorCode;
import com.bristol.siteintel.domain.exception.InvalidMetricRequestException;
import com.bristol.siteintel.domain.exception.UnknownUpstreamException;
import com.bristol.siteintel.domain.exception.UpstreamException;
import com.bristol.siteintel.infrastructure.web.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Renders failures as {@code {"error": code, "message": ..., "upstream": id}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(CircuitOpenException.class)
    public ResponseEntity<ErrorResponse> circuitOpen(CircuitOpenException e) {
        long retryAfterSeconds = Math.max(1, (e.getRetryAfter().toMillis() + 999) / 1000);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds))
                .body(body(e));
    }

    @ExceptionHandler(DeadlineExceededException.class)
    public ResponseEntity<ErrorResponse> deadlineExceeded(DeadlineExceededException e) {
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(body(e));
    }

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<ErrorResponse> upstreamFailure(UpstreamException e) {
        logger.warn("Upstream {} failed: {}", e.getUpstreamId(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body(e));
    }

    @ExceptionHandler(InvalidMetricRequestException.class)
    public ResponseEntity<ErrorResponse> invalidRequest(InvalidMetricRequestException e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(ErrorCode.INVALID_REQUEST.name(), e.getMessage(), e.getUpstreamId()));
    }

    @ExceptionHandler(UnknownUpstreamException.class)
    public ResponseEntity<ErrorResponse> unknownUpstream(UnknownUpstreamException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse(ErrorCode.UNKNOWN_UPSTREAM.name(), e.getMessage(), e.getUpstreamId()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> invalidBody(MethodArgumentNotValidException e) {
        var message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(ErrorCode.INVALID_REQUEST.name(), message, null));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> unreadableBody(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(ErrorCode.INVALID_REQUEST.name(), "Malformed request body", null));
    }

    private static ErrorResponse body(UpstreamException e) {
        return new ErrorResponse(e.getErrorCode().name(), e.getMessage(), e.getUpstreamId());
    }
}

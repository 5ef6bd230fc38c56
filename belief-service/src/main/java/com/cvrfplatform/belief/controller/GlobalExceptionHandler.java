package com.cvrfplatform.belief.controller;

import com.cvrfplatform.belief.dto.ErrorResponse;
import com.cvrfplatform.common.exception.ConcurrentCycleException;
import com.cvrfplatform.common.exception.StateException;
import com.cvrfplatform.common.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * Maps engine exceptions to HTTP responses with an {@link ErrorResponse} body.
 *
 * <ul>
 *   <li>{@link ValidationException}: 400, carries the offending field</li>
 *   <li>{@link StateException}: 409</li>
 *   <li>{@link ConcurrentCycleException}: 409, the caller may retry</li>
 *   <li>anything else (persistence included): 500</li>
 * </ul>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex) {
        log.warn("Validation failed. userId={} field={} message={}", ex.getUserId(), ex.getField(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", ex.getMessage(), ex.getField());
    }

    @ExceptionHandler(ConcurrentCycleException.class)
    public ResponseEntity<ErrorResponse> handleConcurrentCycle(ConcurrentCycleException ex) {
        log.warn("Concurrent cycle rejected. userId={} message={}", ex.getUserId(), ex.getMessage());
        return build(HttpStatus.CONFLICT, "CONCURRENT_CYCLE", ex.getMessage(), null);
    }

    @ExceptionHandler(StateException.class)
    public ResponseEntity<ErrorResponse> handleState(StateException ex) {
        log.warn("Invalid lifecycle state. userId={} message={}", ex.getUserId(), ex.getMessage());
        return build(HttpStatus.CONFLICT, "INVALID_STATE", ex.getMessage(), null);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatus(ResponseStatusException ex) {
        log.warn("Request rejected. status={} reason={}", ex.getStatusCode(), ex.getReason());
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        String code = status != null ? status.name() : "HTTP_" + ex.getStatusCode().value();
        return ResponseEntity.status(ex.getStatusCode())
            .body(new ErrorResponse(code, ex.getReason(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unhandled error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Internal error", null);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String code, String message,
                                                       String field) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message, field));
    }
}

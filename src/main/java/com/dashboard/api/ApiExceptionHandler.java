package com.dashboard.api;

import com.dashboard.domain.exception.AnalyticsException;
import com.dashboard.domain.exception.AnalyticsQueryTimeoutException;
import com.dashboard.domain.exception.QueryExecutionException;
import com.dashboard.domain.exception.QueryValidationException;
import com.dashboard.domain.exception.UnknownOperationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * Maps domain exceptions to HTTP responses with body {error, message, timestamp}.
 * 
 * - QueryValidationException → 400
 * - UnknownOperationException → 404
 * - AnalyticsQueryTimeoutException → 504
 * - QueryExecutionException → 500
 * 
 * Cache faults never get here; the query service degrades them to misses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(QueryValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(QueryValidationException e) {
        return respond(HttpStatus.BAD_REQUEST, "invalid_parameters", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .sorted()
                .collect(Collectors.joining("; "));
        return respond(HttpStatus.BAD_REQUEST, "invalid_request", message);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return respond(HttpStatus.BAD_REQUEST, "invalid_parameters",
                e.getName() + " has an invalid value: " + e.getValue());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return respond(HttpStatus.BAD_REQUEST, "invalid_request", "Malformed request body");
    }

    @ExceptionHandler(UnknownOperationException.class)
    public ResponseEntity<ErrorResponse> handleUnknownOperation(UnknownOperationException e) {
        return respond(HttpStatus.NOT_FOUND, "unknown_operation", e.getMessage());
    }

    @ExceptionHandler(AnalyticsQueryTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleTimeout(AnalyticsQueryTimeoutException e) {
        log.warn("Query timed out: {}", e.getMessage());
        return respond(HttpStatus.GATEWAY_TIMEOUT, "query_timeout", e.getMessage());
    }

    @ExceptionHandler(QueryExecutionException.class)
    public ResponseEntity<ErrorResponse> handleExecution(QueryExecutionException e) {
        log.error("Query execution failed: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "query_failed", e.getMessage());
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleConflict(DataIntegrityViolationException e) {
        log.warn("Rejected write: {}", e.getMostSpecificCause().getMessage());
        return respond(HttpStatus.CONFLICT, "conflict", "Record conflicts with existing data");
    }

    @ExceptionHandler(AnalyticsException.class)
    public ResponseEntity<ErrorResponse> handleAnalytics(AnalyticsException e) {
        log.error("Unhandled analytics error: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.of(error, message));
    }
}

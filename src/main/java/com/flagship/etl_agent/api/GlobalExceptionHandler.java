package com.flagship.etl_agent.api;

import com.flagship.etl_agent.dispatch.DispatchException;
import com.flagship.etl_agent.observability.CorrelationContext;
import com.flagship.etl_agent.observability.CorrelationIdResolver;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API.
 *
 * Every error body has the shape {@code {error, correlation_id}}. The matching
 * {@code x-correlation-id} header is already on the response, set by the filter.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(DispatchException.class)
    public ResponseEntity<ApiError> handleDispatchException(DispatchException e, HttpServletRequest request) {
        log.warn("Dispatch failed: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e.getError().describe(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e,
                                                              HttpServletRequest request) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return respond(HttpStatus.BAD_REQUEST, errors, request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e, HttpServletRequest request) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e, HttpServletRequest request) {
        // 404, 405 and ResponseStatusException keep their status
        if (e instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            log.warn("Request failed with {}: {}", status.value(), e.getMessage());
            String detail = errorResponse.getBody().getDetail();
            return respond(status, detail != null ? detail : e.getMessage(), request);
        }

        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
                e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), request);
    }

    private static ResponseEntity<ApiError> respond(HttpStatusCode status, Object error, HttpServletRequest request) {
        ApiError body = ApiError.builder()
            .error(error)
            .correlationId(correlationId(request))
            .build();

        return ResponseEntity.status(status).body(body);
    }

    private static String correlationId(HttpServletRequest request) {
        return CorrelationContext.current()
            .orElseGet(() -> CorrelationIdResolver.resolve(
                request.getHeader(CorrelationContext.CORRELATION_ID_HEADER)));
    }
}

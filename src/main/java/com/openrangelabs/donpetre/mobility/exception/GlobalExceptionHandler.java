package com.openrangelabs.donpetre.mobility.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Global exception handler for the mobility sync API.
 *
 * <p>Maps run-level failures to HTTP status codes with a structured body. Messages of
 * unexpected errors are not exposed.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2026-10
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handles requests that cannot run with the current configuration.
     */
    @ExceptionHandler(ConfigurationException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleConfiguration(
            ConfigurationException ex, ServerWebExchange exchange) {

        log.warn("Rejected run request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Run Request", ex.getMessage(), exchange);
    }

    /**
     * Handles a second start of a run that is still in progress.
     */
    @ExceptionHandler(RunAlreadyActiveException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleRunAlreadyActive(
            RunAlreadyActiveException ex, ServerWebExchange exchange) {

        log.warn("Run already active: {}", ex.getRunId());
        return respond(HttpStatus.CONFLICT, "Run Already Active", ex.getMessage(), exchange);
    }

    /**
     * Handles unknown run ids.
     */
    @ExceptionHandler(RunNotFoundException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleRunNotFound(
            RunNotFoundException ex, ServerWebExchange exchange) {

        return respond(HttpStatus.NOT_FOUND, "Run Not Found", ex.getMessage(), exchange);
    }

    /**
     * Handles validation exceptions.
     */
    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationException(
            WebExchangeBindException ex, ServerWebExchange exchange) {

        log.warn("Validation failed: {}", ex.getMessage());

        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String name = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            fieldErrors.put(name, error.getDefaultMessage());
        });

        ErrorResponse error = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.BAD_REQUEST.value())
                .error("Validation Failed")
                .message("Request validation failed")
                .path(exchange.getRequest().getPath().toString())
                .traceId(generateTraceId())
                .fieldErrors(fieldErrors)
                .build();

        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error));
    }

    /**
     * Handles unreadable request bodies and malformed parameters.
     */
    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInput(
            ServerWebInputException ex, ServerWebExchange exchange) {

        log.warn("Malformed request: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, "Malformed Request", ex.getReason(), exchange);
    }

    /**
     * Handles access denied exceptions.
     */
    @ExceptionHandler(AccessDeniedException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleAccessDenied(
            AccessDeniedException ex, ServerWebExchange exchange) {

        log.warn("Access denied: {}", ex.getMessage());
        return respond(HttpStatus.FORBIDDEN, "Access Denied",
                "Insufficient privileges to access this resource", exchange);
    }

    /**
     * Handles all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(
            Exception ex, ServerWebExchange exchange) {

        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again.", exchange);
    }

    private Mono<ResponseEntity<ErrorResponse>> respond(HttpStatus status, String error, String message,
                                                        ServerWebExchange exchange) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(error)
                .message(message)
                .path(exchange.getRequest().getPath().toString())
                .traceId(generateTraceId())
                .build();

        return Mono.just(ResponseEntity.status(status).body(body));
    }

    private String generateTraceId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}

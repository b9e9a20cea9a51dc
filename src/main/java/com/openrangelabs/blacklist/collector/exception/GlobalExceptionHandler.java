package com.openrangelabs.blacklist.collector.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
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
 * Global exception handler for the collection API.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handles lookups of sources without a collector.
     */
    @ExceptionHandler(UnknownSourceException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleUnknownSource(
            UnknownSourceException ex, ServerWebExchange exchange) {

        log.warn("Unknown source requested: {}", ex.getSourceName());
        return respond(HttpStatus.NOT_FOUND, "Unknown Source", ex.getMessage(), exchange, null);
    }

    /**
     * Handles invalid date ranges and other rejected arguments.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleIllegalArgument(
            IllegalArgumentException ex, ServerWebExchange exchange) {

        log.warn("Rejected request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), exchange, null);
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
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", exchange, fieldErrors);
    }

    /**
     * Handles unreadable request bodies and parameters.
     */
    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInputException(
            ServerWebInputException ex, ServerWebExchange exchange) {

        log.warn("Unreadable request: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", ex.getReason(), exchange, null);
    }

    /**
     * Handles all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(
            Exception ex, ServerWebExchange exchange) {

        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again.", exchange, null);
    }

    private Mono<ResponseEntity<ErrorResponse>> respond(HttpStatus status, String error, String message,
                                                        ServerWebExchange exchange,
                                                        Map<String, String> fieldErrors) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(error)
                .message(message)
                .path(exchange.getRequest().getPath().toString())
                .traceId(generateTraceId())
                .fieldErrors(fieldErrors)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    private String generateTraceId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}

package com.agrivision.ingestion.exception;

import com.agrivision.common.validation.InvalidReadingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

/**
 * Global exception handler for REST endpoints.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle rejected readings.
     */
    @ExceptionHandler(InvalidReadingException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInvalidReading(
            InvalidReadingException ex, ServerWebExchange exchange) {

        String path = exchange.getRequest().getPath().value();

        log.warn("Rejected reading for {}: {} ({})", path, ex.getMessage(), ex.getFailure());

        return Mono.just(ResponseEntity.badRequest().body(ErrorResponse.of(ex.getMessage())));
    }

    /**
     * Handle bodies that are missing or are not a JSON object.
     */
    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInputException(
            ServerWebInputException ex, ServerWebExchange exchange) {

        String path = exchange.getRequest().getPath().value();
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(ex);
        String details = cause != ex ? cause.getMessage() : ex.getReason();

        log.warn("Unreadable request body for {}: {}", path, details);

        return Mono.just(ResponseEntity.badRequest().body(ErrorResponse.of("Invalid JSON body", details)));
    }

    /**
     * Handle bodies above the configured codec limit.
     */
    @ExceptionHandler(DataBufferLimitException.class)
    public Mono<ResponseEntity<ErrorResponse>> handlePayloadTooLarge(
            DataBufferLimitException ex, ServerWebExchange exchange) {

        String path = exchange.getRequest().getPath().value();

        log.warn("Request body too large for {}: {}", path, ex.getMessage());

        return Mono.just(ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(ErrorResponse.of("Payload too large", ex.getMessage())));
    }

    /**
     * Keep framework status codes (415, 405, 404, ...) instead of turning them into 500s.
     */
    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatus(
            ResponseStatusException ex, ServerWebExchange exchange) {

        String path = exchange.getRequest().getPath().value();

        log.warn("Request to {} failed with {}: {}", path, ex.getStatusCode(), ex.getReason());

        String error = ex.getReason() != null ? ex.getReason() : ex.getStatusCode().toString();
        return Mono.just(ResponseEntity.status(ex.getStatusCode()).body(ErrorResponse.of(error)));
    }

    /**
     * Handle all other exceptions, e.g. MongoDB being unreachable or an insert failing.
     */
    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(
            Exception ex, ServerWebExchange exchange) {

        String path = exchange.getRequest().getPath().value();

        log.error("ERROR {}: {}", path, ex.getMessage(), ex);

        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(ErrorResponse.SERVER_ERROR, ex.getMessage())));
    }
}

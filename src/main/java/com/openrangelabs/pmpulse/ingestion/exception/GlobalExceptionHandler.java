package com.openrangelabs.pmpulse.ingestion.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Maps service exceptions to structured error responses.
 *
 * <p>Encryption and unexpected failures are logged in full but answered with a generic
 * message so internal details do not leak to clients.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ConnectionNotFoundException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleConnectionNotFound(
            ConnectionNotFoundException ex, ServerWebExchange exchange) {
        log.warn("Connection not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Connection Not Found", ex.getMessage(), exchange);
    }

    @ExceptionHandler(AlertNotFoundException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleAlertNotFound(
            AlertNotFoundException ex, ServerWebExchange exchange) {
        log.warn("Alert not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Alert Not Found", ex.getMessage(), exchange);
    }

    @ExceptionHandler(SyncAlreadyRunningException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleSyncAlreadyRunning(
            SyncAlreadyRunningException ex, ServerWebExchange exchange) {
        log.info("Rejected concurrent sync: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "Sync Already Running", ex.getMessage(), exchange);
    }

    @ExceptionHandler(ConnectionNotConfiguredException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleConnectionNotConfigured(
            ConnectionNotConfiguredException ex, ServerWebExchange exchange) {
        log.warn("Connection not configured: {}", ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Connection Not Configured", ex.getMessage(), exchange);
    }

    @ExceptionHandler(CredentialEncryptionException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleCredentialEncryption(
            CredentialEncryptionException ex, ServerWebExchange exchange) {
        log.error("Credential {} error: {}", ex.getOperation(), ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Credential Processing Error",
                "Unable to process connection credentials.", exchange);
    }

    @ExceptionHandler(RemoteApiException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleRemoteApi(
            RemoteApiException ex, ServerWebExchange exchange) {
        log.error("Remote API call failed with status {}: {}", ex.getStatusCode(), ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "Remote API Error", ex.getMessage(), exchange);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleIllegalArgument(
            IllegalArgumentException ex, ServerWebExchange exchange) {
        log.warn("Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), exchange);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ValidationErrorResponse>> handleValidationException(
            WebExchangeBindException ex, ServerWebExchange exchange) {

        log.warn("Validation failed: {}", ex.getMessage());

        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            fieldErrors.put(fieldName, error.getDefaultMessage());
        });

        ValidationErrorResponse error = ValidationErrorResponse.builder()
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

    @ExceptionHandler(AccessDeniedException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleAccessDenied(
            AccessDeniedException ex, ServerWebExchange exchange) {
        log.warn("Access denied: {}", ex.getMessage());
        return respond(HttpStatus.FORBIDDEN, "Access Denied",
                "Insufficient privileges to access this resource", exchange);
    }

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

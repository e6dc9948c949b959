package com.openrangelabs.pmpulse.ingestion.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Error body returned by every endpoint of the ingestion API.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Standard error response structure")
public class ErrorResponse {

    @Schema(description = "When the error occurred", example = "2025-01-15T10:30:00")
    LocalDateTime timestamp;

    @Schema(description = "HTTP status code", example = "409")
    int status;

    @Schema(description = "Error type", example = "Sync Already Running")
    String error;

    @Schema(description = "Detailed error message", example = "A sync is already running for connection 123e4567-e89b-12d3-a456-426614174000")
    String message;

    @Schema(description = "Request path that caused the error", example = "/api/sync/123e4567-e89b-12d3-a456-426614174000")
    String path;

    @Schema(description = "Short trace ID for log correlation", example = "a1b2c3d4")
    String traceId;
}

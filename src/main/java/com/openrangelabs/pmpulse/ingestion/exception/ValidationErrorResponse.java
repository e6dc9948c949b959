package com.openrangelabs.pmpulse.ingestion.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Validation error body with one message per rejected field.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Validation error response with field details")
public class ValidationErrorResponse {

    LocalDateTime timestamp;

    int status;

    String error;

    String message;

    String path;

    String traceId;

    @Schema(description = "Field-specific validation errors", example = "{\"mode\": \"must be full or incremental\"}")
    Map<String, String> fieldErrors;
}

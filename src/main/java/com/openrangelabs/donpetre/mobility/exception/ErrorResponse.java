package com.openrangelabs.donpetre.mobility.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Standard error response structure for API errors.
 *
 * <p>Validation failures additionally carry the offending fields.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2026-10
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Standard error response structure")
public class ErrorResponse {

    @Schema(description = "When the error occurred", example = "2026-10-15T10:30:00")
    LocalDateTime timestamp;

    @Schema(description = "HTTP status code", example = "409")
    int status;

    @Schema(description = "Error type", example = "Run Already Active")
    String error;

    @Schema(description = "Detailed error message", example = "Run already active: daily-2026-10-08")
    String message;

    @Schema(description = "Request path that caused the error", example = "/api/sync/runs")
    String path;

    @Schema(description = "Unique trace ID for debugging", example = "a1b2c3d4")
    String traceId;

    @Schema(description = "Field-specific validation errors",
            example = "{\"fromDate\": \"must not be null\"}")
    Map<String, String> fieldErrors;
}

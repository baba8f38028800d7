package com.fintech.candlestream.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

/**
 * Standardized error response for API errors.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Error response with details about the failure")
public record ErrorResponse(
    
    @Schema(description = "HTTP status code", example = "500")
    int status,
    
    @Schema(description = "Error type/category", example = "INTERNAL_ERROR")
    String error,
    
    @Schema(description = "Human-readable error message")
    String message,
    
    @Schema(description = "Request path that caused the error", example = "/state/manifest")
    String path,
    
    @Schema(description = "Timestamp of the error", example = "2025-12-09T10:30:00Z")
    Instant timestamp
) {
    
    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now());
    }
}

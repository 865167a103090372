package com.example.sgkdocumentreader.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(description = "Error body returned by every endpoint")
public record ErrorResponse(
        Instant timestamp,
        @Schema(example = "400") int status,
        @Schema(example = "Bad Request") String error,
        @Schema(description = "What the user can do about it") String message,
        @Schema(example = "/api/v1/documents/upload") String path) {
}

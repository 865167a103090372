package com.example.sgkdocumentreader.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Objects;

@Schema(description = "Document type decided for a page")
public record ClassificationResult(
        @Schema(description = "Document type") DocumentType type,
        @Schema(description = "Confidence between 0 and 1", example = "0.9") double confidence,
        @Schema(description = "How the type was decided") ClassificationMethod method) {

    public ClassificationResult {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(method, "method");
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }
}

package com.example.sgkdocumentreader.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Best person name found in the OCR text")
public record NameCandidate(
        @Schema(description = "Cleaned name in proper case", example = "Ali Veli") String text,
        @Schema(description = "Extraction confidence between 0 and 1", example = "0.75") double confidence) {

    public NameCandidate {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Name candidate text must not be blank");
        }
    }
}

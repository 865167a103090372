package com.example.sgkdocumentreader.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDate;

@Schema(description = "Date found in the OCR text")
public record DateCandidate(
        @Schema(description = "Date as written", example = "15.03.1958") String text,
        @Schema(description = "ISO form", example = "1958-03-15") LocalDate date,
        @Schema(description = "Role inferred from the nearby label") DateRole role) {
}

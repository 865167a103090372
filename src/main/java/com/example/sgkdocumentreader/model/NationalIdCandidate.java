package com.example.sgkdocumentreader.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Turkish national identity (TC) number found in the OCR text")
public record NationalIdCandidate(
        @Schema(description = "Eleven digit number", example = "12345678950") String value,
        @Schema(description = "Whether the checksum digits are valid") boolean validated) {
}

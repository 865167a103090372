package com.example.sgkdocumentreader.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Per-signal scores that were fused into a match confidence")
public record SignalBreakdown(
        @Schema(description = "Average of the four name similarity measures") double name,
        @Schema(description = "Share of extracted tokens found verbatim in the patient name") double exactWords,
        @Schema(description = "Share of position-aligned tokens that agree") double nameOrder,
        @Schema(description = "1 when the national id matches") double nationalId,
        @Schema(description = "1 when the birth date matches") double birthDate,
        @Schema(description = "1 when the last seven phone digits match") double phone) {

    public static SignalBreakdown none() {
        return new SignalBreakdown(0, 0, 0, 0, 0, 0);
    }
}

package com.example.sgkdocumentreader.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Patient considered as the owner of a document")
public record MatchCandidate(
        @Schema(description = "Patient id", example = "p-001") String patientId,
        @Schema(description = "Patient full name", example = "Ali Veli") String patientName,
        @Schema(description = "Fused confidence between 0 and 1", example = "0.93") double confidence,
        SignalBreakdown signals,
        MatchMethod method) {

    public MatchCandidate {
        if (confidence < 0 || confidence > 1) {
            throw new IllegalArgumentException("Match confidence must be between 0 and 1");
        }
    }
}

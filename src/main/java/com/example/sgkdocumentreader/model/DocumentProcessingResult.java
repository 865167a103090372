package com.example.sgkdocumentreader.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Outcome of one completed pipeline run")
public record DocumentProcessingResult(
        @Schema(description = "Pipeline run id") String runId,
        @Schema(description = "Stored artifact") DocumentArtifact artifact,
        ClassificationResult classification,
        IdentityResolution identity,
        @Schema(description = "Name read from the page, if any", example = "Ahmet Yılmaz") String extractedName,
        @Schema(description = "Whether a checksum-valid national id was found") boolean nationalIdFound,
        @Schema(description = "Whether the pipeline linked the patient without user action") boolean autoAssigned,
        @Schema(description = "Whether the user should confirm the patient link") boolean confirmationRequired,
        boolean boundaryDetected,
        @Schema(description = "Boundary strategy that produced the crop", example = "edge-density") String boundaryStrategy,
        @Schema(description = "Mean OCR confidence between 0 and 1") double ocrConfidence,
        boolean placeholder,
        List<CompressionAttempt> compressionAttempts) {

    public DocumentProcessingResult {
        compressionAttempts = compressionAttempts == null ? List.of() : List.copyOf(compressionAttempts);
    }

    public DocumentProcessingResult withArtifact(DocumentArtifact stored) {
        return new DocumentProcessingResult(runId, stored, classification, identity, extractedName, nationalIdFound,
                autoAssigned, confirmationRequired, boundaryDetected, boundaryStrategy, ocrConfidence, placeholder,
                compressionAttempts);
    }
}

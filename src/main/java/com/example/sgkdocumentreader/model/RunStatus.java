package com.example.sgkdocumentreader.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(description = "Progress of a pipeline run")
public record RunStatus(
        String runId,
        String fileName,
        @Schema(description = "Current stage", example = "EXTRACTING") String stage,
        @Schema(description = "Current step, 8 when done", example = "3") int step,
        int totalSteps,
        String message,
        @Schema(description = "A cancel was requested and takes effect at the next stage boundary") boolean cancelRequested,
        @Schema(description = "The save failed and can be retried without reprocessing") boolean retryable,
        @Schema(description = "User-facing error of a failed run") String error,
        @Schema(description = "Artifact id once the run is done") String artifactId,
        Instant startedAt,
        Instant updatedAt) {
}

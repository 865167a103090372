package com.example.sgkdocumentreader.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

public record WorkflowUpdateRequest(
        @Schema(description = "Target workflow status", example = "INVOICED") @NotNull WorkflowStatus status,
        @Schema(description = "Free text stored in the patient history") String note) {
}

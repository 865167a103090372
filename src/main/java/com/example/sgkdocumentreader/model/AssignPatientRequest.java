package com.example.sgkdocumentreader.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

public record AssignPatientRequest(
        @Schema(description = "Patient to link the document to", example = "p-1001") @NotBlank String patientId) {
}

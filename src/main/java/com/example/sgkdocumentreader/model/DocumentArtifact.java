package com.example.sgkdocumentreader.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

/**
 * Persisted outcome of one pipeline run. The patient is referenced by id only.
 */
@Schema(description = "Stored, classified document linked to a patient")
public record DocumentArtifact(
        @Schema(description = "Artifact id") String id,
        @Schema(description = "Pipeline run that created the artifact") String runId,
        @Schema(description = "Linked patient, null until resolved or assigned") String patientId,
        DocumentType documentType,
        @Schema(description = "Generated PDF file name", example = "ALI_VELI_Recete_20250114_0930.pdf") String fileName,
        @Schema(description = "Name of the uploaded file", example = "scan.jpg") String originalFileName,
        String originalImageRef,
        String rectifiedImageRef,
        String documentRef,
        String ocrText,
        double classificationConfidence,
        double matchConfidence,
        MatchTier matchTier,
        boolean boundaryDetected,
        @Schema(description = "True when the stored PDF is the text-only placeholder") boolean placeholder,
        WorkflowStatus workflowStatus,
        @Schema(description = "Size of the stored PDF in bytes") long byteSize,
        Instant createdAt) {

    public DocumentArtifact withPatient(String newPatientId) {
        return new DocumentArtifact(id, runId, newPatientId, documentType, fileName, originalFileName,
                originalImageRef, rectifiedImageRef, documentRef, ocrText, classificationConfidence,
                matchConfidence, matchTier, boundaryDetected, placeholder, workflowStatus, byteSize, createdAt);
    }

    public DocumentArtifact withContentRefs(String originalRef, String rectifiedRef, String packagedRef) {
        return new DocumentArtifact(id, runId, patientId, documentType, fileName, originalFileName,
                originalRef, rectifiedRef, packagedRef, ocrText, classificationConfidence,
                matchConfidence, matchTier, boundaryDetected, placeholder, workflowStatus, byteSize, createdAt);
    }

    public DocumentArtifact withWorkflowStatus(WorkflowStatus status) {
        return new DocumentArtifact(id, runId, patientId, documentType, fileName, originalFileName,
                originalImageRef, rectifiedImageRef, documentRef, ocrText, classificationConfidence,
                matchConfidence, matchTier, boundaryDetected, placeholder, status, byteSize, createdAt);
    }
}

package com.example.sgkdocumentreader.service.storage;

import com.example.sgkdocumentreader.model.DocumentArtifact;
import com.example.sgkdocumentreader.model.WorkflowStatus;

/**
 * Changes allowed on a stored artifact. Null fields are left untouched.
 */
public record ArtifactPatch(String patientId, WorkflowStatus workflowStatus) {

    public static ArtifactPatch patient(String patientId) {
        return new ArtifactPatch(patientId, null);
    }

    public static ArtifactPatch workflow(WorkflowStatus status) {
        return new ArtifactPatch(null, status);
    }

    DocumentArtifact applyTo(DocumentArtifact artifact) {
        DocumentArtifact patched = artifact;
        if (patientId != null) {
            patched = patched.withPatient(patientId);
        }
        if (workflowStatus != null) {
            patched = patched.withWorkflowStatus(workflowStatus);
        }
        return patched;
    }
}

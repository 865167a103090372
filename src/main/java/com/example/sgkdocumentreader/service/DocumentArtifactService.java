package com.example.sgkdocumentreader.service;

import com.example.sgkdocumentreader.exception.ArtifactNotFoundException;
import com.example.sgkdocumentreader.exception.InvalidWorkflowTransitionException;
import com.example.sgkdocumentreader.exception.PatientNotFoundException;
import com.example.sgkdocumentreader.model.DocumentArtifact;
import com.example.sgkdocumentreader.model.WorkflowStatus;
import com.example.sgkdocumentreader.service.storage.ArtifactPatch;
import com.example.sgkdocumentreader.service.storage.ArtifactStore;
import com.example.sgkdocumentreader.service.storage.PatientDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Reads stored artifacts and applies the two changes users may make to
 * them: linking a patient and advancing the workflow status.
 */
@Service
public class DocumentArtifactService {

    private static final Logger log = LoggerFactory.getLogger(DocumentArtifactService.class);

    private final ArtifactStore artifactStore;
    private final PatientDirectory patientDirectory;
    private final PatientWorkflowService workflowService;

    public DocumentArtifactService(ArtifactStore artifactStore, PatientDirectory patientDirectory,
                                   PatientWorkflowService workflowService) {
        this.artifactStore = artifactStore;
        this.patientDirectory = patientDirectory;
        this.workflowService = workflowService;
    }

    public List<DocumentArtifact> list(String patientId) {
        return artifactStore.list(patientId == null || patientId.isBlank() ? null : patientId);
    }

    public DocumentArtifact get(String artifactId) {
        return artifactStore.find(artifactId).orElseThrow(() -> new ArtifactNotFoundException(artifactId));
    }

    public byte[] content(DocumentArtifact artifact) {
        return artifactStore.readContent(artifact.documentRef());
    }

    /**
     * Links the artifact to a patient chosen by the user. The patient's
     * pending identity query is cleared and the upload is recorded on the
     * patient's workflow.
     */
    public DocumentArtifact assignPatient(String artifactId, String patientId) {
        DocumentArtifact artifact = get(artifactId);
        if (patientDirectory.findById(patientId).isEmpty()) {
            throw new PatientNotFoundException(patientId);
        }
        DocumentArtifact linked = artifactStore.update(artifact.id(), ArtifactPatch.patient(patientId));
        patientDirectory.clearIdentityQuery(patientId);
        log.info("Artifact {} manually assigned to patient {}", artifactId, patientId);
        try {
            workflowService.recordDocumentUpload(linked);
        } catch (RuntimeException ex) {
            log.warn("Workflow update after assigning artifact {} failed", artifactId, ex);
        }
        return get(artifactId);
    }

    public DocumentArtifact advanceWorkflow(String artifactId, WorkflowStatus status) {
        DocumentArtifact artifact = get(artifactId);
        if (!status.isAfter(artifact.workflowStatus())) {
            throw new InvalidWorkflowTransitionException("Artifact " + artifactId + " is already at "
                    + artifact.workflowStatus() + " and cannot move to " + status);
        }
        return artifactStore.update(artifactId, ArtifactPatch.workflow(status));
    }
}

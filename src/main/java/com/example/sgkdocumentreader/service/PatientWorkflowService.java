package com.example.sgkdocumentreader.service;

import com.example.sgkdocumentreader.exception.PatientNotFoundException;
import com.example.sgkdocumentreader.model.DocumentArtifact;
import com.example.sgkdocumentreader.model.Patient;
import com.example.sgkdocumentreader.model.WorkflowStatus;
import com.example.sgkdocumentreader.service.storage.ArtifactPatch;
import com.example.sgkdocumentreader.service.storage.ArtifactStore;
import com.example.sgkdocumentreader.service.storage.PatientDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * SGK workflow of patients. Setting a patient's status also moves that
 * patient's documents forward to it; documents never move back.
 */
@Service
public class PatientWorkflowService {

    private static final Logger log = LoggerFactory.getLogger(PatientWorkflowService.class);

    private final PatientDirectory patientDirectory;
    private final ArtifactStore artifactStore;

    public PatientWorkflowService(PatientDirectory patientDirectory, ArtifactStore artifactStore) {
        this.patientDirectory = patientDirectory;
        this.artifactStore = artifactStore;
    }

    public List<Patient> listPatients() {
        return patientDirectory.findAll();
    }

    public Patient getPatient(String patientId) {
        return patientDirectory.findById(patientId).orElseThrow(() -> new PatientNotFoundException(patientId));
    }

    public Patient setStatus(String patientId, WorkflowStatus status, String note) {
        Patient updated = patientDirectory.setWorkflowStatus(patientId, status, note);
        for (DocumentArtifact artifact : artifactStore.list(patientId)) {
            if (status.isAfter(artifact.workflowStatus())) {
                artifactStore.update(artifact.id(), ArtifactPatch.workflow(status));
            }
        }
        return updated;
    }

    /** Marks the documents of the artifact's patient as uploaded. */
    public Patient recordDocumentUpload(DocumentArtifact artifact) {
        if (artifact.patientId() == null) {
            throw new IllegalArgumentException("Artifact " + artifact.id() + " is not linked to a patient");
        }
        String note = artifact.documentType().label() + " yüklendi: " + artifact.fileName();
        log.info("Recording upload of {} for patient {}", artifact.fileName(), artifact.patientId());
        return setStatus(artifact.patientId(), WorkflowStatus.DOCUMENTS_UPLOADED, note);
    }
}

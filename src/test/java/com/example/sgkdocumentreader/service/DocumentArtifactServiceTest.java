package com.example.sgkdocumentreader.service;

import com.example.sgkdocumentreader.exception.ArtifactNotFoundException;
import com.example.sgkdocumentreader.exception.InvalidWorkflowTransitionException;
import com.example.sgkdocumentreader.exception.PatientNotFoundException;
import com.example.sgkdocumentreader.model.DocumentArtifact;
import com.example.sgkdocumentreader.model.IdentityQuery;
import com.example.sgkdocumentreader.model.MatchTier;
import com.example.sgkdocumentreader.model.Patient;
import com.example.sgkdocumentreader.model.WorkflowStatus;
import com.example.sgkdocumentreader.service.storage.JsonFileArtifactStore;
import com.example.sgkdocumentreader.service.storage.JsonPatientDirectory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DocumentArtifactServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @TempDir
    Path directory;

    private JsonFileArtifactStore artifactStore;
    private JsonPatientDirectory patients;
    private DocumentArtifactService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-05T10:00:00Z"), ZoneOffset.UTC);
        artifactStore = new JsonFileArtifactStore(directory.resolve("store"), 1_000_000, objectMapper);
        patients = new JsonPatientDirectory(directory.resolve("patients.json"), objectMapper, clock,
                List.of(Patient.of("p-1", "Ali Veli", null, null, null),
                        Patient.of("p-2", "Ayşe Demir", null, null, null)));
        service = new DocumentArtifactService(artifactStore, patients,
                new PatientWorkflowService(patients, artifactStore));
    }

    @Test
    void shouldAssignPatientClearQueryAndRecordUpload() {
        artifactStore.append(unlinked("a-1"), PatientWorkflowServiceTest.content());
        patients.recordIdentityQuery("p-2", new IdentityQuery("run-a-1", Instant.EPOCH, MatchTier.LOW, 0.2, "Ayse"));

        DocumentArtifact assigned = service.assignPatient("a-1", "p-2");

        assertThat(assigned.patientId()).isEqualTo("p-2");
        assertThat(assigned.workflowStatus()).isEqualTo(WorkflowStatus.DOCUMENTS_UPLOADED);
        Patient patient = patients.findById("p-2").orElseThrow();
        assertThat(patient.lastIdentityQuery()).isNull();
        assertThat(patient.currentStatus()).isEqualTo(WorkflowStatus.DOCUMENTS_UPLOADED);
        assertThat(service.list("p-2")).extracting(DocumentArtifact::id).containsExactly("a-1");
    }

    @Test
    void shouldKeepAssignmentWhenWorkflowUpdateFails() {
        PatientWorkflowService failingWorkflow = mock(PatientWorkflowService.class);
        when(failingWorkflow.recordDocumentUpload(any())).thenThrow(new IllegalStateException("disk full"));
        DocumentArtifactService tolerant = new DocumentArtifactService(artifactStore, patients, failingWorkflow);
        artifactStore.append(unlinked("a-1"), PatientWorkflowServiceTest.content());

        assertThat(tolerant.assignPatient("a-1", "p-1").patientId()).isEqualTo("p-1");
    }

    @Test
    void shouldRejectUnknownPatientOrArtifact() {
        artifactStore.append(unlinked("a-1"), PatientWorkflowServiceTest.content());

        assertThatThrownBy(() -> service.assignPatient("a-1", "p-404")).isInstanceOf(PatientNotFoundException.class);
        assertThatThrownBy(() -> service.assignPatient("a-404", "p-1")).isInstanceOf(ArtifactNotFoundException.class);
        assertThat(service.get("a-1").patientId()).isNull();
    }

    @Test
    void shouldOnlyAdvanceWorkflowForward() {
        artifactStore.append(PatientWorkflowServiceTest.artifact("a-1", "run-1", WorkflowStatus.DOCUMENTS_UPLOADED),
                PatientWorkflowServiceTest.content());

        assertThat(service.advanceWorkflow("a-1", WorkflowStatus.INVOICED).workflowStatus())
                .isEqualTo(WorkflowStatus.INVOICED);
        assertThatThrownBy(() -> service.advanceWorkflow("a-1", WorkflowStatus.PRESCRIPTION_SAVED))
                .isInstanceOf(InvalidWorkflowTransitionException.class);
        assertThatThrownBy(() -> service.advanceWorkflow("a-1", WorkflowStatus.INVOICED))
                .isInstanceOf(InvalidWorkflowTransitionException.class);
    }

    @Test
    void shouldTreatBlankPatientFilterAsAll() {
        artifactStore.append(unlinked("a-1"), PatientWorkflowServiceTest.content());

        assertThat(service.list(" ")).hasSize(1);
        assertThat(service.content(service.get("a-1"))).containsExactly(1);
    }

    private static DocumentArtifact unlinked(String id) {
        return PatientWorkflowServiceTest.artifact(id, "run-" + id, null).withPatient(null);
    }
}

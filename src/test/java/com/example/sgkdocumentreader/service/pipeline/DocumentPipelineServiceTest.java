package com.example.sgkdocumentreader.service.pipeline;

import com.example.sgkdocumentreader.config.PipelineProperties;
import com.example.sgkdocumentreader.exception.ExtractionFailureException;
import com.example.sgkdocumentreader.exception.InvalidWorkflowTransitionException;
import com.example.sgkdocumentreader.exception.PersistenceException;
import com.example.sgkdocumentreader.exception.PipelineCancelledException;
import com.example.sgkdocumentreader.exception.RunInProgressException;
import com.example.sgkdocumentreader.exception.RunNotFoundException;
import com.example.sgkdocumentreader.exception.ValidationException;
import com.example.sgkdocumentreader.model.DocumentArtifact;
import com.example.sgkdocumentreader.model.DocumentProcessingResult;
import com.example.sgkdocumentreader.model.DocumentType;
import com.example.sgkdocumentreader.model.MatchTier;
import com.example.sgkdocumentreader.model.Patient;
import com.example.sgkdocumentreader.model.RunStatus;
import com.example.sgkdocumentreader.model.UploadedFile;
import com.example.sgkdocumentreader.model.WorkflowStatus;
import com.example.sgkdocumentreader.service.PatientWorkflowService;
import com.example.sgkdocumentreader.service.classification.DocumentClassifier;
import com.example.sgkdocumentreader.service.classification.ExternalDocumentClassifier;
import com.example.sgkdocumentreader.service.extraction.EntityExtractor;
import com.example.sgkdocumentreader.service.geometry.DocumentRectifier;
import com.example.sgkdocumentreader.service.matching.IdentityResolver;
import com.example.sgkdocumentreader.service.ocr.OcrEngine;
import com.example.sgkdocumentreader.service.ocr.OcrResult;
import com.example.sgkdocumentreader.service.packaging.DocumentPackager;
import com.example.sgkdocumentreader.service.packaging.FilenameGenerator;
import com.example.sgkdocumentreader.service.packaging.PdfDocumentWriter;
import com.example.sgkdocumentreader.service.storage.JsonFileArtifactStore;
import com.example.sgkdocumentreader.service.storage.JsonPatientDirectory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.support.StaticListableBeanFactory;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.core.task.support.TaskExecutorAdapter;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DocumentPipelineServiceTest {

    private static final String PRESCRIPTION_TEXT = "AHMET YILMAZ\nTC: 12345678950\nReçete";
    private static final String INSTITUTION_TEXT = "SOSYAL GÜVENLİK KURUMU\nSAĞLIK BAKANLIĞI";

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-05T10:00:00Z"), ZoneOffset.UTC);
    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final OcrEngine ocrEngine = mock(OcrEngine.class);
    private final PipelineProperties properties = new PipelineProperties();

    @TempDir
    Path directory;

    private JsonFileArtifactStore artifactStore;
    private JsonPatientDirectory patients;
    private PipelineRunRegistry registry;
    private DocumentPipelineService service;

    @BeforeEach
    void setUp() {
        properties.getOcr().setTimeout(Duration.ofSeconds(5));
        artifactStore = spy(new JsonFileArtifactStore(directory.resolve("store"), 50_000_000, objectMapper));
        patients = new JsonPatientDirectory(directory.resolve("patients.json"), objectMapper, clock, List.of(
                Patient.of("p-1001", "Ahmet Yılmaz", "12345678950", LocalDate.of(1958, 4, 12), "5321234567"),
                Patient.of("p-1002", "Ayşe Demir", "10000000146", null, null)));
        registry = new PipelineRunRegistry(clock);
        service = newService(new SimpleAsyncTaskExecutor("ocr-test-"), new TaskExecutorAdapter(Runnable::run));
    }

    private DocumentPipelineService newService(AsyncTaskExecutor ocrExecutor, AsyncTaskExecutor pipelineExecutor) {
        UploadValidator validator = new UploadValidator(
                List.of("image/jpeg", "image/png", "image/tiff", "application/pdf"), 16 * 1024 * 1024);
        DocumentPackager packager = new DocumentPackager(new PdfDocumentWriter(),
                new FilenameGenerator(clock, properties), clock, properties);
        DocumentClassifier classifier = new DocumentClassifier(
                new StaticListableBeanFactory().getBeanProvider(ExternalDocumentClassifier.class), properties);
        return new DocumentPipelineService(validator, new PageImageDecoder(properties),
                new DocumentRectifier(List.of(), properties), ocrEngine, new EntityExtractor(),
                new IdentityResolver(properties), classifier, packager,
                artifactStore, patients, new PatientWorkflowService(patients, artifactStore), registry,
                ocrExecutor, pipelineExecutor, properties, clock);
    }

    @Test
    void shouldProcessMatchedPrescriptionEndToEnd() throws IOException {
        when(ocrEngine.extractText(any())).thenReturn(new OcrResult(PRESCRIPTION_TEXT, 0.91));
        List<Integer> steps = new ArrayList<>();

        DocumentProcessingResult result = service.process(png("scan.png"), "run-1",
                (step, total, message) -> steps.add(step));

        assertThat(steps).containsExactly(1, 2, 3, 4, 5, 6, 7, 8);
        assertThat(result.extractedName()).isEqualTo("Ahmet Yılmaz");
        assertThat(result.nationalIdFound()).isTrue();
        assertThat(result.autoAssigned()).isTrue();
        assertThat(result.confirmationRequired()).isFalse();
        assertThat(result.identity().tier()).isEqualTo(MatchTier.HIGH);
        assertThat(result.classification().type()).isEqualTo(DocumentType.PRESCRIPTION);
        assertThat(result.ocrConfidence()).isEqualTo(0.91);

        DocumentArtifact artifact = result.artifact();
        assertThat(artifact.patientId()).isEqualTo("p-1001");
        assertThat(artifact.fileName()).isEqualTo("AHMET_YILMAZ_Recete_20240305_1000.pdf");
        assertThat(artifact.documentRef()).endsWith("/document.pdf");
        assertThat(artifact.originalImageRef()).endsWith("/original.png");
        assertThat(artifact.workflowStatus()).isEqualTo(WorkflowStatus.DOCUMENTS_UPLOADED);
        assertThat(new String(artifactStore.readContent(artifact.documentRef()), 0, 5, StandardCharsets.US_ASCII))
                .isEqualTo("%PDF-");

        RunStatus status = service.status("run-1");
        assertThat(status.stage()).isEqualTo("DONE");
        assertThat(status.step()).isEqualTo(8);
        assertThat(status.artifactId()).isEqualTo(artifact.id());

        Patient patient = patients.findById("p-1001").orElseThrow();
        assertThat(patient.currentStatus()).isEqualTo(WorkflowStatus.DOCUMENTS_UPLOADED);
        assertThat(patient.lastIdentityQuery()).isNotNull();
        assertThat(patient.lastIdentityQuery().runId()).isEqualTo("run-1");
    }

    @Test
    void shouldStoreUnmatchedDocumentWithoutPatient() throws IOException {
        when(ocrEngine.extractText(any())).thenReturn(new OcrResult(INSTITUTION_TEXT, 0.7));

        DocumentProcessingResult result = service.process(png("letter.png"), null, null);

        assertThat(result.extractedName()).isNull();
        assertThat(result.identity().tier()).isEqualTo(MatchTier.NONE);
        assertThat(result.autoAssigned()).isFalse();
        assertThat(result.artifact().patientId()).isNull();
        assertThat(result.artifact().workflowStatus()).isNull();
        assertThat(result.artifact().fileName()).startsWith("BILINMEYEN_HASTA_");
        assertThat(patients.findAll()).allSatisfy(patient -> {
            assertThat(patient.lastIdentityQuery()).isNull();
            assertThat(patient.currentStatus()).isNull();
        });
    }

    @Test
    void shouldReadFirstPageOfPdfUploads() throws IOException {
        when(ocrEngine.extractText(any())).thenReturn(new OcrResult(PRESCRIPTION_TEXT, 0.9));
        byte[] pdf = new PdfDocumentWriter().writeImagePage(page(), 0.9f, "scan");

        DocumentProcessingResult result = service.process(
                new UploadedFile("scan.pdf", "application/pdf", pdf), "run-pdf", null);

        assertThat(result.artifact().originalImageRef()).endsWith("/original.pdf");
        assertThat(service.status("run-pdf").stage()).isEqualTo("DONE");
    }

    @Test
    void shouldReturnStoredResultForCompletedRunId() throws IOException {
        when(ocrEngine.extractText(any())).thenReturn(new OcrResult(PRESCRIPTION_TEXT, 0.9));

        DocumentProcessingResult first = service.process(png("scan.png"), "run-1", null);
        DocumentProcessingResult second = service.process(png("scan.png"), "run-1", null);

        assertThat(second).isEqualTo(first);
        assertThat(artifactStore.list(null)).hasSize(1);
        verify(ocrEngine, times(1)).extractText(any());
    }

    @Test
    void shouldRefuseRunIdThatIsStillProcessing() throws IOException {
        registry.claim("run-1", "scan.png");

        assertThatThrownBy(() -> service.process(png("scan.png"), "run-1", null))
                .isInstanceOf(RunInProgressException.class);
    }

    @Nested
    class Failures {

        @Test
        void shouldFailValidationWithoutCallingOcr() {
            UploadedFile text = new UploadedFile("notes.txt", "text/plain", "hello".getBytes(StandardCharsets.UTF_8));

            assertThatThrownBy(() -> service.process(text, "run-1", null)).isInstanceOf(ValidationException.class);

            RunStatus status = service.status("run-1");
            assertThat(status.stage()).isEqualTo("FAILED");
            assertThat(status.step()).isZero();
            assertThat(status.retryable()).isFalse();
            assertThat(status.error()).isEqualTo("Unsupported file type, allowed types are JPEG, PNG, TIFF and PDF");
            verify(ocrEngine, never()).extractText(any());
        }

        @Test
        void shouldFailUndecodableImage() {
            UploadedFile broken = new UploadedFile("scan.png", "image/png", new byte[]{1, 2, 3, 4});

            assertThatThrownBy(() -> service.process(broken, "run-1", null))
                    .isInstanceOfSatisfying(ValidationException.class, ex -> assertThat(ex.getUserMessage())
                            .isEqualTo("The file could not be read as an image or PDF"));
        }

        @Test
        void shouldFailWhenOcrFails() throws IOException {
            when(ocrEngine.extractText(any())).thenThrow(new ExtractionFailureException("tessdata missing"));

            assertThatThrownBy(() -> service.process(png("scan.png"), "run-1", null))
                    .isInstanceOf(ExtractionFailureException.class)
                    .hasMessage("tessdata missing");

            assertThat(service.status("run-1").stage()).isEqualTo("FAILED");
            assertThat(artifactStore.list(null)).isEmpty();
        }

        @Test
        void shouldWrapUnexpectedOcrErrors() throws IOException {
            when(ocrEngine.extractText(any())).thenThrow(new IllegalStateException("native crash"));

            assertThatThrownBy(() -> service.process(png("scan.png"), "run-1", null))
                    .isInstanceOf(ExtractionFailureException.class)
                    .hasMessageContaining("native crash");
        }

        @Test
        void shouldTimeOutSlowOcr() throws IOException {
            properties.getOcr().setTimeout(Duration.ofMillis(200));
            DocumentPipelineService impatient = newService(new SimpleAsyncTaskExecutor("ocr-slow-"),
                    new TaskExecutorAdapter(Runnable::run));
            when(ocrEngine.extractText(any())).thenAnswer(invocation -> {
                Thread.sleep(5_000);
                return new OcrResult("late", 1.0);
            });

            assertThatThrownBy(() -> impatient.process(png("scan.png"), "run-1", null))
                    .isInstanceOf(ExtractionFailureException.class)
                    .hasMessageContaining("timed out");
            assertThat(impatient.status("run-1").stage()).isEqualTo("FAILED");
        }

        @Test
        void shouldKeepRunningWhenProgressListenerThrows() throws IOException {
            when(ocrEngine.extractText(any())).thenReturn(new OcrResult(PRESCRIPTION_TEXT, 0.9));

            DocumentProcessingResult result = service.process(png("scan.png"), "run-1", (step, total, message) -> {
                throw new IllegalStateException("listener bug");
            });

            assertThat(result.artifact()).isNotNull();
        }
    }

    @Nested
    class Cancellation {

        @Test
        void shouldStopAtNextStageBoundaryAndStoreNothing() throws IOException {
            when(ocrEngine.extractText(any())).thenReturn(new OcrResult(PRESCRIPTION_TEXT, 0.9));
            List<Integer> steps = new ArrayList<>();

            assertThatThrownBy(() -> service.process(png("scan.png"), "run-1", (step, total, message) -> {
                steps.add(step);
                if (step == PipelineStage.EXTRACTING.step()) {
                    service.cancel("run-1");
                }
            })).isInstanceOf(PipelineCancelledException.class);

            assertThat(steps).containsExactly(1, 2, 3, 0);
            assertThat(service.status("run-1").stage()).isEqualTo("CANCELLED");
            assertThat(artifactStore.list(null)).isEmpty();
            assertThat(patients.findById("p-1001").orElseThrow().lastIdentityQuery()).isNull();
        }

        @Test
        void shouldIgnoreCancelOfFinishedRun() throws IOException {
            when(ocrEngine.extractText(any())).thenReturn(new OcrResult(PRESCRIPTION_TEXT, 0.9));
            service.process(png("scan.png"), "run-1", null);

            RunStatus status = service.cancel("run-1");

            assertThat(status.stage()).isEqualTo("DONE");
            assertThat(status.cancelRequested()).isFalse();
        }
    }

    @Nested
    class RetryPersist {

        @Test
        void shouldRetryOnlyTheSaveStep() throws IOException {
            when(ocrEngine.extractText(any())).thenReturn(new OcrResult(PRESCRIPTION_TEXT, 0.9));
            doThrow(new PersistenceException("disk full", new IOException("disk full")))
                    .doCallRealMethod()
                    .when(artifactStore).append(any(), any());

            assertThatThrownBy(() -> service.process(png("scan.png"), "run-1", null))
                    .isInstanceOfSatisfying(PersistenceException.class,
                            ex -> assertThat(ex.getRunId()).isEqualTo("run-1"));
            RunStatus failed = service.status("run-1");
            assertThat(failed.stage()).isEqualTo("FAILED");
            assertThat(failed.retryable()).isTrue();

            DocumentProcessingResult result = service.retryPersist("run-1");

            assertThat(result.artifact().runId()).isEqualTo("run-1");
            assertThat(service.status("run-1").stage()).isEqualTo("DONE");
            assertThat(artifactStore.list(null)).hasSize(1);
            verify(ocrEngine, times(1)).extractText(any());
        }

        @Test
        void shouldRefuseRetryWithoutFailedSave() {
            UploadedFile text = new UploadedFile("notes.txt", "text/plain", new byte[]{1});
            assertThatThrownBy(() -> service.process(text, "run-1", null)).isInstanceOf(ValidationException.class);

            assertThatThrownBy(() -> service.retryPersist("run-1"))
                    .isInstanceOf(InvalidWorkflowTransitionException.class);
            assertThatThrownBy(() -> service.retryPersist("missing")).isInstanceOf(RunNotFoundException.class);
        }

        @Test
        void shouldRefuseRetryOfActiveRun() {
            registry.claim("run-1", "scan.png");

            assertThatThrownBy(() -> service.retryPersist("run-1")).isInstanceOf(RunInProgressException.class);
        }
    }

    @Nested
    class Batch {

        @Test
        void shouldProcessEveryFileAsItsOwnRun() throws IOException {
            when(ocrEngine.extractText(any())).thenReturn(new OcrResult(PRESCRIPTION_TEXT, 0.9));
            UploadedFile broken = new UploadedFile("notes.txt", "text/plain", new byte[]{1});

            List<String> runIds = service.processBatch(List.of(png("a.png"), broken, png("b.png")));

            assertThat(runIds).hasSize(3).doesNotHaveDuplicates();
            assertThat(service.status(runIds.get(0)).stage()).isEqualTo("DONE");
            assertThat(service.status(runIds.get(1)).stage()).isEqualTo("FAILED");
            assertThat(service.status(runIds.get(2)).stage()).isEqualTo("DONE");
            assertThat(artifactStore.list(null)).hasSize(2);
        }

        @Test
        void shouldFailRunsTheQueueRejects() throws IOException {
            AsyncTaskExecutor full = mock(AsyncTaskExecutor.class);
            doThrow(new TaskRejectedException("queue full")).when(full).execute(any(Runnable.class));
            DocumentPipelineService saturated = newService(new SimpleAsyncTaskExecutor(), full);

            List<String> runIds = saturated.processBatch(List.of(png("a.png")));

            RunStatus status = saturated.status(runIds.get(0));
            assertThat(status.stage()).isEqualTo("FAILED");
            assertThat(status.error()).contains("queue is full");
        }
    }

    private static UploadedFile png(String fileName) throws IOException {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        ImageIO.write(page(), "png", output);
        return new UploadedFile(fileName, "image/png", output.toByteArray());
    }

    private static BufferedImage page() {
        BufferedImage image = new BufferedImage(300, 400, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, 300, 400);
        g.setColor(Color.BLACK);
        g.drawString("AHMET YILMAZ", 30, 60);
        g.drawString("Reçete", 30, 90);
        g.dispose();
        return image;
    }
}

package com.example.sgkdocumentreader.service.pipeline;

import com.example.sgkdocumentreader.config.PipelineProperties;
import com.example.sgkdocumentreader.exception.ExtractionFailureException;
import com.example.sgkdocumentreader.exception.InvalidWorkflowTransitionException;
import com.example.sgkdocumentreader.exception.PersistenceException;
import com.example.sgkdocumentreader.exception.PipelineCancelledException;
import com.example.sgkdocumentreader.exception.RunInProgressException;
import com.example.sgkdocumentreader.exception.SgkDocumentException;
import com.example.sgkdocumentreader.exception.ValidationException;
import com.example.sgkdocumentreader.model.ClassificationResult;
import com.example.sgkdocumentreader.model.DocumentArtifact;
import com.example.sgkdocumentreader.model.DocumentProcessingResult;
import com.example.sgkdocumentreader.model.ExtractedEntities;
import com.example.sgkdocumentreader.model.IdentityQuery;
import com.example.sgkdocumentreader.model.IdentityResolution;
import com.example.sgkdocumentreader.model.MatchCandidate;
import com.example.sgkdocumentreader.model.NameCandidate;
import com.example.sgkdocumentreader.model.PackagedDocument;
import com.example.sgkdocumentreader.model.RectifiedImage;
import com.example.sgkdocumentreader.model.RunStatus;
import com.example.sgkdocumentreader.model.UploadedFile;
import com.example.sgkdocumentreader.model.WorkflowStatus;
import com.example.sgkdocumentreader.service.classification.DocumentClassifier;
import com.example.sgkdocumentreader.service.extraction.EntityExtractor;
import com.example.sgkdocumentreader.service.geometry.DocumentRectifier;
import com.example.sgkdocumentreader.service.matching.IdentityResolver;
import com.example.sgkdocumentreader.service.PatientWorkflowService;
import com.example.sgkdocumentreader.service.ocr.OcrEngine;
import com.example.sgkdocumentreader.service.ocr.OcrResult;
import com.example.sgkdocumentreader.service.packaging.DocumentPackager;
import com.example.sgkdocumentreader.service.packaging.PackagingRequest;
import com.example.sgkdocumentreader.service.storage.ArtifactStore;
import com.example.sgkdocumentreader.service.storage.ContentKind;
import com.example.sgkdocumentreader.service.storage.PatientDirectory;
import com.example.sgkdocumentreader.service.storage.StoredContent;
import com.example.sgkdocumentreader.util.ImagePreprocessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs one upload through rectification, OCR, entity extraction, identity
 * resolution, classification, packaging and persistence. Each run moves
 * through {@link PipelineStage}s in order and reports every transition to
 * its {@link ProgressListener}. Exactly one artifact is stored per run id.
 */
@Service
public class DocumentPipelineService {

    private static final Logger log = LoggerFactory.getLogger(DocumentPipelineService.class);

    private final UploadValidator uploadValidator;
    private final PageImageDecoder pageImageDecoder;
    private final DocumentRectifier rectifier;
    private final OcrEngine ocrEngine;
    private final EntityExtractor entityExtractor;
    private final IdentityResolver identityResolver;
    private final DocumentClassifier classifier;
    private final DocumentPackager packager;
    private final ArtifactStore artifactStore;
    private final PatientDirectory patientDirectory;
    private final PatientWorkflowService workflowService;
    private final PipelineRunRegistry runRegistry;
    private final AsyncTaskExecutor ocrExecutor;
    private final AsyncTaskExecutor pipelineExecutor;
    private final Duration ocrTimeout;
    private final Clock clock;

    public DocumentPipelineService(UploadValidator uploadValidator,
                                   PageImageDecoder pageImageDecoder,
                                   DocumentRectifier rectifier,
                                   OcrEngine ocrEngine,
                                   EntityExtractor entityExtractor,
                                   IdentityResolver identityResolver,
                                   DocumentClassifier classifier,
                                   DocumentPackager packager,
                                   ArtifactStore artifactStore,
                                   PatientDirectory patientDirectory,
                                   PatientWorkflowService workflowService,
                                   PipelineRunRegistry runRegistry,
                                   @Qualifier("ocrExecutor") AsyncTaskExecutor ocrExecutor,
                                   @Qualifier("pipelineExecutor") AsyncTaskExecutor pipelineExecutor,
                                   PipelineProperties properties,
                                   Clock clock) {
        this.uploadValidator = uploadValidator;
        this.pageImageDecoder = pageImageDecoder;
        this.rectifier = rectifier;
        this.ocrEngine = ocrEngine;
        this.entityExtractor = entityExtractor;
        this.identityResolver = identityResolver;
        this.classifier = classifier;
        this.packager = packager;
        this.artifactStore = artifactStore;
        this.patientDirectory = patientDirectory;
        this.workflowService = workflowService;
        this.runRegistry = runRegistry;
        this.ocrExecutor = ocrExecutor;
        this.pipelineExecutor = pipelineExecutor;
        this.ocrTimeout = properties.getOcr().getTimeout();
        this.clock = clock;
    }

    public DocumentProcessingResult process(UploadedFile file, String runId, ProgressListener listener) {
        String id = runId == null || runId.isBlank() ? UUID.randomUUID().toString() : runId;
        ProgressListener progress = listener == null ? ProgressListener.NONE : listener;
        PipelineRun run = runRegistry.claim(id, file.fileName());
        if (run.stage() == PipelineStage.DONE) {
            log.info("Run {} already completed, returning the stored result", id);
            return run.result();
        }
        return start(run, file, progress);
    }

    /**
     * Starts every file as its own run on the pipeline executor and returns
     * the run ids immediately. Progress is read through {@link #status(String)}.
     */
    public List<String> processBatch(List<UploadedFile> files) {
        List<String> runIds = new ArrayList<>(files.size());
        for (UploadedFile file : files) {
            String runId = UUID.randomUUID().toString();
            PipelineRun run = runRegistry.claim(runId, file.fileName());
            runIds.add(runId);
            try {
                pipelineExecutor.execute(() -> {
                    try {
                        start(run, file, ProgressListener.NONE);
                    } catch (SgkDocumentException ex) {
                        log.warn("Batch run {} for {} ended in error: {}", runId, file.fileName(), ex.getMessage());
                    } catch (RuntimeException ex) {
                        log.error("Batch run {} for {} crashed", runId, file.fileName(), ex);
                    }
                });
            } catch (TaskRejectedException ex) {
                log.error("Batch queue rejected {}", file.fileName(), ex);
                run.fail("The processing queue is full, retry the upload later", clock.instant());
            }
        }
        log.info("Queued {} file(s) for batch processing", files.size());
        return runIds;
    }

    /** Repeats only the save step of a run whose save failed. */
    public DocumentProcessingResult retryPersist(String runId) {
        PipelineRun run = runRegistry.require(runId);
        if (run.stage() == PipelineStage.DONE) {
            return run.result();
        }
        if (!run.stage().isTerminal()) {
            throw new RunInProgressException(runId);
        }
        if (!run.beginRetry(clock.instant())) {
            throw new InvalidWorkflowTransitionException("Run " + runId + " has no failed save to retry");
        }
        log.info("Retrying persist for run {}", runId);
        return supervise(run, ProgressListener.NONE, () -> commit(run, ProgressListener.NONE));
    }

    public RunStatus status(String runId) {
        return runRegistry.require(runId).snapshot();
    }

    /** Requests cancellation. It takes effect at the next stage boundary. */
    public RunStatus cancel(String runId) {
        PipelineRun run = runRegistry.require(runId);
        if (!run.stage().isTerminal()) {
            run.cancellationToken().cancel();
            log.info("Cancellation requested for run {}", runId);
        }
        return run.snapshot();
    }

    private DocumentProcessingResult start(PipelineRun run, UploadedFile file, ProgressListener progress) {
        log.info("Run {} started for {} ({} bytes)", run.runId(), file.fileName(), file.size());
        report(run, progress);
        return supervise(run, progress, () -> execute(run, file, progress));
    }

    /** Moves the run to its terminal side state when the work throws. */
    private DocumentProcessingResult supervise(PipelineRun run, ProgressListener progress,
                                               Supplier<DocumentProcessingResult> work) {
        try {
            return work.get();
        } catch (PipelineCancelledException ex) {
            run.cancel(clock.instant());
            log.info("Run {} cancelled: {}", run.runId(), ex.getMessage());
            report(run, progress);
            throw ex;
        } catch (SgkDocumentException ex) {
            log.warn("Run {} failed in stage {}: {}", run.runId(), run.stage(), ex.getMessage());
            run.fail(ex.getUserMessage(), clock.instant());
            report(run, progress);
            throw ex;
        } catch (RuntimeException ex) {
            log.error("Run {} failed unexpectedly in stage {}", run.runId(), run.stage(), ex);
            run.fail("Unexpected processing error", clock.instant());
            report(run, progress);
            throw ex;
        }
    }

    private DocumentProcessingResult execute(PipelineRun run, UploadedFile file, ProgressListener progress) {
        String mediaType = uploadValidator.validate(file);
        BufferedImage page = pageImageDecoder.decode(file, mediaType);

        advance(run, PipelineStage.RECTIFYING, progress);
        RectifiedImage rectified = rectifier.rectify(page);

        advance(run, PipelineStage.EXTRACTING, progress);
        byte[] ocrInput = encode(rectified.image(), "png");
        OcrResult ocr = recognize(run.runId(), ocrInput);
        ExtractedEntities entities = entityExtractor.extract(ocr.text());

        advance(run, PipelineStage.RESOLVING, progress);
        IdentityResolution identity = identityResolver.resolve(entities, patientDirectory.findAll());
        Optional<MatchCandidate> best = identity.best();
        boolean autoAssigned = identity.tier().autoAssigns() && best.isPresent();
        String extractedName = entities.nameCandidate().map(NameCandidate::text).orElse(null);
        log.info("Run {} matched tier {} with confidence {}", run.runId(), identity.tier(),
                String.format(Locale.ROOT, "%.3f", identity.confidence()));

        advance(run, PipelineStage.CLASSIFYING, progress);
        ClassificationResult classification = classifier.classify(ocr.text(), file.fileName());

        advance(run, PipelineStage.PACKAGING, progress);
        String patientName = autoAssigned ? best.get().patientName() : extractedName;
        PackagedDocument packaged = packager.pack(new PackagingRequest(rectified, patientName, classification,
                identity.tier(), extractedName != null));

        advance(run, PipelineStage.PERSISTING, progress);
        String patientId = autoAssigned ? best.get().patientId() : null;
        DocumentArtifact draft = new DocumentArtifact(
                UUID.randomUUID().toString(), run.runId(), patientId, classification.type(), packaged.fileName(),
                file.fileName(), null, null, null, ocr.text(), classification.confidence(), identity.confidence(),
                identity.tier(), rectified.boundaryDetected(), packaged.placeholder(),
                patientId != null ? WorkflowStatus.DOCUMENTS_UPLOADED : null, packaged.size(), clock.instant());
        List<StoredContent> contents = List.of(
                new StoredContent(ContentKind.ORIGINAL, file.extension(), file.content()),
                new StoredContent(ContentKind.RECTIFIED, "jpg", encodeForStorage(run.runId(), rectified.image())),
                new StoredContent(ContentKind.DOCUMENT, "pdf", packaged.content()));
        DocumentProcessingResult result = new DocumentProcessingResult(run.runId(), draft, classification, identity,
                extractedName, entities.validNationalId().isPresent(), autoAssigned,
                autoAssigned && identity.tier().requiresConfirmation(), rectified.boundaryDetected(),
                rectified.strategy(), ocr.confidence(), packaged.placeholder(), packaged.attempts());
        IdentityQuery query = identity.tier().isCandidate() && best.isPresent()
                ? new IdentityQuery(run.runId(), clock.instant(), identity.tier(), identity.confidence(), extractedName)
                : null;
        run.retain(new PendingCommit(draft, contents, result, query == null ? null : best.get().patientId(), query));
        return commit(run, progress);
    }

    private DocumentProcessingResult commit(PipelineRun run, ProgressListener progress) {
        run.cancellationToken().throwIfCancelled(run.runId(), PipelineStage.DONE);
        PendingCommit pending = run.pendingCommit();
        DocumentArtifact stored;
        try {
            stored = artifactStore.append(pending.draft(), pending.contents());
        } catch (PersistenceException ex) {
            PersistenceException scoped = ex.getRunId() == null ? ex.forRun(run.runId()) : ex;
            log.error("Run {} failed to persist, document retained for retry", run.runId(), ex);
            throw scoped;
        }
        afterCommit(run.runId(), stored, pending);
        DocumentProcessingResult result = pending.result().withArtifact(artifactStore.find(stored.id()).orElse(stored));
        run.complete(result, clock.instant());
        log.info("Run {} completed as artifact {} ({})", run.runId(), stored.id(), stored.fileName());
        report(run, progress);
        return result;
    }

    private void afterCommit(String runId, DocumentArtifact stored, PendingCommit pending) {
        if (pending.identityQuery() != null) {
            try {
                patientDirectory.recordIdentityQuery(pending.queryPatientId(), pending.identityQuery());
            } catch (RuntimeException ex) {
                log.warn("Could not record identity query of run {} on patient {}", runId, pending.queryPatientId(), ex);
            }
        }
        if (stored.patientId() != null) {
            try {
                workflowService.recordDocumentUpload(stored);
            } catch (RuntimeException ex) {
                log.warn("Workflow update after run {} failed, the document is stored", runId, ex);
            }
        }
    }

    private OcrResult recognize(String runId, byte[] imageBytes) {
        Future<OcrResult> future = ocrExecutor.submit(() -> ocrEngine.extractText(imageBytes));
        try {
            return future.get(ocrTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.error("OCR for run {} timed out after {}", runId, ocrTimeout);
            throw new ExtractionFailureException("OCR timed out after " + ocrTimeout.toSeconds() + "s", ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExtractionFailureException("Interrupted while waiting for OCR", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof ExtractionFailureException extractionFailure) {
                throw extractionFailure;
            }
            log.error("OCR for run {} failed", runId, cause);
            throw new ExtractionFailureException("OCR failed: " + cause.getMessage(), cause);
        }
    }

    private byte[] encode(BufferedImage image, String format) {
        try {
            ByteArrayOutputStream output = new ByteArrayOutputStream();
            if (!ImageIO.write(ImagePreprocessor.toRgb(image), format, output)) {
                throw new ExtractionFailureException("No image writer for " + format);
            }
            return output.toByteArray();
        } catch (IOException ex) {
            throw new ExtractionFailureException("Unable to encode page for OCR", ex);
        }
    }

    private byte[] encodeForStorage(String runId, BufferedImage image) {
        try {
            ByteArrayOutputStream output = new ByteArrayOutputStream();
            ImageIO.write(ImagePreprocessor.toRgb(image), "jpg", output);
            return output.toByteArray();
        } catch (IOException ex) {
            throw new PersistenceException("Unable to encode rectified image", runId, ex);
        }
    }

    private void advance(PipelineRun run, PipelineStage next, ProgressListener progress) {
        run.cancellationToken().throwIfCancelled(run.runId(), next);
        run.transitionTo(next, clock.instant());
        log.debug("Run {} entered {}", run.runId(), next);
        report(run, progress);
    }

    private static void report(PipelineRun run, ProgressListener progress) {
        RunStatus status = run.snapshot();
        try {
            progress.onProgress(status.step(), status.totalSteps(), status.message());
        } catch (RuntimeException ex) {
            log.warn("Progress listener failed for run {}", run.runId(), ex);
        }
    }
}

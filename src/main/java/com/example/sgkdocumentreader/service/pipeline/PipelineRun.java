package com.example.sgkdocumentreader.service.pipeline;

import com.example.sgkdocumentreader.model.DocumentProcessingResult;
import com.example.sgkdocumentreader.model.RunStatus;

import java.time.Instant;

/**
 * Mutable state of one run, shared between the worker thread and status
 * readers. All state changes go through the synchronized methods.
 */
public class PipelineRun {

    private final String runId;
    private final String fileName;
    private final Instant startedAt;
    private final CancellationToken cancellationToken = new CancellationToken();

    private PipelineStage stage = PipelineStage.UPLOADED;
    private Instant updatedAt;
    private String error;
    private DocumentProcessingResult result;
    private PendingCommit pendingCommit;

    PipelineRun(String runId, String fileName, Instant startedAt) {
        this.runId = runId;
        this.fileName = fileName;
        this.startedAt = startedAt;
        this.updatedAt = startedAt;
    }

    public String runId() {
        return runId;
    }

    public CancellationToken cancellationToken() {
        return cancellationToken;
    }

    public synchronized PipelineStage stage() {
        return stage;
    }

    public synchronized DocumentProcessingResult result() {
        return result;
    }

    synchronized PendingCommit pendingCommit() {
        return pendingCommit;
    }

    synchronized void retain(PendingCommit commit) {
        this.pendingCommit = commit;
    }

    synchronized void transitionTo(PipelineStage next, Instant at) {
        if (!stage.canTransitionTo(next)) {
            throw new IllegalStateException("Run " + runId + " cannot move from " + stage + " to " + next);
        }
        if (stage == PipelineStage.FAILED && pendingCommit == null) {
            throw new IllegalStateException("Run " + runId + " has no retained document to save");
        }
        stage = next;
        updatedAt = at;
        if (next != PipelineStage.FAILED) {
            error = null;
        }
    }

    /** Moves a failed run with a retained document back to persisting. */
    synchronized boolean beginRetry(Instant at) {
        if (stage != PipelineStage.FAILED || pendingCommit == null) {
            return false;
        }
        transitionTo(PipelineStage.PERSISTING, at);
        return true;
    }

    /**
     * Records a failure. Failures outside the stages that can fail are
     * defects and are still recorded, so a run never hangs in a working stage.
     */
    synchronized void fail(String message, Instant at) {
        if (stage.isTerminal()) {
            return;
        }
        stage = PipelineStage.FAILED;
        error = message;
        updatedAt = at;
    }

    synchronized void cancel(Instant at) {
        if (stage.canTransitionTo(PipelineStage.CANCELLED)) {
            transitionTo(PipelineStage.CANCELLED, at);
            pendingCommit = null;
        }
    }

    synchronized void complete(DocumentProcessingResult completed, Instant at) {
        transitionTo(PipelineStage.DONE, at);
        result = completed;
        pendingCommit = null;
    }

    public synchronized RunStatus snapshot() {
        return new RunStatus(runId, fileName, stage.name(), stage.step(), PipelineStage.TOTAL_STEPS,
                stage.message(), cancellationToken.isCancelled(),
                stage == PipelineStage.FAILED && pendingCommit != null,
                error,
                result != null && result.artifact() != null ? result.artifact().id() : null,
                startedAt, updatedAt);
    }
}

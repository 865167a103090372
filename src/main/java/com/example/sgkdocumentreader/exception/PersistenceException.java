package com.example.sgkdocumentreader.exception;

/**
 * A write to the artifact or patient store was rejected. When raised from a
 * pipeline run the packaged document stays available for
 * {@code retryPersist(runId)}.
 */
public class PersistenceException extends SgkDocumentException {

    private final String runId;

    public PersistenceException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public PersistenceException(String message, String runId, Throwable cause) {
        this(message, "Saving failed, retry saving this run", runId, cause);
    }

    protected PersistenceException(String message, String userMessage, String runId, Throwable cause) {
        super(message, userMessage, cause);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }

    public PersistenceException forRun(String runId) {
        return new PersistenceException(getMessage(), getUserMessage(), runId, this);
    }
}

package com.example.sgkdocumentreader.model;

/**
 * Discrete verdict derived from the top match confidence.
 */
public enum MatchTier {
    HIGH,
    MEDIUM,
    LOW,
    NONE;

    /** Whether the pipeline links the document to the patient without user action. */
    public boolean autoAssigns() {
        return this == HIGH || this == MEDIUM;
    }

    public boolean requiresConfirmation() {
        return this == MEDIUM;
    }

    public boolean isCandidate() {
        return this != NONE;
    }
}

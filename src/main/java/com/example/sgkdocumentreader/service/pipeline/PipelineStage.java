package com.example.sgkdocumentreader.service.pipeline;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one pipeline run. Forward stages carry their progress step;
 * the side states are terminal.
 */
public enum PipelineStage {
    UPLOADED(1, "Validating upload"),
    RECTIFYING(2, "Detecting document boundary"),
    EXTRACTING(3, "Reading text"),
    RESOLVING(4, "Matching patient"),
    CLASSIFYING(5, "Classifying document"),
    PACKAGING(6, "Building PDF"),
    PERSISTING(7, "Saving document"),
    DONE(8, "Completed"),
    FAILED(0, "Failed"),
    CANCELLED(0, "Cancelled");

    public static final int TOTAL_STEPS = 8;

    private static final Set<PipelineStage> FAILABLE = EnumSet.of(UPLOADED, EXTRACTING, PERSISTING);

    private final int step;
    private final String message;

    PipelineStage(int step, String message) {
        this.step = step;
        this.message = message;
    }

    public int step() {
        return step;
    }

    public String message() {
        return message;
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(PipelineStage next) {
        if (next == null) {
            return false;
        }
        return switch (next) {
            case FAILED -> FAILABLE.contains(this);
            case CANCELLED -> !isTerminal();
            case PERSISTING -> this == PACKAGING || this == FAILED;
            case UPLOADED -> false;
            default -> !isTerminal() && next.ordinal() == ordinal() + 1;
        };
    }
}

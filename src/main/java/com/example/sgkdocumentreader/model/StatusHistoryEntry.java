package com.example.sgkdocumentreader.model;

import java.time.Instant;

public record StatusHistoryEntry(WorkflowStatus status,
                                 String label,
                                 String description,
                                 Instant timestamp,
                                 String note) {

    public static StatusHistoryEntry of(WorkflowStatus status, Instant timestamp, String note) {
        return new StatusHistoryEntry(status, status.label(), status.description(), timestamp, note);
    }
}

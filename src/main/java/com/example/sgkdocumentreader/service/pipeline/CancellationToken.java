package com.example.sgkdocumentreader.service.pipeline;

import com.example.sgkdocumentreader.exception.PipelineCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancel flag. The pipeline looks at it between stages, never
 * in the middle of one.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled(String runId, PipelineStage next) {
        if (cancelled.get()) {
            throw new PipelineCancelledException(runId, next.name());
        }
    }
}

package com.example.sgkdocumentreader.service.pipeline;

import com.example.sgkdocumentreader.exception.RunInProgressException;
import com.example.sgkdocumentreader.exception.RunNotFoundException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory index of runs by id. Claiming a run id is atomic: at most one
 * worker processes a given id at a time.
 */
@Component
public class PipelineRunRegistry {

    private final Map<String, PipelineRun> runs = new ConcurrentHashMap<>();
    private final Clock clock;

    public PipelineRunRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Returns a fresh run, or the finished run when {@code runId} already
     * completed. Failed and cancelled runs are replaced by a fresh attempt.
     *
     * @throws RunInProgressException when another worker holds the id
     */
    public PipelineRun claim(String runId, String fileName) {
        return runs.compute(runId, (id, existing) -> {
            if (existing == null
                    || existing.stage() == PipelineStage.FAILED
                    || existing.stage() == PipelineStage.CANCELLED) {
                return new PipelineRun(id, fileName, clock.instant());
            }
            if (existing.stage() == PipelineStage.DONE) {
                return existing;
            }
            throw new RunInProgressException(id);
        });
    }

    public Optional<PipelineRun> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    public PipelineRun require(String runId) {
        return find(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }
}

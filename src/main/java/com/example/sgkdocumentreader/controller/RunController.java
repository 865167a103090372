package com.example.sgkdocumentreader.controller;

import com.example.sgkdocumentreader.model.DocumentProcessingResult;
import com.example.sgkdocumentreader.model.RunStatus;
import com.example.sgkdocumentreader.service.pipeline.DocumentPipelineService;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/runs")
public class RunController {

    private final DocumentPipelineService pipelineService;

    public RunController(DocumentPipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @Operation(summary = "Progress of a pipeline run")
    @GetMapping("/{runId}")
    public RunStatus status(@PathVariable("runId") String runId) {
        return pipelineService.status(runId);
    }

    @Operation(summary = "Cancel a run", description = "Takes effect at the next stage boundary. Nothing is saved afterwards.")
    @DeleteMapping("/{runId}")
    public RunStatus cancel(@PathVariable("runId") String runId) {
        return pipelineService.cancel(runId);
    }

    @Operation(summary = "Retry saving a run whose save failed", description = "Text recognition is not repeated.")
    @PostMapping("/{runId}/persist")
    public DocumentProcessingResult retryPersist(@PathVariable("runId") String runId) {
        return pipelineService.retryPersist(runId);
    }
}

package com.example.sgkdocumentreader.controller;

import com.example.sgkdocumentreader.exception.ValidationException;
import com.example.sgkdocumentreader.model.BatchUploadResponse;
import com.example.sgkdocumentreader.model.DocumentProcessingResult;
import com.example.sgkdocumentreader.model.ErrorResponse;
import com.example.sgkdocumentreader.model.UploadedFile;
import com.example.sgkdocumentreader.service.pipeline.DocumentPipelineService;
import com.example.sgkdocumentreader.service.pipeline.ProgressListener;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.CollectionUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/v1/documents")
public class DocumentUploadController {

    private static final Logger log = LoggerFactory.getLogger(DocumentUploadController.class);

    private final DocumentPipelineService pipelineService;

    public DocumentUploadController(DocumentPipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @Operation(
            summary = "Process one scanned SGK document",
            description = "Rectifies the page, reads it, matches the patient, classifies it and stores a PDF under "
                    + "the size budget. Repeating a completed runId returns the stored result.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Document processed and stored",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = DocumentProcessingResult.class))),
            @ApiResponse(responseCode = "400", description = "Unsupported, empty, oversized or unreadable file",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "409", description = "The run is already in progress or was cancelled",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "502", description = "Text recognition failed",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "503", description = "Saving failed, retry via the run endpoint",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "507", description = "Storage quota exhausted",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<DocumentProcessingResult> upload(
            @Parameter(description = "Scanned page as JPEG, PNG, TIFF or PDF", required = true)
            @RequestPart("file") MultipartFile file,
            @Parameter(description = "Client-chosen run id for idempotent retries")
            @RequestParam(value = "runId", required = false) String runId) {
        UploadedFile upload = toUploadedFile(file);
        DocumentProcessingResult result = pipelineService.process(upload, runId,
                (step, total, message) -> log.debug("{}: step {}/{} {}", upload.fileName(), step, total, message));
        return ResponseEntity.ok(result);
    }

    @Operation(
            summary = "Process several documents in the background",
            description = "Starts one run per file and returns the run ids. Poll /api/v1/runs/{runId} for progress.")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Runs started",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = BatchUploadResponse.class))),
            @ApiResponse(responseCode = "400", description = "No files provided", content = @Content)
    })
    @PostMapping(value = "/batch", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<BatchUploadResponse> batch(
            @Parameter(description = "One or more scanned pages", required = true)
            @RequestPart("files") List<MultipartFile> files) {
        if (CollectionUtils.isEmpty(files)) {
            throw new ResponseStatusException(BAD_REQUEST, "At least one file must be provided");
        }
        List<UploadedFile> uploads = files.stream().map(DocumentUploadController::toUploadedFile).toList();
        List<String> runIds = pipelineService.processBatch(uploads);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new BatchUploadResponse(runIds));
    }

    static UploadedFile toUploadedFile(MultipartFile file) {
        try {
            return new UploadedFile(file.getOriginalFilename(), file.getContentType(), file.getBytes());
        } catch (IOException ex) {
            log.error("Failed to read upload {}", file.getOriginalFilename(), ex);
            throw new ValidationException("Failed to read upload " + file.getOriginalFilename(),
                    "The upload could not be read, please try again", ex);
        }
    }
}

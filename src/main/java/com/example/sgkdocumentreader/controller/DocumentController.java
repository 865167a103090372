package com.example.sgkdocumentreader.controller;

import com.example.sgkdocumentreader.model.AssignPatientRequest;
import com.example.sgkdocumentreader.model.DocumentArtifact;
import com.example.sgkdocumentreader.model.ErrorResponse;
import com.example.sgkdocumentreader.model.WorkflowUpdateRequest;
import com.example.sgkdocumentreader.service.DocumentArtifactService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.List;

@RestController
@RequestMapping("/api/v1/documents")
public class DocumentController {

    private final DocumentArtifactService artifactService;

    public DocumentController(DocumentArtifactService artifactService) {
        this.artifactService = artifactService;
    }

    @Operation(summary = "List stored documents, newest first, optionally for one patient")
    @GetMapping
    public List<DocumentArtifact> list(
            @Parameter(description = "Only documents linked to this patient")
            @RequestParam(value = "patientId", required = false) String patientId) {
        return artifactService.list(patientId);
    }

    @Operation(summary = "Get one stored document")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Document found"),
            @ApiResponse(responseCode = "404", description = "Unknown document",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/{id}")
    public DocumentArtifact get(@PathVariable("id") String id) {
        return artifactService.get(id);
    }

    @Operation(summary = "Download the packaged PDF of a document")
    @GetMapping(value = "/{id}/content", produces = MediaType.APPLICATION_PDF_VALUE)
    public ResponseEntity<byte[]> content(@PathVariable("id") String id) {
        DocumentArtifact artifact = artifactService.get(id);
        byte[] pdf = artifactService.content(artifact);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_PDF)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(artifact.fileName(), StandardCharsets.UTF_8)
                        .build()
                        .toString())
                .body(pdf);
    }

    @Operation(
            summary = "Link a document to a patient",
            description = "Manual assignment. Clears the patient's pending identity query and records the upload "
                    + "on the patient's SGK workflow.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Document re-linked"),
            @ApiResponse(responseCode = "404", description = "Unknown document or patient",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PutMapping(value = "/{id}/patient", consumes = MediaType.APPLICATION_JSON_VALUE)
    public DocumentArtifact assignPatient(@PathVariable("id") String id,
                                          @Valid @RequestBody AssignPatientRequest request) {
        return artifactService.assignPatient(id, request.patientId());
    }

    @Operation(summary = "Advance the workflow status of a document")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Status advanced"),
            @ApiResponse(responseCode = "409", description = "The status would move backwards",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PatchMapping(value = "/{id}/workflow", consumes = MediaType.APPLICATION_JSON_VALUE)
    public DocumentArtifact advanceWorkflow(@PathVariable("id") String id,
                                            @Valid @RequestBody WorkflowUpdateRequest request) {
        return artifactService.advanceWorkflow(id, request.status());
    }
}

package com.example.sgkdocumentreader.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Runs started for a batch upload, in upload order")
public record BatchUploadResponse(List<String> runIds) {

    public BatchUploadResponse {
        runIds = runIds == null ? List.of() : List.copyOf(runIds);
    }
}

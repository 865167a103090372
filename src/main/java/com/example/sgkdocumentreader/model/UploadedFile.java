package com.example.sgkdocumentreader.model;

import java.util.Objects;

/**
 * Raw upload handed to the pipeline. Lives only for the duration of one run.
 */
public record UploadedFile(String fileName, String mediaType, byte[] content) {

    public UploadedFile {
        Objects.requireNonNull(content, "content");
        if (fileName == null || fileName.isBlank()) {
            fileName = "document";
        }
    }

    public long size() {
        return content.length;
    }

    public String extension() {
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 && dot < fileName.length() - 1 ? fileName.substring(dot + 1) : "";
    }
}

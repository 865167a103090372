package com.example.sgkdocumentreader.model;

import java.util.List;
import java.util.Objects;

public record PackagedDocument(byte[] content,
                               String fileName,
                               List<CompressionAttempt> attempts,
                               boolean placeholder) {

    public PackagedDocument {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(fileName, "fileName");
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public long size() {
        return content.length;
    }
}

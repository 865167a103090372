package com.example.sgkdocumentreader.service.storage;

/** Binary payloads kept next to an artifact. */
public enum ContentKind {
    ORIGINAL("original"),
    RECTIFIED("rectified"),
    DOCUMENT("document");

    private final String baseName;

    ContentKind(String baseName) {
        this.baseName = baseName;
    }

    public String baseName() {
        return baseName;
    }
}

package com.example.sgkdocumentreader.service.storage;

import java.util.Locale;
import java.util.Objects;

public record StoredContent(ContentKind kind, String extension, byte[] bytes) {

    public StoredContent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(bytes, "bytes");
        extension = extension == null || extension.isBlank()
                ? "bin"
                : extension.replaceAll("[^A-Za-z0-9]", "").toLowerCase(Locale.ROOT);
        if (extension.isEmpty()) {
            extension = "bin";
        }
    }

    public String fileName() {
        return kind.baseName() + "." + extension;
    }

    public long size() {
        return bytes.length;
    }
}

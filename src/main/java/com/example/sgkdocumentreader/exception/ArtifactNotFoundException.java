package com.example.sgkdocumentreader.exception;

public class ArtifactNotFoundException extends SgkDocumentException {

    public ArtifactNotFoundException(String id) {
        super("Artifact not found: " + id, "No artifact exists with id " + id);
    }
}

package com.example.sgkdocumentreader.exception;

public class RunNotFoundException extends SgkDocumentException {

    public RunNotFoundException(String id) {
        super("Run not found: " + id, "No run exists with id " + id);
    }
}

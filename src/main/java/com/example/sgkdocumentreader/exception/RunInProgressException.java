package com.example.sgkdocumentreader.exception;

public class RunInProgressException extends SgkDocumentException {

    public RunInProgressException(String runId) {
        super("Run " + runId + " is already being processed",
                "This upload is still being processed, wait for it to finish");
    }
}

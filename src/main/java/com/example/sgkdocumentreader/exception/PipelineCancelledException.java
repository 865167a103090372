package com.example.sgkdocumentreader.exception;

public class PipelineCancelledException extends SgkDocumentException {

    public PipelineCancelledException(String runId, String stage) {
        super("Run " + runId + " cancelled before " + stage,
                "Processing was cancelled, nothing was saved");
    }
}

package com.example.sgkdocumentreader.exception;

/** The OCR collaborator failed or timed out. Fatal for the run. */
public class ExtractionFailureException extends SgkDocumentException {

    private static final String USER_MESSAGE = "Text recognition failed, please retry the upload";

    public ExtractionFailureException(String message) {
        super(message, USER_MESSAGE);
    }

    public ExtractionFailureException(String message, Throwable cause) {
        super(message, USER_MESSAGE, cause);
    }
}

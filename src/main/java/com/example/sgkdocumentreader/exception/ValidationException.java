package com.example.sgkdocumentreader.exception;

/** Upload rejected before any pipeline stage ran. */
public class ValidationException extends SgkDocumentException {

    public ValidationException(String message, String userMessage) {
        super(message, userMessage);
    }

    public ValidationException(String message, String userMessage, Throwable cause) {
        super(message, userMessage, cause);
    }
}

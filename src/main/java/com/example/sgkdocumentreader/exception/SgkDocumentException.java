package com.example.sgkdocumentreader.exception;

/**
 * Base type for failures surfaced to the uploader. Every subclass carries a
 * message that tells the user what to do next, separate from the technical
 * message that ends up in the logs.
 */
public abstract class SgkDocumentException extends RuntimeException {

    private final String userMessage;

    protected SgkDocumentException(String message, String userMessage) {
        super(message);
        this.userMessage = userMessage;
    }

    protected SgkDocumentException(String message, String userMessage, Throwable cause) {
        super(message, cause);
        this.userMessage = userMessage;
    }

    public String getUserMessage() {
        return userMessage;
    }
}

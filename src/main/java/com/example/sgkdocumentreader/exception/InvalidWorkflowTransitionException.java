package com.example.sgkdocumentreader.exception;

public class InvalidWorkflowTransitionException extends SgkDocumentException {

    public InvalidWorkflowTransitionException(String message) {
        super(message, message);
    }
}

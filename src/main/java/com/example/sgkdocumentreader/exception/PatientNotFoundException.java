package com.example.sgkdocumentreader.exception;

public class PatientNotFoundException extends SgkDocumentException {

    public PatientNotFoundException(String id) {
        super("Patient not found: " + id, "No patient exists with id " + id);
    }
}

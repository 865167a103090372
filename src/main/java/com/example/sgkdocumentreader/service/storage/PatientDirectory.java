package com.example.sgkdocumentreader.service.storage;

import com.example.sgkdocumentreader.model.IdentityQuery;
import com.example.sgkdocumentreader.model.Patient;
import com.example.sgkdocumentreader.model.WorkflowStatus;

import java.util.List;
import java.util.Optional;

public interface PatientDirectory {

    List<Patient> findAll();

    Optional<Patient> findById(String id);

    /** Appends a history entry and makes {@code status} current. History is never rewritten. */
    Patient setWorkflowStatus(String patientId, WorkflowStatus status, String note);

    Patient recordIdentityQuery(String patientId, IdentityQuery query);

    Patient clearIdentityQuery(String patientId);
}

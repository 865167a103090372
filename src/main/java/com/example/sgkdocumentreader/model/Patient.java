package com.example.sgkdocumentreader.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Patient as seen by the pipeline. Only the workflow fields and the last
 * identity query are ever written back.
 */
public record Patient(String id,
                      String fullName,
                      String nationalId,
                      LocalDate birthDate,
                      String phone,
                      WorkflowStatus currentStatus,
                      List<StatusHistoryEntry> statusHistory,
                      IdentityQuery lastIdentityQuery) {

    public Patient {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Patient id must not be blank");
        }
        statusHistory = statusHistory == null ? List.of() : List.copyOf(statusHistory);
    }

    public static Patient of(String id, String fullName, String nationalId, LocalDate birthDate, String phone) {
        return new Patient(id, fullName, nationalId, birthDate, phone, null, List.of(), null);
    }

    public Patient withStatus(StatusHistoryEntry entry) {
        List<StatusHistoryEntry> history = new ArrayList<>(statusHistory);
        history.add(entry);
        return new Patient(id, fullName, nationalId, birthDate, phone, entry.status(), history, lastIdentityQuery);
    }

    public Patient withLastIdentityQuery(IdentityQuery query) {
        return new Patient(id, fullName, nationalId, birthDate, phone, currentStatus, statusHistory, query);
    }
}

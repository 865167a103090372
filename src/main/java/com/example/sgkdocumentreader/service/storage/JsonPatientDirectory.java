package com.example.sgkdocumentreader.service.storage;

import com.example.sgkdocumentreader.exception.PatientNotFoundException;
import com.example.sgkdocumentreader.exception.PersistenceException;
import com.example.sgkdocumentreader.model.IdentityQuery;
import com.example.sgkdocumentreader.model.Patient;
import com.example.sgkdocumentreader.model.StatusHistoryEntry;
import com.example.sgkdocumentreader.model.WorkflowStatus;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Patient records kept in a single JSON file. The file is created from the
 * seed list the first time the directory is opened.
 */
public class JsonPatientDirectory implements PatientDirectory {

    private static final Logger log = LoggerFactory.getLogger(JsonPatientDirectory.class);

    private static final TypeReference<List<Patient>> PATIENT_LIST = new TypeReference<>() {
    };

    private final ReentrantLock lock = new ReentrantLock();
    private final Path file;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final List<Patient> patients;

    public JsonPatientDirectory(Path file, ObjectMapper objectMapper, Clock clock, List<Patient> seed) {
        this.file = file.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
        this.clock = clock;
        try {
            if (Files.isRegularFile(this.file)) {
                this.patients = new ArrayList<>(objectMapper.readValue(this.file.toFile(), PATIENT_LIST));
            } else {
                this.patients = new ArrayList<>(seed == null ? List.of() : seed);
                if (this.file.getParent() != null) {
                    Files.createDirectories(this.file.getParent());
                }
                write(this.patients);
            }
        } catch (IOException ex) {
            log.error("Unable to open patient directory {}", this.file, ex);
            throw new PersistenceException("Unable to open patient directory " + this.file, ex);
        }
        log.info("Patient directory {} holds {} patient(s)", this.file, patients.size());
    }

    @Override
    public List<Patient> findAll() {
        lock.lock();
        try {
            return List.copyOf(patients);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Patient> findById(String id) {
        lock.lock();
        try {
            return patients.stream().filter(patient -> patient.id().equals(id)).findFirst();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Patient setWorkflowStatus(String patientId, WorkflowStatus status, String note) {
        Objects.requireNonNull(status, "status");
        Patient updated = modify(patientId,
                patient -> patient.withStatus(StatusHistoryEntry.of(status, clock.instant(), note)));
        log.info("Patient {} moved to workflow status {}", patientId, status);
        return updated;
    }

    @Override
    public Patient recordIdentityQuery(String patientId, IdentityQuery query) {
        Objects.requireNonNull(query, "query");
        return modify(patientId, patient -> patient.withLastIdentityQuery(query));
    }

    @Override
    public Patient clearIdentityQuery(String patientId) {
        return modify(patientId, patient -> patient.withLastIdentityQuery(null));
    }

    private Patient modify(String patientId, UnaryOperator<Patient> change) {
        lock.lock();
        try {
            int index = -1;
            for (int i = 0; i < patients.size(); i++) {
                if (patients.get(i).id().equals(patientId)) {
                    index = i;
                    break;
                }
            }
            if (index < 0) {
                throw new PatientNotFoundException(patientId);
            }
            Patient changed = change.apply(patients.get(index));
            List<Patient> snapshot = new ArrayList<>(patients);
            snapshot.set(index, changed);
            try {
                write(snapshot);
            } catch (IOException ex) {
                log.error("Failed to save patient {}", patientId, ex);
                throw new PersistenceException("Failed to save patient " + patientId, ex);
            }
            patients.set(index, changed);
            return changed;
        } finally {
            lock.unlock();
        }
    }

    private void write(List<Patient> snapshot) throws IOException {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}

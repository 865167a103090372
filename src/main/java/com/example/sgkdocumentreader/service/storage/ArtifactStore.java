package com.example.sgkdocumentreader.service.storage;

import com.example.sgkdocumentreader.model.DocumentArtifact;

import java.util.List;
import java.util.Optional;

/**
 * Durable home of document artifacts and their binary content.
 */
public interface ArtifactStore {

    /**
     * Stores the artifact together with its content. A second call with the
     * same run id stores nothing and returns the artifact of the first call.
     *
     * @return the stored artifact with its content references filled in
     * @throws com.example.sgkdocumentreader.exception.StorageQuotaExceededException when the content does not fit
     * @throws com.example.sgkdocumentreader.exception.PersistenceException on any other write failure
     */
    DocumentArtifact append(DocumentArtifact artifact, List<StoredContent> contents);

    /** All artifacts when {@code patientId} is null, newest first. */
    List<DocumentArtifact> list(String patientId);

    Optional<DocumentArtifact> find(String id);

    Optional<DocumentArtifact> findByRunId(String runId);

    DocumentArtifact update(String id, ArtifactPatch patch);

    byte[] readContent(String ref);
}

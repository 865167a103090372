package com.example.sgkdocumentreader.service.storage;

import com.example.sgkdocumentreader.exception.ArtifactNotFoundException;
import com.example.sgkdocumentreader.exception.PersistenceException;
import com.example.sgkdocumentreader.exception.StorageQuotaExceededException;
import com.example.sgkdocumentreader.model.DocumentArtifact;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Keeps the artifact index in {@code artifacts.json} and each artifact's
 * binaries under {@code content/<artifactId>/}. Every read-modify-write of
 * the index holds one lock, and the index file is replaced atomically.
 */
public class JsonFileArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileArtifactStore.class);

    private static final TypeReference<List<DocumentArtifact>> ARTIFACT_LIST = new TypeReference<>() {
    };

    private final ReentrantLock lock = new ReentrantLock();
    private final ObjectMapper objectMapper;
    private final Path indexFile;
    private final Path contentRoot;
    private final long quotaBytes;
    private final List<DocumentArtifact> artifacts;
    private long usedBytes;

    public JsonFileArtifactStore(Path directory, long quotaBytes, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.quotaBytes = quotaBytes;
        Path base = directory.toAbsolutePath().normalize();
        this.indexFile = base.resolve("artifacts.json");
        this.contentRoot = base.resolve("content");
        try {
            Files.createDirectories(contentRoot);
            this.artifacts = Files.isRegularFile(indexFile)
                    ? new ArrayList<>(objectMapper.readValue(indexFile.toFile(), ARTIFACT_LIST))
                    : new ArrayList<>();
            this.usedBytes = directorySize(contentRoot);
        } catch (IOException ex) {
            log.error("Unable to open artifact store at {}", base, ex);
            throw new PersistenceException("Unable to open artifact store at " + base, ex);
        }
        log.info("Artifact store at {} holds {} artifact(s), {} bytes of content", base, artifacts.size(), usedBytes);
    }

    @Override
    public DocumentArtifact append(DocumentArtifact artifact, List<StoredContent> contents) {
        Objects.requireNonNull(artifact, "artifact");
        lock.lock();
        try {
            Optional<DocumentArtifact> existing = findByRunIdLocked(artifact.runId());
            if (existing.isPresent()) {
                log.info("Run {} already committed as artifact {}", artifact.runId(), existing.get().id());
                return existing.get();
            }
            long required = contents.stream().mapToLong(StoredContent::size).sum();
            long available = Math.max(0, quotaBytes - usedBytes);
            if (required > available) {
                log.warn("Rejecting artifact for run {}: {} bytes needed, {} available", artifact.runId(), required, available);
                throw new StorageQuotaExceededException(required, available);
            }

            Path artifactDir = contentRoot.resolve(artifact.id());
            Map<ContentKind, String> refs = new EnumMap<>(ContentKind.class);
            try {
                Files.createDirectories(artifactDir);
                for (StoredContent content : contents) {
                    Files.write(artifactDir.resolve(content.fileName()), content.bytes());
                    refs.put(content.kind(), artifact.id() + "/" + content.fileName());
                }
                DocumentArtifact stored = artifact.withContentRefs(
                        refs.get(ContentKind.ORIGINAL), refs.get(ContentKind.RECTIFIED), refs.get(ContentKind.DOCUMENT));
                List<DocumentArtifact> updated = new ArrayList<>(artifacts);
                updated.add(stored);
                writeIndex(updated);
                artifacts.add(stored);
                usedBytes += required;
                log.info("Stored artifact {} for run {} ({} bytes)", stored.id(), stored.runId(), required);
                return stored;
            } catch (IOException ex) {
                deleteQuietly(artifactDir);
                log.error("Failed to store artifact for run {}", artifact.runId(), ex);
                throw new PersistenceException("Failed to store artifact for run " + artifact.runId(), artifact.runId(), ex);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<DocumentArtifact> list(String patientId) {
        lock.lock();
        try {
            return artifacts.stream()
                    .filter(artifact -> patientId == null || patientId.equals(artifact.patientId()))
                    .sorted(Comparator.comparing(DocumentArtifact::createdAt).reversed()
                            .thenComparing(DocumentArtifact::id))
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<DocumentArtifact> find(String id) {
        lock.lock();
        try {
            return artifacts.stream().filter(artifact -> artifact.id().equals(id)).findFirst();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<DocumentArtifact> findByRunId(String runId) {
        lock.lock();
        try {
            return findByRunIdLocked(runId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public DocumentArtifact update(String id, ArtifactPatch patch) {
        lock.lock();
        try {
            int index = indexOf(id);
            if (index < 0) {
                throw new ArtifactNotFoundException(id);
            }
            DocumentArtifact patched = patch.applyTo(artifacts.get(index));
            List<DocumentArtifact> updated = new ArrayList<>(artifacts);
            updated.set(index, patched);
            try {
                writeIndex(updated);
            } catch (IOException ex) {
                log.error("Failed to update artifact {}", id, ex);
                throw new PersistenceException("Failed to update artifact " + id, ex);
            }
            artifacts.set(index, patched);
            return patched;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public byte[] readContent(String ref) {
        if (ref == null || ref.isBlank()) {
            throw new ArtifactNotFoundException(String.valueOf(ref));
        }
        Path file = contentRoot.resolve(ref).normalize();
        if (!file.startsWith(contentRoot)) {
            throw new IllegalArgumentException("Content reference escapes the store: " + ref);
        }
        if (!Files.isRegularFile(file)) {
            throw new ArtifactNotFoundException(ref);
        }
        try {
            return Files.readAllBytes(file);
        } catch (IOException ex) {
            log.error("Failed to read content {}", ref, ex);
            throw new PersistenceException("Failed to read content " + ref, ex);
        }
    }

    long usedBytes() {
        lock.lock();
        try {
            return usedBytes;
        } finally {
            lock.unlock();
        }
    }

    private Optional<DocumentArtifact> findByRunIdLocked(String runId) {
        return artifacts.stream().filter(artifact -> artifact.runId().equals(runId)).findFirst();
    }

    private int indexOf(String id) {
        for (int i = 0; i < artifacts.size(); i++) {
            if (artifacts.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    private void writeIndex(List<DocumentArtifact> snapshot) throws IOException {
        Path temp = indexFile.resolveSibling(indexFile.getFileName() + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
        Files.move(temp, indexFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private static long directorySize(Path root) throws IOException {
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(Files::isRegularFile).mapToLong(path -> {
                try {
                    return Files.size(path);
                } catch (IOException ex) {
                    throw new UncheckedIOException(ex);
                }
            }).sum();
        } catch (UncheckedIOException ex) {
            throw ex.getCause();
        }
    }

    private static void deleteQuietly(Path directory) {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException ex) {
                    log.warn("Could not remove partial content {}", path, ex);
                }
            });
        } catch (IOException ex) {
            log.warn("Could not clean up {}", directory, ex);
        }
    }
}

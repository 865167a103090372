package com.example.sgkdocumentreader.exception;

public class StorageQuotaExceededException extends PersistenceException {

    private static final String USER_MESSAGE = "Storage is full, free up storage by deleting old documents";

    private final long requiredBytes;
    private final long availableBytes;

    public StorageQuotaExceededException(long requiredBytes, long availableBytes) {
        this(requiredBytes, availableBytes, null);
    }

    private StorageQuotaExceededException(long requiredBytes, long availableBytes, String runId) {
        super(String.format("Storage quota exceeded: %d bytes required, %d bytes available",
                requiredBytes, availableBytes), USER_MESSAGE, runId, null);
        this.requiredBytes = requiredBytes;
        this.availableBytes = availableBytes;
    }

    public long getRequiredBytes() {
        return requiredBytes;
    }

    public long getAvailableBytes() {
        return availableBytes;
    }

    @Override
    public PersistenceException forRun(String runId) {
        return new StorageQuotaExceededException(requiredBytes, availableBytes, runId);
    }
}

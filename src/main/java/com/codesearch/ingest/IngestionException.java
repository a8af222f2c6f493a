package com.codesearch.ingest;

public class IngestionException extends RuntimeException {
    private final int storedRecords;

    public IngestionException(String message, int storedRecords, Throwable cause) {
        super(message, cause);
        this.storedRecords = storedRecords;
    }

    /** Records that were already written before the failure; they stay in the store. */
    public int storedRecords() {
        return storedRecords;
    }
}

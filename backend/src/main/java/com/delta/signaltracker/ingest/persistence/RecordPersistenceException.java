package com.delta.signaltracker.ingest.persistence;

public class RecordPersistenceException extends RuntimeException {

    public RecordPersistenceException(String message) {
        super(message);
    }

    public RecordPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.delta.signaltracker.ingest.embedding;

public class EmbeddingBackendUnavailableException extends RuntimeException {
    private final String reasonCode;

    public EmbeddingBackendUnavailableException(String reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }

    public EmbeddingBackendUnavailableException(String reasonCode, String message, Throwable cause) {
        super(message, cause);
        this.reasonCode = reasonCode;
    }

    public String reasonCode() {
        return reasonCode;
    }
}

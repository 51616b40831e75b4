package com.delta.signaltracker.ingest.plugin;

/**
 * Base of the per-fetch failures a plugin may raise. Each subtype maps to one
 * {@link com.delta.signaltracker.ingest.model.PluginError} code.
 */
public abstract class SourceFetchException extends RuntimeException {
    private final String source;
    private final String reasonCode;

    protected SourceFetchException(String source, String reasonCode, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.reasonCode = reasonCode;
    }

    public String source() {
        return source;
    }

    public String reasonCode() {
        return reasonCode;
    }

    public abstract String errorCode();

    public abstract boolean isRetryable();
}

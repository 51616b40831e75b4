package com.delta.signaltracker.ingest.plugin;

import com.delta.signaltracker.ingest.model.PluginError;

public class SourceUnavailableException extends SourceFetchException {

    public SourceUnavailableException(String source, String reasonCode, String message) {
        super(source, reasonCode, message, null);
    }

    public SourceUnavailableException(String source, String reasonCode, String message, Throwable cause) {
        super(source, reasonCode, message, cause);
    }

    @Override
    public String errorCode() {
        return PluginError.SOURCE_UNAVAILABLE;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}

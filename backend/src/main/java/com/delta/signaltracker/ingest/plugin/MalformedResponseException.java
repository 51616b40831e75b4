package com.delta.signaltracker.ingest.plugin;

import com.delta.signaltracker.ingest.model.PluginError;
import com.delta.signaltracker.ingest.util.ReasonCodeClassifier;

public class MalformedResponseException extends SourceFetchException {

    public MalformedResponseException(String source, String message) {
        super(source, ReasonCodeClassifier.PARSING_FAILED, message, null);
    }

    public MalformedResponseException(String source, String message, Throwable cause) {
        super(source, ReasonCodeClassifier.PARSING_FAILED, message, cause);
    }

    @Override
    public String errorCode() {
        return PluginError.MALFORMED_RESPONSE;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}

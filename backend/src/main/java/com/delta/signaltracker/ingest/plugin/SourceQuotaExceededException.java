package com.delta.signaltracker.ingest.plugin;

import com.delta.signaltracker.ingest.model.PluginError;
import com.delta.signaltracker.ingest.util.ReasonCodeClassifier;

import java.time.Duration;

public class SourceQuotaExceededException extends SourceFetchException {
    private final Duration retryAfter;

    public SourceQuotaExceededException(String source, String message, Duration retryAfter) {
        super(source, ReasonCodeClassifier.HTTP_429_RATE_LIMIT, message, null);
        this.retryAfter = retryAfter;
    }

    /**
     * Provider hint for how long to stay away, or null when none was given.
     */
    public Duration retryAfter() {
        return retryAfter;
    }

    @Override
    public String errorCode() {
        return PluginError.SOURCE_QUOTA_EXCEEDED;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}

package com.delta.signaltracker.ingest.model;

public record PluginError(
    String pluginName,
    String errorCode,
    String reasonCode,
    String message
) {
    public static final String SOURCE_UNAVAILABLE = "SOURCE_UNAVAILABLE";
    public static final String SOURCE_QUOTA_EXCEEDED = "SOURCE_QUOTA_EXCEEDED";
    public static final String MALFORMED_RESPONSE = "MALFORMED_RESPONSE";
    public static final String RATE_LIMIT_TIMEOUT = "RATE_LIMIT_TIMEOUT";
    public static final String FETCH_TIMEOUT = "FETCH_TIMEOUT";
    public static final String CANCELLED = "CANCELLED";
    public static final String UNEXPECTED_ERROR = "UNEXPECTED_ERROR";
}

package com.delta.signaltracker.ingest.filter;

public record FilterExplanation(
    String title,
    double score,
    double threshold,
    Decision decision,
    String error
) {
    public enum Decision {
        KEEP,
        FILTER_OUT
    }
}

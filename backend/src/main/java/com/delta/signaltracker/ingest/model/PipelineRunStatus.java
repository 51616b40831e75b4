package com.delta.signaltracker.ingest.model;

public enum PipelineRunStatus {
    PENDING,
    FETCHING_ALL,
    FILTERING,
    COMPLETED,
    PARTIALLY_FAILED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == PARTIALLY_FAILED || this == FAILED;
    }
}

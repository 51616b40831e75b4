package com.delta.signaltracker.ingest.model;

import java.time.Instant;
import java.util.List;

public record PipelineRunView(
    long runId,
    String companyName,
    PipelineRunStatus status,
    Instant startedAt,
    Instant finishedAt,
    List<String> plugins,
    int fetched,
    int accepted,
    int rejected,
    int failed,
    List<PluginError> pluginErrors,
    boolean cancelled,
    String failureReason,
    String persistenceError
) {
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}

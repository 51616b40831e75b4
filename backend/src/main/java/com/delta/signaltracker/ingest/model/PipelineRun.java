package com.delta.signaltracker.ingest.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one pipeline execution. Only the orchestrator mutates it; readers take
 * {@link #snapshot()} copies. Counters only grow and every mutator fails once the run has
 * reached a terminal status.
 */
public class PipelineRun {
    private final long runId;
    private final CompanyTarget target;
    private final Instant startedAt;

    private PipelineRunStatus status = PipelineRunStatus.PENDING;
    private List<String> plugins = List.of();
    private int fetched;
    private int accepted;
    private int rejected;
    private int failed;
    private final List<PluginError> pluginErrors = new ArrayList<>();
    private Instant finishedAt;
    private String failureReason;
    private String persistenceError;
    private volatile boolean cancelRequested;

    public PipelineRun(long runId, CompanyTarget target, Instant startedAt) {
        this.runId = runId;
        this.target = target;
        this.startedAt = startedAt;
    }

    public long runId() {
        return runId;
    }

    public CompanyTarget target() {
        return target;
    }

    public synchronized PipelineRunStatus status() {
        return status;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public void requestCancel() {
        cancelRequested = true;
    }

    public synchronized void startFetching(List<String> pluginNames) {
        transition(PipelineRunStatus.PENDING, PipelineRunStatus.FETCHING_ALL);
        plugins = List.copyOf(pluginNames);
    }

    public synchronized void startFiltering() {
        transition(PipelineRunStatus.FETCHING_ALL, PipelineRunStatus.FILTERING);
    }

    public synchronized void recordFetched(int count) {
        ensureOpen();
        fetched += requireNonNegative(count);
    }

    public synchronized void recordFilterOutcome(int acceptedCount, int rejectedCount, int failedCount) {
        ensureOpen();
        accepted += requireNonNegative(acceptedCount);
        rejected += requireNonNegative(rejectedCount);
        failed += requireNonNegative(failedCount);
    }

    public synchronized void recordFailedRecords(int count) {
        ensureOpen();
        failed += requireNonNegative(count);
    }

    public synchronized void recordPluginError(PluginError error) {
        ensureOpen();
        pluginErrors.add(error);
    }

    public synchronized void recordPersistenceError(String message) {
        ensureOpen();
        persistenceError = message;
    }

    public synchronized void complete(PipelineRunStatus terminalStatus, Instant at) {
        ensureOpen();
        if (terminalStatus != PipelineRunStatus.COMPLETED && terminalStatus != PipelineRunStatus.PARTIALLY_FAILED) {
            throw new IllegalArgumentException("Run can only complete as COMPLETED or PARTIALLY_FAILED");
        }
        status = terminalStatus;
        finishedAt = at;
    }

    public synchronized void completeWithError(String reason, Instant at) {
        ensureOpen();
        failureReason = reason;
        status = PipelineRunStatus.PARTIALLY_FAILED;
        finishedAt = at;
    }

    /**
     * Fatal startup failure: only legal before any fetch was dispatched.
     */
    public synchronized void fail(String reason, Instant at) {
        if (status != PipelineRunStatus.PENDING) {
            throw new IllegalStateException("Run " + runId + " can only fail from PENDING, was " + status);
        }
        failureReason = reason;
        status = PipelineRunStatus.FAILED;
        finishedAt = at;
    }

    public synchronized PipelineRunView snapshot() {
        return new PipelineRunView(
            runId,
            target == null ? null : target.name(),
            status,
            startedAt,
            finishedAt,
            plugins,
            fetched,
            accepted,
            rejected,
            failed,
            List.copyOf(pluginErrors),
            cancelRequested,
            failureReason,
            persistenceError
        );
    }

    private void transition(PipelineRunStatus expected, PipelineRunStatus next) {
        if (status != expected) {
            throw new IllegalStateException("Run " + runId + " expected " + expected + " but was " + status);
        }
        status = next;
    }

    private void ensureOpen() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Run " + runId + " is frozen in status " + status);
        }
    }

    private static int requireNonNegative(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("counts never decrease, got " + count);
        }
        return count;
    }
}

package com.delta.signaltracker.ingest.service;

import com.delta.signaltracker.config.IngestionProperties;
import com.delta.signaltracker.ingest.filter.FilterResult;
import com.delta.signaltracker.ingest.filter.ReferenceQueryBuilder;
import com.delta.signaltracker.ingest.filter.SemanticFilteringEngine;
import com.delta.signaltracker.ingest.model.CompanyTarget;
import com.delta.signaltracker.ingest.model.PipelineRun;
import com.delta.signaltracker.ingest.model.PipelineRunRequest;
import com.delta.signaltracker.ingest.model.PipelineRunStatus;
import com.delta.signaltracker.ingest.model.PipelineRunView;
import com.delta.signaltracker.ingest.model.PluginError;
import com.delta.signaltracker.ingest.model.RawRecord;
import com.delta.signaltracker.ingest.persistence.ScoredRecordSink;
import com.delta.signaltracker.ingest.plugin.MalformedResponseException;
import com.delta.signaltracker.ingest.plugin.PluginRegistry;
import com.delta.signaltracker.ingest.plugin.SourcePlugin;
import com.delta.signaltracker.ingest.plugin.SourceQuotaExceededException;
import com.delta.signaltracker.ingest.plugin.SourceUnavailableException;
import com.delta.signaltracker.ingest.plugin.UnknownPluginException;
import com.delta.signaltracker.ingest.ratelimit.GlobalConcurrencyLimiter;
import com.delta.signaltracker.ingest.ratelimit.RateLimitTimeoutException;
import com.delta.signaltracker.ingest.ratelimit.SourceThrottle;
import com.delta.signaltracker.ingest.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Service
public class PipelineOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestratorService.class);
    private static final int MAX_RETAINED_RUNS = 200;

    private final PluginRegistry registry;
    private final GlobalConcurrencyLimiter concurrencyLimiter;
    private final SourceThrottle sourceThrottle;
    private final SemanticFilteringEngine filteringEngine;
    private final ScoredRecordSink sink;
    private final ExecutorService pipelineExecutor;
    private final ExecutorService pipelineRunExecutor;
    private final IngestionProperties properties;

    private final AtomicLong runIds = new AtomicLong();
    private final Map<Long, PipelineRun> runs = new ConcurrentSkipListMap<>();

    public PipelineOrchestratorService(
        PluginRegistry registry,
        GlobalConcurrencyLimiter concurrencyLimiter,
        SourceThrottle sourceThrottle,
        SemanticFilteringEngine filteringEngine,
        ScoredRecordSink sink,
        @Qualifier("pipelineExecutor") ExecutorService pipelineExecutor,
        @Qualifier("pipelineRunExecutor") ExecutorService pipelineRunExecutor,
        IngestionProperties properties
    ) {
        this.registry = registry;
        this.concurrencyLimiter = concurrencyLimiter;
        this.sourceThrottle = sourceThrottle;
        this.filteringEngine = filteringEngine;
        this.sink = sink;
        this.pipelineExecutor = pipelineExecutor;
        this.pipelineRunExecutor = pipelineRunExecutor;
        this.properties = properties;
    }

    public PipelineRunView run(CompanyTarget target, PipelineRunRequest request) {
        PipelineRun run = newRun(target);
        return execute(run, request);
    }

    public long startAsync(CompanyTarget target, PipelineRunRequest request) {
        PipelineRun run = newRun(target);
        pipelineRunExecutor.submit(() -> execute(run, request));
        return run.runId();
    }

    public Optional<PipelineRunView> snapshot(long runId) {
        PipelineRun run = runs.get(runId);
        return run == null ? Optional.empty() : Optional.of(run.snapshot());
    }

    /**
     * Stops dispatching new fetches for the run; fetches already in flight are awaited.
     * Returns false when the run is unknown or already finished.
     */
    public boolean cancel(long runId) {
        PipelineRun run = runs.get(runId);
        if (run == null || run.status().isTerminal()) {
            return false;
        }
        run.requestCancel();
        log.info("Cancellation requested for pipeline run {}", runId);
        return true;
    }

    private PipelineRun newRun(CompanyTarget target) {
        PipelineRun run = new PipelineRun(runIds.incrementAndGet(), target, Instant.now());
        runs.put(run.runId(), run);
        return run;
    }

    private PipelineRunView execute(PipelineRun run, PipelineRunRequest request) {
        long runId = run.runId();
        CompanyTarget target = run.target();
        PipelineRunRequest effective = request == null ? PipelineRunRequest.defaults() : request;
        try {
            List<SourcePlugin> plugins;
            String referenceQuery;
            double threshold;
            try {
                if (target == null || !target.hasName()) {
                    throw new IllegalArgumentException("Company target must have a non-empty name");
                }
                if (effective.since() != null && effective.since().isAfter(Instant.now())) {
                    throw new IllegalArgumentException("since must not be in the future: " + effective.since());
                }
                threshold = effective.threshold() == null
                    ? properties.getFilter().getThreshold()
                    : effective.threshold();
                if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
                    throw new IllegalArgumentException("threshold must be within [0,1], got " + threshold);
                }
                List<String> keywords = effective.keywords() == null
                    ? properties.getFilter().getKeywords()
                    : effective.keywords();
                referenceQuery = ReferenceQueryBuilder.build(target, keywords);
                if (referenceQuery.isBlank()) {
                    throw new IllegalArgumentException("reference query is empty");
                }
                List<String> names = effective.normalizedSources();
                if (names.isEmpty()) {
                    names = PipelineRunRequest.forSources(properties.getActiveSources()).normalizedSources();
                }
                plugins = registry.resolve(names);
            } catch (UnknownPluginException | IllegalArgumentException e) {
                log.warn("Pipeline run {} rejected: {}", runId, e.getMessage());
                run.fail(e.getMessage(), Instant.now());
                return run.snapshot();
            }

            List<String> pluginNames = plugins.stream().map(SourcePlugin::name).collect(Collectors.toList());
            run.startFetching(pluginNames);
            log.info("Pipeline run {} for '{}' fetching from {}", runId, target.name(), pluginNames);
            List<PluginOutcome> outcomes = fetchAll(run, plugins, target, effective.since());

            run.startFiltering();
            List<RawRecord> records = new ArrayList<>();
            int mismatched = 0;
            boolean anySucceeded = false;
            for (PluginOutcome outcome : outcomes) {
                if (!outcome.succeeded()) {
                    run.recordPluginError(outcome.error());
                    continue;
                }
                anySucceeded = true;
                for (RawRecord record : outcome.records()) {
                    if (outcome.pluginName().equals(record.source())) {
                        records.add(record);
                    } else {
                        mismatched++;
                    }
                }
            }
            if (mismatched > 0) {
                log.warn("Pipeline run {} dropped {} record(s) carrying a foreign source name", runId, mismatched);
            }
            run.recordFetched(records.size() + mismatched);
            run.recordFailedRecords(mismatched);

            FilterResult result = filteringEngine.filter(records, referenceQuery, threshold);
            run.recordFilterOutcome(result.accepted().size(), result.rejected(), result.failed());

            try {
                sink.save(target, result.accepted());
            } catch (RuntimeException e) {
                log.warn("Pipeline run {} could not persist {} record(s)", runId, result.accepted().size(), e);
                run.recordPersistenceError(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            }

            boolean allPluginsFailed = !plugins.isEmpty() && !anySucceeded;
            PipelineRunStatus status = allPluginsFailed || run.isCancelRequested()
                ? PipelineRunStatus.PARTIALLY_FAILED
                : PipelineRunStatus.COMPLETED;
            run.complete(status, Instant.now());
            log.info(
                "Pipeline run {} finished {}: fetched={} accepted={} rejected={} failed={}",
                runId,
                status,
                run.snapshot().fetched(),
                result.accepted().size(),
                result.rejected(),
                run.snapshot().failed()
            );
        } catch (RuntimeException e) {
            log.warn("Pipeline run {} failed", runId, e);
            String reason = "exception=" + e.getClass().getSimpleName() + ": " + e.getMessage();
            if (run.status() == PipelineRunStatus.PENDING) {
                run.fail(reason, Instant.now());
            } else if (!run.status().isTerminal()) {
                run.completeWithError(reason, Instant.now());
            }
        } finally {
            pruneFinishedRuns();
        }
        return run.snapshot();
    }

    private List<PluginOutcome> fetchAll(
        PipelineRun run,
        List<SourcePlugin> plugins,
        CompanyTarget target,
        Instant since
    ) {
        List<Future<PluginOutcome>> futures = new ArrayList<>();
        for (SourcePlugin plugin : plugins) {
            futures.add(pipelineExecutor.submit(() -> fetchOne(run, plugin, target, since)));
        }
        Duration fetchTimeout = Duration.ofSeconds(properties.getFetchTimeoutSeconds());
        long deadline = System.nanoTime() + fetchTimeout.toNanos();

        List<PluginOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            String pluginName = plugins.get(i).name();
            Future<PluginOutcome> future = futures.get(i);
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                outcomes.add(future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Plugin {} did not finish within {}s", pluginName, fetchTimeout.toSeconds());
                outcomes.add(PluginOutcome.failure(
                    pluginName,
                    PluginError.FETCH_TIMEOUT,
                    ReasonCodeClassifier.TIMEOUT,
                    "No result within " + fetchTimeout.toSeconds() + "s"
                ));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.warn("Plugin {} task crashed", pluginName, cause);
                outcomes.add(PluginOutcome.failure(
                    pluginName,
                    PluginError.UNEXPECTED_ERROR,
                    ReasonCodeClassifier.UNKNOWN,
                    cause.getClass().getSimpleName() + ": " + cause.getMessage()
                ));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                run.requestCancel();
                future.cancel(true);
                outcomes.add(PluginOutcome.failure(
                    pluginName,
                    PluginError.CANCELLED,
                    ReasonCodeClassifier.INTERRUPTED,
                    "Interrupted while waiting for plugin"
                ));
            }
        }
        return outcomes;
    }

    private PluginOutcome fetchOne(PipelineRun run, SourcePlugin plugin, CompanyTarget target, Instant since) {
        String source = plugin.name();
        if (run.isCancelRequested()) {
            return PluginOutcome.cancelled(source);
        }
        String jobName = "run-" + run.runId() + ":" + source;
        try (GlobalConcurrencyLimiter.Permit permit = concurrencyLimiter.acquire(jobName, properties.acquireTimeout())) {
            int maxAttempts = properties.getFetchMaxAttempts();
            SourceUnavailableException lastUnavailable = null;
            for (int attempt = 1; ; attempt++) {
                if (run.isCancelRequested()) {
                    return PluginOutcome.cancelled(source);
                }
                try {
                    sourceThrottle.acquire(source, properties.acquireTimeout());
                } catch (RateLimitTimeoutException e) {
                    if (lastUnavailable == null) {
                        throw e;
                    }
                    log.warn("Plugin {} got no token for retry {}: {}", source, attempt, e.getMessage());
                    return PluginOutcome.failure(
                        source,
                        lastUnavailable.errorCode(),
                        lastUnavailable.reasonCode(),
                        lastUnavailable.getMessage()
                    );
                }
                try (Stream<RawRecord> stream = plugin.fetch(target, since)) {
                    List<RawRecord> records = stream.collect(Collectors.toList());
                    log.info("Plugin {} returned {} record(s) (attempt {})", source, records.size(), attempt);
                    return PluginOutcome.success(source, records);
                } catch (SourceUnavailableException e) {
                    lastUnavailable = e;
                    if (attempt >= maxAttempts || run.isCancelRequested()) {
                        log.warn("Plugin {} unavailable after {} attempt(s): {}", source, attempt, e.getMessage());
                        return PluginOutcome.failure(source, e.errorCode(), e.reasonCode(), e.getMessage());
                    }
                    log.info("Plugin {} unavailable (attempt {}/{}), retrying: {}", source, attempt, maxAttempts, e.getMessage());
                    if (!sleepBackoff(attempt)) {
                        return PluginOutcome.cancelled(source);
                    }
                }
            }
        } catch (SourceQuotaExceededException e) {
            Duration backoff = e.retryAfter() == null || e.retryAfter().isZero() || e.retryAfter().isNegative()
                ? Duration.ofSeconds(properties.getQuotaBackoffSeconds())
                : e.retryAfter();
            sourceThrottle.backoff(source, backoff);
            log.warn("Plugin {} hit its provider quota, backing off {}s", source, backoff.toSeconds());
            return PluginOutcome.failure(source, e.errorCode(), e.reasonCode(), e.getMessage());
        } catch (MalformedResponseException e) {
            log.warn("Plugin {} returned an unusable payload: {}", source, e.getMessage());
            return PluginOutcome.failure(source, e.errorCode(), e.reasonCode(), e.getMessage());
        } catch (RateLimitTimeoutException e) {
            log.warn("Plugin {} could not be admitted: {}", source, e.getMessage());
            return PluginOutcome.failure(source, PluginError.RATE_LIMIT_TIMEOUT, ReasonCodeClassifier.TIMEOUT, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Plugin {} failed unexpectedly", source, e);
            return PluginOutcome.failure(
                source,
                PluginError.UNEXPECTED_ERROR,
                ReasonCodeClassifier.UNKNOWN,
                e.getClass().getSimpleName() + ": " + e.getMessage()
            );
        }
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getFetchRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        int maxDelayMs = properties.getFetchRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.max(0, Math.min(attempt - 1, 20)));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        long sleepMs = (delay / 2) + jitter;
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void pruneFinishedRuns() {
        int excess = runs.size() - MAX_RETAINED_RUNS;
        if (excess <= 0) {
            return;
        }
        for (Map.Entry<Long, PipelineRun> entry : runs.entrySet()) {
            if (excess <= 0) {
                break;
            }
            if (entry.getValue().status().isTerminal()) {
                runs.remove(entry.getKey());
                excess--;
            }
        }
    }

    private record PluginOutcome(String pluginName, List<RawRecord> records, PluginError error) {
        static PluginOutcome success(String pluginName, List<RawRecord> records) {
            return new PluginOutcome(pluginName, List.copyOf(records), null);
        }

        static PluginOutcome failure(String pluginName, String errorCode, String reasonCode, String message) {
            return new PluginOutcome(pluginName, List.of(), new PluginError(pluginName, errorCode, reasonCode, message));
        }

        static PluginOutcome cancelled(String pluginName) {
            return failure(pluginName, PluginError.CANCELLED, null, "Run cancelled before fetch started");
        }

        boolean succeeded() {
            return error == null;
        }
    }
}

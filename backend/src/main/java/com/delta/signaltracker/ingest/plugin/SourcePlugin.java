package com.delta.signaltracker.ingest.plugin;

import com.delta.signaltracker.ingest.model.CompanyTarget;
import com.delta.signaltracker.ingest.model.RawRecord;

import java.time.Instant;
import java.util.stream.Stream;

/**
 * Fetches raw records about one company from one external source. Implementations do
 * network I/O only and never persist anything.
 */
public interface SourcePlugin {

    /**
     * Name this instance was registered under; every record it emits carries it.
     */
    String name();

    /**
     * Returns a finite, possibly empty, stream of records. The stream may be lazy and
     * should be closed by the caller.
     *
     * @param target company to research, must have a non-blank name
     * @param since  optional lower bound on publication time, never in the future
     * @throws SourceUnavailableException     transport or auth failure, retryable
     * @throws SourceQuotaExceededException   provider-side throttling
     * @throws MalformedResponseException     unusable payload for this fetch
     * @throws com.delta.signaltracker.ingest.ratelimit.RateLimitTimeoutException
     *                                        a source-side limiter could not admit the call in time
     */
    Stream<RawRecord> fetch(CompanyTarget target, Instant since);

    static void requireValidRequest(CompanyTarget target, Instant since) {
        if (target == null || !target.hasName()) {
            throw new IllegalArgumentException("Company target must have a non-empty name");
        }
        if (since != null && since.isAfter(Instant.now())) {
            throw new IllegalArgumentException("since must not be in the future: " + since);
        }
    }
}

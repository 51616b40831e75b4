package com.delta.signaltracker.ingest.filter;

import com.delta.signaltracker.ingest.model.ScoredRecord;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one filtering pass. {@code accepted} keeps the input order; every input
 * record is counted exactly once across accepted, rejected and failed.
 */
public record FilterResult(
    List<ScoredRecord> accepted,
    int rejected,
    int failed,
    Map<String, Integer> errorCounts
) {
    public FilterResult {
        accepted = List.copyOf(accepted);
        errorCounts = Map.copyOf(errorCounts);
    }

    public static FilterResult empty() {
        return new FilterResult(List.of(), 0, 0, Map.of());
    }

    public int total() {
        return accepted.size() + rejected + failed;
    }
}

package com.delta.signaltracker.ingest.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-run inputs. Null fields fall back to the configured defaults.
 */
public record PipelineRunRequest(
    List<String> sources,
    Instant since,
    Double threshold,
    List<String> keywords
) {
    public static PipelineRunRequest defaults() {
        return new PipelineRunRequest(null, null, null, null);
    }

    public static PipelineRunRequest forSources(List<String> sources) {
        return new PipelineRunRequest(sources, null, null, null);
    }

    public List<String> normalizedSources() {
        if (sources == null) {
            return List.of();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String source : sources) {
            if (source == null) {
                continue;
            }
            String normalized = source.trim();
            if (!normalized.isEmpty()) {
                out.add(normalized);
            }
        }
        return new ArrayList<>(out);
    }
}

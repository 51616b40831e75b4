package com.delta.signaltracker.ingest.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One unfiltered item fetched from a source. The source name is always the name the
 * producing plugin was registered under.
 */
public record RawRecord(
    String source,
    String sourceType,
    String title,
    String body,
    String url,
    Instant publishedAt,
    Map<String, String> metadata
) {
    public RawRecord {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("RawRecord requires a non-empty source name");
        }
        source = source.trim();
        Map<String, String> copy = new LinkedHashMap<>();
        if (metadata != null) {
            metadata.forEach((key, value) -> {
                if (key != null && value != null) {
                    copy.put(key, value);
                }
            });
        }
        metadata = Collections.unmodifiableMap(copy);
    }

    public boolean publishedBefore(Instant cutoff) {
        return cutoff != null && publishedAt != null && publishedAt.isBefore(cutoff);
    }
}

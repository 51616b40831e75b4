package com.delta.signaltracker.ingest.filter;

import com.delta.signaltracker.ingest.model.CompanyTarget;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds the reference text records are compared against: company name, aliases,
 * industry and the configured keywords, case-insensitively de-duplicated.
 */
public final class ReferenceQueryBuilder {
    private ReferenceQueryBuilder() {
    }

    public static String build(CompanyTarget target, List<String> keywords) {
        List<String> parts = new ArrayList<>();
        if (target != null) {
            parts.addAll(target.searchTerms());
            parts.add(target.industry());
        }
        if (keywords != null) {
            parts.addAll(keywords);
        }
        Set<String> seen = new LinkedHashSet<>();
        List<String> kept = new ArrayList<>();
        for (String part : parts) {
            if (part == null || part.isBlank()) {
                continue;
            }
            String trimmed = part.trim();
            if (seen.add(trimmed.toLowerCase(Locale.ROOT))) {
                kept.add(trimmed);
            }
        }
        return String.join(" ", kept);
    }
}

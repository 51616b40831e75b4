package com.delta.signaltracker.ingest.model;

import java.util.ArrayList;
import java.util.List;

public record CompanyTarget(
    String name,
    String industry,
    String city,
    List<String> aliases
) {
    public CompanyTarget {
        name = name == null ? null : name.trim();
        List<String> cleaned = new ArrayList<>();
        if (aliases != null) {
            for (String alias : aliases) {
                if (alias != null && !alias.isBlank()) {
                    cleaned.add(alias.trim());
                }
            }
        }
        aliases = List.copyOf(cleaned);
    }

    public static CompanyTarget of(String name) {
        return new CompanyTarget(name, null, null, List.of());
    }

    public boolean hasName() {
        return name != null && !name.isBlank();
    }

    /**
     * Name followed by the known aliases, used for mention matching.
     */
    public List<String> searchTerms() {
        List<String> terms = new ArrayList<>();
        if (hasName()) {
            terms.add(name);
        }
        terms.addAll(aliases);
        return terms;
    }
}

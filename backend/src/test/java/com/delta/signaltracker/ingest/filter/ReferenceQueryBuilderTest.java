package com.delta.signaltracker.ingest.filter;

import com.delta.signaltracker.ingest.model.CompanyTarget;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ReferenceQueryBuilderTest {

    @Test
    void joinsIdentityAndKeywordsWithoutDuplicates() {
        CompanyTarget target = new CompanyTarget("Acme", "Manufacturing", "Lyon", List.of("ACME Group", " "));

        String query = ReferenceQueryBuilder.build(target, List.of("expansion", "manufacturing", "acme group"));

        assertEquals("Acme ACME Group Manufacturing expansion", query);
    }

    @Test
    void nullKeywordsAreIgnored() {
        assertEquals("Acme", ReferenceQueryBuilder.build(CompanyTarget.of("Acme"), null));
    }
}

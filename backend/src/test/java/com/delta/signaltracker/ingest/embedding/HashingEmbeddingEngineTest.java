package com.delta.signaltracker.ingest.embedding;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HashingEmbeddingEngineTest {
    private final HashingEmbeddingEngine engine = new HashingEmbeddingEngine(256);

    @Test
    void identicalTextGivesIdenticalUnitVectors() {
        float[] first = engine.embed("Acme opens a new plant in Lyon");
        float[] second = engine.embed("Acme opens a new plant in Lyon");

        assertThat(first).hasSize(256).containsExactly(second);
        assertThat(VectorMath.cosineSimilarity(first, first)).isCloseTo(1.0, within(1e-6));
    }

    @Test
    void caseAndPunctuationDoNotChangeTheVector() {
        assertThat(engine.embed("ACME, opens!")).containsExactly(engine.embed("acme opens"));
    }

    @Test
    void relatedTextScoresHigherThanUnrelatedText() {
        float[] reference = engine.embed("Acme industrial expansion new plant");
        double related = VectorMath.cosineSimilarity(reference, engine.embed("Acme announces expansion with a new plant"));
        double unrelated = VectorMath.cosineSimilarity(reference, engine.embed("Rain expected all week in Brittany"));

        assertThat(related).isGreaterThan(unrelated);
    }

    @Test
    void blankTextIsRejected() {
        assertThatThrownBy(() -> engine.embed("   ")).isInstanceOf(EmptyInputException.class);
        assertThatThrownBy(() -> engine.embed(null)).isInstanceOf(EmptyInputException.class);
    }

    @Test
    void zeroVectorHasZeroSimilarity() {
        float[] punctuationOnly = engine.embed("!!!");

        assertThat(VectorMath.cosineSimilarity(punctuationOnly, engine.embed("acme"))).isZero();
    }
}

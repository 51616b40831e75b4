package com.delta.signaltracker.ingest.filter;

import com.delta.signaltracker.config.IngestionProperties;
import com.delta.signaltracker.ingest.embedding.EmbeddingBackendUnavailableException;
import com.delta.signaltracker.ingest.embedding.EmbeddingEngine;
import com.delta.signaltracker.ingest.embedding.EmptyInputException;
import com.delta.signaltracker.ingest.embedding.VectorMath;
import com.delta.signaltracker.ingest.model.RawRecord;
import com.delta.signaltracker.ingest.model.ScoredRecord;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SemanticFilteringEngineTest {
    private static final String QUERY = "acme expansion";

    @Test
    void thresholdIsInclusive() {
        StubEngine engine = new StubEngine()
            .with(QUERY, 1f, 0f, 0f)
            .with("close", 0.8f, 0.6f, 0f);
        SemanticFilteringEngine filter = new SemanticFilteringEngine(engine, properties(3));
        double score = VectorMath.cosineSimilarity(engine.vector("close"), engine.vector(QUERY));
        List<RawRecord> records = List.of(record("close"));

        FilterResult atScore = filter.filter(records, QUERY, score);
        FilterResult justAbove = filter.filter(records, QUERY, Math.nextUp(score));

        assertThat(atScore.accepted()).hasSize(1);
        assertThat(atScore.accepted().get(0).score()).isEqualTo(score);
        assertThat(justAbove.accepted()).isEmpty();
        assertThat(justAbove.rejected()).isEqualTo(1);
    }

    @Test
    void keepsInputOrderAndCountsEveryRecordOnce() {
        StubEngine engine = new StubEngine()
            .with(QUERY, 1f, 0f, 0f)
            .with("first match", 0.9f, 0.1f, 0f)
            .with("unrelated", 0f, 1f, 0f)
            .with("second match", 1f, 0.2f, 0f)
            .with("opposite", -1f, 0f, 0f);
        SemanticFilteringEngine filter = new SemanticFilteringEngine(engine, properties(3));
        List<RawRecord> records = List.of(
            record("first match"),
            record("unrelated"),
            record("second match"),
            new RawRecord("news", "news", "  ", null, null, null, null),
            record("opposite")
        );

        FilterResult result = filter.filter(records, QUERY, 0.5);

        assertThat(result.accepted()).extracting(scored -> scored.record().title())
            .containsExactly("first match", "second match");
        assertThat(result.rejected()).isEqualTo(3);
        assertThat(result.failed()).isZero();
        assertThat(result.total()).isEqualTo(records.size());
        assertThat(result.accepted()).allSatisfy(scored -> assertThat(scored.score()).isBetween(0.5, 1.0));
    }

    @Test
    void negativeSimilarityIsClampedToZero() {
        StubEngine engine = new StubEngine()
            .with(QUERY, 1f, 0f, 0f)
            .with("opposite", -1f, 0f, 0f);
        SemanticFilteringEngine filter = new SemanticFilteringEngine(engine, properties(3));

        FilterResult result = filter.filter(List.of(record("opposite")), QUERY, 0.0);

        assertThat(result.accepted()).singleElement().extracting(ScoredRecord::score).isEqualTo(0.0);
    }

    @Test
    void filteringTwiceGivesTheSameResult() {
        StubEngine engine = new StubEngine()
            .with(QUERY, 1f, 0f, 0f)
            .with("first match", 0.9f, 0.1f, 0f)
            .with("unrelated", 0f, 1f, 0f);
        SemanticFilteringEngine filter = new SemanticFilteringEngine(engine, properties(3));
        List<RawRecord> records = List.of(record("first match"), record("unrelated"));

        assertThat(filter.filter(records, QUERY, 0.4)).isEqualTo(filter.filter(records, QUERY, 0.4));
    }

    @Test
    void retriesTransientFailuresAndIsolatesPermanentOnes() {
        StubEngine engine = new StubEngine()
            .with(QUERY, 1f, 0f, 0f)
            .with("flaky", 1f, 0f, 0f)
            .with("fine", 1f, 0.1f, 0f)
            .failing("flaky", 2)
            .failing("down", Integer.MAX_VALUE);
        SemanticFilteringEngine filter = new SemanticFilteringEngine(engine, properties(3));

        FilterResult result = filter.filter(List.of(record("flaky"), record("down"), record("fine")), QUERY, 0.5);

        assertThat(result.accepted()).extracting(scored -> scored.record().title()).containsExactly("flaky", "fine");
        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.errorCounts()).containsEntry("HTTP_5XX", 1);
        assertThat(engine.calls("down")).isEqualTo(3);
    }

    @Test
    void unembeddableReferenceFailsEveryRecord() {
        StubEngine engine = new StubEngine()
            .with("fine", 1f, 0f, 0f)
            .failing(QUERY, Integer.MAX_VALUE);
        SemanticFilteringEngine filter = new SemanticFilteringEngine(engine, properties(2));

        FilterResult result = filter.filter(List.of(record("fine"), record("fine")), QUERY, 0.1);

        assertThat(result.accepted()).isEmpty();
        assertThat(result.failed()).isEqualTo(2);
        assertThat(engine.calls("fine")).isZero();
    }

    @Test
    void failedBatchFallsBackToOneByOne() {
        StubEngine engine = new StubEngine()
            .with(QUERY, 1f, 0f, 0f)
            .with("first match", 0.9f, 0.1f, 0f)
            .with("unrelated", 0f, 1f, 0f)
            .batchFailing();
        SemanticFilteringEngine filter = new SemanticFilteringEngine(engine, properties(2));

        FilterResult result = filter.filter(List.of(record("first match"), record("unrelated")), QUERY, 0.5);

        assertThat(engine.batchCalls.get()).isEqualTo(2);
        assertThat(result.accepted()).extracting(scored -> scored.record().title()).containsExactly("first match");
        assertThat(result.rejected()).isEqualTo(1);
    }

    @Test
    void textIsWhitespaceCollapsedAndTruncated() {
        IngestionProperties properties = properties(1);
        properties.getFilter().setMaxTextLength(10);
        SemanticFilteringEngine filter = new SemanticFilteringEngine(new StubEngine(), properties);

        String text = filter.prepareText(new RawRecord("news", "news", "Acme\n\n  opens", "a   new plant", null, null, null));

        assertThat(text).isEqualTo("Acme opens");
    }

    @Test
    void emptyInputEmbedsNothing() {
        StubEngine engine = new StubEngine();
        SemanticFilteringEngine filter = new SemanticFilteringEngine(engine, properties(3));

        FilterResult result = filter.filter(List.of(), QUERY, 0.5);

        assertThat(result.total()).isZero();
        assertThat(engine.calls(QUERY)).isZero();
    }

    @Test
    void invalidArgumentsAreRejected() {
        SemanticFilteringEngine filter = new SemanticFilteringEngine(new StubEngine(), properties(3));
        List<RawRecord> records = List.of(record("x"));

        assertThatThrownBy(() -> filter.filter(records, QUERY, 1.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> filter.filter(records, QUERY, -0.1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> filter.filter(records, "  ", 0.5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void explainReportsScoreAndDecision() {
        StubEngine engine = new StubEngine()
            .with(QUERY, 1f, 0f, 0f)
            .with("first match", 0.9f, 0.1f, 0f);
        SemanticFilteringEngine filter = new SemanticFilteringEngine(engine, properties(1));

        FilterExplanation keep = filter.explain(record("first match"), QUERY, 0.5);
        FilterExplanation drop = filter.explain(record("first match"), QUERY, 1.0);
        FilterExplanation broken = filter.explain(record("missing"), QUERY, 0.5);

        assertThat(keep.decision()).isEqualTo(FilterExplanation.Decision.KEEP);
        assertThat(keep.title()).isEqualTo("first match");
        assertThat(drop.decision()).isEqualTo(FilterExplanation.Decision.FILTER_OUT);
        assertThat(broken.error()).isNotNull();
    }

    private static RawRecord record(String title) {
        return new RawRecord("news", "news", title, null, "https://example.com/" + title.hashCode(), null, null);
    }

    private static IngestionProperties properties(int maxAttempts) {
        IngestionProperties properties = new IngestionProperties();
        properties.getFilter().setEmbeddingMaxAttempts(maxAttempts);
        return properties;
    }

    private static final class StubEngine implements EmbeddingEngine {
        private final Map<String, float[]> vectors = new HashMap<>();
        private final Map<String, Integer> failuresLeft = new HashMap<>();
        private final Map<String, AtomicInteger> calls = new HashMap<>();
        private final AtomicInteger batchCalls = new AtomicInteger();
        private boolean batch;

        StubEngine with(String text, float... vector) {
            vectors.put(text, vector);
            return this;
        }

        StubEngine failing(String text, int times) {
            failuresLeft.put(text, times);
            return this;
        }

        StubEngine batchFailing() {
            batch = true;
            return this;
        }

        float[] vector(String text) {
            return vectors.get(text);
        }

        int calls(String text) {
            AtomicInteger count = calls.get(text);
            return count == null ? 0 : count.get();
        }

        @Override
        public int dimension() {
            return 3;
        }

        @Override
        public synchronized float[] embed(String text) {
            if (text == null || text.isBlank()) {
                throw new EmptyInputException();
            }
            calls.computeIfAbsent(text, ignored -> new AtomicInteger()).incrementAndGet();
            int remaining = failuresLeft.getOrDefault(text, 0);
            if (remaining > 0) {
                failuresLeft.put(text, remaining - 1);
                throw new EmbeddingBackendUnavailableException("HTTP_5XX", "backend down for " + text);
            }
            float[] vector = vectors.get(text);
            if (vector == null) {
                throw new IllegalArgumentException("no vector for " + text);
            }
            return vector.clone();
        }

        @Override
        public boolean supportsBatch() {
            return batch;
        }

        @Override
        public List<float[]> embedBatch(List<String> texts) {
            batchCalls.incrementAndGet();
            throw new EmbeddingBackendUnavailableException("HTTP_5XX", "batch endpoint down for " + texts.size());
        }
    }
}

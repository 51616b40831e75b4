package com.delta.signaltracker.ingest.filter;

import com.delta.signaltracker.config.IngestionProperties;
import com.delta.signaltracker.ingest.embedding.EmbeddingBackendUnavailableException;
import com.delta.signaltracker.ingest.embedding.EmbeddingEngine;
import com.delta.signaltracker.ingest.embedding.EmptyInputException;
import com.delta.signaltracker.ingest.embedding.VectorMath;
import com.delta.signaltracker.ingest.model.RawRecord;
import com.delta.signaltracker.ingest.model.ScoredRecord;
import com.delta.signaltracker.ingest.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps the records whose embedding is close enough to a reference query. Scores are
 * cosine similarities clamped to [0,1]; a record is kept when its score is at least the
 * threshold. Embedding failures are isolated per record.
 */
@Service
public class SemanticFilteringEngine {
    private static final Logger log = LoggerFactory.getLogger(SemanticFilteringEngine.class);
    static final String UNEXPECTED_ERROR = "UNEXPECTED_ERROR";

    private final EmbeddingEngine embeddingEngine;
    private final IngestionProperties properties;

    public SemanticFilteringEngine(EmbeddingEngine embeddingEngine, IngestionProperties properties) {
        this.embeddingEngine = embeddingEngine;
        this.properties = properties;
    }

    public FilterResult filter(List<RawRecord> records, String referenceQuery, double threshold) {
        validate(referenceQuery, threshold);
        if (records == null || records.isEmpty()) {
            return FilterResult.empty();
        }

        Map<String, Integer> errorCounts = new LinkedHashMap<>();
        float[] reference;
        try {
            reference = embedWithRetry(referenceQuery.trim());
        } catch (EmbeddingBackendUnavailableException e) {
            log.warn("Reference query could not be embedded, failing {} record(s): {}", records.size(), e.getMessage());
            errorCounts.put(reasonOf(e), records.size());
            return new FilterResult(List.of(), 0, records.size(), errorCounts);
        }

        String[] texts = new String[records.size()];
        for (int i = 0; i < records.size(); i++) {
            texts[i] = prepareText(records.get(i));
        }
        float[][] vectors = embedAll(texts, errorCounts);

        List<ScoredRecord> accepted = new ArrayList<>();
        int rejected = 0;
        int failed = 0;
        for (int i = 0; i < records.size(); i++) {
            RawRecord record = records.get(i);
            if (texts[i].isEmpty()) {
                rejected++;
                continue;
            }
            float[] vector = vectors[i];
            if (vector == null) {
                failed++;
                continue;
            }
            double score;
            try {
                score = clamp(VectorMath.cosineSimilarity(vector, reference));
            } catch (IllegalArgumentException e) {
                log.warn("Cannot score record '{}' from {}: {}", record.title(), record.source(), e.getMessage());
                errorCounts.merge(UNEXPECTED_ERROR, 1, Integer::sum);
                failed++;
                continue;
            }
            if (score >= threshold) {
                accepted.add(new ScoredRecord(record, score, vector));
            } else {
                rejected++;
            }
            log.debug("Record '{}' from {} scored {} (threshold {})", record.title(), record.source(), score, threshold);
        }
        log.info(
            "Filtered {} record(s): {} accepted, {} rejected, {} failed",
            records.size(),
            accepted.size(),
            rejected,
            failed
        );
        return new FilterResult(accepted, rejected, failed, errorCounts);
    }

    /**
     * Scores one record against the reference query without raising.
     */
    public FilterExplanation explain(RawRecord record, String referenceQuery, double threshold) {
        validate(referenceQuery, threshold);
        String title = record.title() == null ? "" : record.title().trim();
        String text = prepareText(record);
        if (text.isEmpty()) {
            return new FilterExplanation(title, 0.0, threshold, FilterExplanation.Decision.FILTER_OUT, "empty text");
        }
        try {
            float[] reference = embedWithRetry(referenceQuery.trim());
            float[] vector = embedWithRetry(text);
            double score = clamp(VectorMath.cosineSimilarity(vector, reference));
            FilterExplanation.Decision decision = score >= threshold
                ? FilterExplanation.Decision.KEEP
                : FilterExplanation.Decision.FILTER_OUT;
            return new FilterExplanation(title, score, threshold, decision, null);
        } catch (EmbeddingBackendUnavailableException | IllegalArgumentException e) {
            return new FilterExplanation(title, 0.0, threshold, FilterExplanation.Decision.FILTER_OUT, e.getMessage());
        }
    }

    String prepareText(RawRecord record) {
        StringBuilder joined = new StringBuilder();
        if (record.title() != null) {
            joined.append(record.title());
        }
        if (record.body() != null) {
            joined.append(' ').append(record.body());
        }
        String collapsed = joined.toString().replaceAll("\\s+", " ").trim();
        int max = properties.getFilter().getMaxTextLength();
        return collapsed.length() > max ? collapsed.substring(0, max).trim() : collapsed;
    }

    private float[][] embedAll(String[] texts, Map<String, Integer> errorCounts) {
        float[][] vectors = new float[texts.length][];
        if (embeddingEngine.supportsBatch()) {
            List<Integer> positions = new ArrayList<>();
            List<String> batch = new ArrayList<>();
            for (int i = 0; i < texts.length; i++) {
                if (!texts[i].isEmpty()) {
                    positions.add(i);
                    batch.add(texts[i]);
                }
            }
            if (batch.isEmpty()) {
                return vectors;
            }
            try {
                List<float[]> embedded = embedBatchWithRetry(batch);
                for (int i = 0; i < positions.size(); i++) {
                    vectors[positions.get(i)] = embedded.get(i);
                }
                return vectors;
            } catch (EmbeddingBackendUnavailableException | EmptyInputException e) {
                log.warn("Batch embedding of {} text(s) failed, falling back to one-by-one: {}", batch.size(), e.getMessage());
            }
        }
        for (int i = 0; i < texts.length; i++) {
            if (texts[i].isEmpty()) {
                continue;
            }
            try {
                vectors[i] = embedWithRetry(texts[i]);
            } catch (EmbeddingBackendUnavailableException e) {
                log.warn("Embedding failed for text #{}: {}", i, e.getMessage());
                errorCounts.merge(reasonOf(e), 1, Integer::sum);
            } catch (EmptyInputException e) {
                // engine considers the cleaned text empty; counted as rejected below
                texts[i] = "";
            }
        }
        return vectors;
    }

    private float[] embedWithRetry(String text) {
        int maxAttempts = properties.getFilter().getEmbeddingMaxAttempts();
        EmbeddingBackendUnavailableException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return embeddingEngine.embed(text);
            } catch (EmbeddingBackendUnavailableException e) {
                last = e;
                log.debug("Embedding attempt {}/{} failed: {}", attempt, maxAttempts, e.getMessage());
            }
        }
        throw last;
    }

    private List<float[]> embedBatchWithRetry(List<String> texts) {
        int maxAttempts = properties.getFilter().getEmbeddingMaxAttempts();
        EmbeddingBackendUnavailableException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                List<float[]> vectors = embeddingEngine.embedBatch(texts);
                if (vectors.size() != texts.size()) {
                    throw new EmbeddingBackendUnavailableException(
                        ReasonCodeClassifier.PARSING_FAILED,
                        "Batch returned " + vectors.size() + " vector(s) for " + texts.size() + " text(s)"
                    );
                }
                return vectors;
            } catch (EmbeddingBackendUnavailableException e) {
                last = e;
                log.debug("Batch embedding attempt {}/{} failed: {}", attempt, maxAttempts, e.getMessage());
            }
        }
        throw last;
    }

    private static void validate(String referenceQuery, double threshold) {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be within [0,1], got " + threshold);
        }
        if (referenceQuery == null || referenceQuery.isBlank()) {
            throw new IllegalArgumentException("reference query must not be blank");
        }
    }

    private static String reasonOf(EmbeddingBackendUnavailableException e) {
        return e.reasonCode() == null ? ReasonCodeClassifier.UNKNOWN : e.reasonCode();
    }

    private static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}

package com.delta.signaltracker.ingest.model;

import java.util.Arrays;

public record ScoredRecord(
    RawRecord record,
    double score,
    float[] embedding
) {
    public ScoredRecord {
        if (record == null) {
            throw new IllegalArgumentException("ScoredRecord requires a record");
        }
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be within [0,1], got " + score);
        }
        embedding = embedding == null ? new float[0] : embedding.clone();
    }

    @Override
    public float[] embedding() {
        return embedding.clone();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ScoredRecord that)) {
            return false;
        }
        return Double.compare(score, that.score) == 0
            && record.equals(that.record)
            && Arrays.equals(embedding, that.embedding);
    }

    @Override
    public int hashCode() {
        int result = record.hashCode();
        result = 31 * result + Double.hashCode(score);
        result = 31 * result + Arrays.hashCode(embedding);
        return result;
    }

    @Override
    public String toString() {
        return "ScoredRecord[source=" + record.source()
            + ", title=" + record.title()
            + ", score=" + score
            + ", dimension=" + embedding.length + "]";
    }
}

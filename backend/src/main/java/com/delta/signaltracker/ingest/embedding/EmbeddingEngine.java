package com.delta.signaltracker.ingest.embedding;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns text into fixed-size vectors. Identical input always yields an identical vector.
 */
public interface EmbeddingEngine {

    int dimension();

    /**
     * @throws EmptyInputException                  when the text is blank after trimming
     * @throws EmbeddingBackendUnavailableException when the provider cannot answer
     */
    float[] embed(String text);

    default boolean supportsBatch() {
        return false;
    }

    default List<float[]> embedBatch(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }
}

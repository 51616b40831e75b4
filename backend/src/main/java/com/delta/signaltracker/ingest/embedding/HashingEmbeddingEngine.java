package com.delta.signaltracker.ingest.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Local feature-hashing embedder: lowercased word tokens and adjacent word bigrams are
 * hashed into a fixed number of buckets with a hash-derived sign, then L2-normalized.
 * Needs no network and is stable across JVMs since it relies on String.hashCode.
 */
public class HashingEmbeddingEngine implements EmbeddingEngine {
    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+");

    private final int dimension;

    public HashingEmbeddingEngine(int dimension) {
        if (dimension < 1) {
            throw new IllegalArgumentException("dimension must be positive, got " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmptyInputException();
        }
        List<String> tokens = tokenize(text);
        float[] vector = new float[dimension];
        String previous = null;
        for (String token : tokens) {
            accumulate(vector, token);
            if (previous != null) {
                accumulate(vector, previous + " " + token);
            }
            previous = token;
        }
        return VectorMath.l2Normalize(vector);
    }

    private void accumulate(float[] vector, String feature) {
        int hash = feature.hashCode();
        int bucket = Math.floorMod(hash, dimension);
        // sign from an independent mix of the same hash
        int mixed = Integer.rotateLeft(hash * 0x9E3779B9, 16);
        vector[bucket] += (mixed & 1) == 0 ? 1.0f : -1.0f;
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }
}

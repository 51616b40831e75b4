package com.delta.signaltracker.ingest.embedding;

import com.delta.signaltracker.ingest.http.SignalHttpClient;
import com.delta.signaltracker.ingest.model.HttpFetchResult;
import com.delta.signaltracker.ingest.util.ReasonCodeClassifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for an OpenAI-compatible embeddings endpoint: POST {"model", "input": [...]},
 * response vectors read from data[].embedding in index order.
 */
public class RemoteEmbeddingEngine implements EmbeddingEngine {
    private static final Logger log = LoggerFactory.getLogger(RemoteEmbeddingEngine.class);

    private final SignalHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String endpoint;
    private final String apiKey;
    private final String model;
    private final int dimension;
    private final Duration timeout;

    public RemoteEmbeddingEngine(
        SignalHttpClient httpClient,
        ObjectMapper objectMapper,
        String endpoint,
        String apiKey,
        String model,
        int dimension,
        Duration timeout
    ) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("Remote embedding provider needs an endpoint");
        }
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.endpoint = endpoint.trim();
        this.apiKey = apiKey;
        this.model = model;
        this.dimension = dimension;
        this.timeout = timeout;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public float[] embed(String text) {
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public boolean supportsBatch() {
        return true;
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        for (String text : texts) {
            if (text == null || text.isBlank()) {
                throw new EmptyInputException();
            }
        }
        ObjectNode request = objectMapper.createObjectNode();
        if (model != null && !model.isBlank()) {
            request.put("model", model);
        }
        ArrayNode input = request.putArray("input");
        texts.forEach(input::add);

        Map<String, String> headers = new LinkedHashMap<>();
        if (apiKey != null && !apiKey.isBlank()) {
            headers.put("Authorization", "Bearer " + apiKey.trim());
        }
        HttpFetchResult response = httpClient.postJson(endpoint, write(request), "application/json", headers, timeout);
        if (!response.isSuccessful()) {
            String reason = ReasonCodeClassifier.fromFetchResult(response);
            log.warn("Embedding request of {} text(s) failed: {}", texts.size(), response.describe());
            throw new EmbeddingBackendUnavailableException(reason, "Embedding endpoint returned " + response.describe());
        }
        return parseVectors(response.body(), texts.size());
    }

    private List<float[]> parseVectors(String body, int expected) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new EmbeddingBackendUnavailableException(ReasonCodeClassifier.PARSING_FAILED, "Invalid embedding JSON", e);
        }
        JsonNode data = root == null ? null : root.path("data");
        if (data == null || !data.isArray() || data.size() != expected) {
            throw new EmbeddingBackendUnavailableException(
                ReasonCodeClassifier.PARSING_FAILED,
                "Expected " + expected + " embedding(s) in data[]"
            );
        }
        float[][] ordered = new float[expected][];
        int position = 0;
        for (JsonNode item : data) {
            int index = item.path("index").asInt(position);
            JsonNode embedding = item.path("embedding");
            if (index < 0 || index >= expected || ordered[index] != null || !embedding.isArray()) {
                throw new EmbeddingBackendUnavailableException(
                    ReasonCodeClassifier.PARSING_FAILED,
                    "Bad embedding entry at position " + position
                );
            }
            if (embedding.size() != dimension) {
                throw new EmbeddingBackendUnavailableException(
                    ReasonCodeClassifier.PARSING_FAILED,
                    "Embedding dimension " + embedding.size() + " does not match configured " + dimension
                );
            }
            float[] vector = new float[dimension];
            for (int i = 0; i < dimension; i++) {
                vector[i] = (float) embedding.get(i).asDouble();
            }
            ordered[index] = vector;
            position++;
        }
        return new ArrayList<>(Arrays.asList(ordered));
    }

    private String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize embedding request", e);
        }
    }
}

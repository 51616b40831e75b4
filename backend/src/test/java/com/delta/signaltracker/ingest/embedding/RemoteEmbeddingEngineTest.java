package com.delta.signaltracker.ingest.embedding;

import com.delta.signaltracker.config.IngestionProperties;
import com.delta.signaltracker.ingest.http.SignalHttpClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RemoteEmbeddingEngineTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private ExecutorService executor;
    private RemoteEmbeddingEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);
        IngestionProperties properties = new IngestionProperties();
        properties.setRequestTimeoutSeconds(5);
        SignalHttpClient httpClient = new SignalHttpClient(properties, executor);
        engine = new RemoteEmbeddingEngine(
            httpClient,
            objectMapper,
            server.url("/v1/embeddings").toString(),
            "secret",
            "test-model",
            3,
            Duration.ofSeconds(5)
        );
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void sendsModelAndInputsAndOrdersVectorsByIndex() throws Exception {
        server.enqueue(new MockResponse().setBody("""
            {"data": [
              {"index": 1, "embedding": [0.0, 1.0, 0.0]},
              {"index": 0, "embedding": [1.0, 0.0, 0.0]}
            ]}
            """));

        List<float[]> vectors = engine.embedBatch(List.of("first text", "second text"));

        assertThat(vectors.get(0)).containsExactly(1.0f, 0.0f, 0.0f);
        assertThat(vectors.get(1)).containsExactly(0.0f, 1.0f, 0.0f);
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer secret");
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("model").asText()).isEqualTo("test-model");
        assertThat(body.path("input").get(1).asText()).isEqualTo("second text");
    }

    @Test
    void serverErrorMeansBackendUnavailable() {
        server.enqueue(new MockResponse().setResponseCode(503));

        assertThatThrownBy(() -> engine.embed("text"))
            .isInstanceOf(EmbeddingBackendUnavailableException.class)
            .satisfies(e -> assertThat(((EmbeddingBackendUnavailableException) e).reasonCode()).isEqualTo("HTTP_5XX"));
    }

    @Test
    void wrongDimensionIsRejected() {
        server.enqueue(new MockResponse().setBody("{\"data\":[{\"index\":0,\"embedding\":[1.0,2.0]}]}"));

        assertThatThrownBy(() -> engine.embed("text"))
            .isInstanceOf(EmbeddingBackendUnavailableException.class)
            .hasMessageContaining("dimension");
    }

    @Test
    void blankInputNeverReachesTheServer() {
        assertThatThrownBy(() -> engine.embed(" ")).isInstanceOf(EmptyInputException.class);
        assertThat(server.getRequestCount()).isZero();
    }
}

package com.delta.signaltracker.ingest;

import com.delta.signaltracker.ingest.embedding.EmbeddingEngine;
import com.delta.signaltracker.ingest.embedding.HashingEmbeddingEngine;
import com.delta.signaltracker.ingest.model.CompanyTarget;
import com.delta.signaltracker.ingest.model.PipelineRunRequest;
import com.delta.signaltracker.ingest.model.PipelineRunStatus;
import com.delta.signaltracker.ingest.model.PipelineRunView;
import com.delta.signaltracker.ingest.model.PluginError;
import com.delta.signaltracker.ingest.plugin.PluginRegistry;
import com.delta.signaltracker.ingest.service.PipelineOrchestratorService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class IngestionContextSmokeTest {

    @Autowired
    private PluginRegistry registry;

    @Autowired
    private EmbeddingEngine embeddingEngine;

    @Autowired
    private PipelineOrchestratorService orchestratorService;

    @Test
    void wiresEnabledSourcesAndDefaultEmbeddings() {
        assertThat(registry.registeredNames()).containsExactly("news");
        assertThat(embeddingEngine).isInstanceOf(HashingEmbeddingEngine.class);
        assertThat(embeddingEngine.dimension()).isEqualTo(384);
    }

    @Test
    void unreachableFeedEndsAsPartialFailure() {
        PipelineRunView view = orchestratorService.run(CompanyTarget.of("Acme"), PipelineRunRequest.defaults());

        assertThat(view.status()).isEqualTo(PipelineRunStatus.PARTIALLY_FAILED);
        assertThat(view.plugins()).isEqualTo(List.of("news"));
        assertThat(view.pluginErrors()).extracting(PluginError::errorCode)
            .containsExactly(PluginError.SOURCE_UNAVAILABLE);
        assertThat(orchestratorService.snapshot(view.runId())).contains(view);
    }

    @Test
    void unknownSourceIsRejected() {
        PipelineRunView view = orchestratorService.run(
            CompanyTarget.of("Acme"),
            PipelineRunRequest.forSources(List.of("blog"))
        );

        assertThat(view.status()).isEqualTo(PipelineRunStatus.FAILED);
    }
}

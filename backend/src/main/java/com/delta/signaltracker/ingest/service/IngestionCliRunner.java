package com.delta.signaltracker.ingest.service;

import com.delta.signaltracker.config.IngestionProperties;
import com.delta.signaltracker.ingest.model.CompanyTarget;
import com.delta.signaltracker.ingest.model.PipelineRunRequest;
import com.delta.signaltracker.ingest.model.PipelineRunStatus;
import com.delta.signaltracker.ingest.model.PipelineRunView;
import com.delta.signaltracker.ingest.model.PluginError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@Component
public class IngestionCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(IngestionCliRunner.class);

    private final IngestionProperties properties;
    private final PipelineOrchestratorService orchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public IngestionCliRunner(
        IngestionProperties properties,
        PipelineOrchestratorService orchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        IngestionProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        CompanyTarget target = new CompanyTarget(
            cli.getCompanyName(),
            cli.getIndustry(),
            cli.getCity(),
            splitCsv(cli.getAliases())
        );
        List<String> sources = splitCsv(cli.getSources());
        PipelineRunRequest request = PipelineRunRequest.forSources(sources);

        PipelineRunView view = orchestratorService.run(target, request);
        log.info(
            "Pipeline run {} for '{}' finished with status {}: fetched={}, accepted={}, rejected={}, failed={}",
            view.runId(),
            view.companyName(),
            view.status(),
            view.fetched(),
            view.accepted(),
            view.rejected(),
            view.failed()
        );
        for (PluginError error : view.pluginErrors()) {
            log.info("Plugin {} failed: {} ({}) {}", error.pluginName(), error.errorCode(), error.reasonCode(), error.message());
        }
        if (view.failureReason() != null) {
            log.info("Failure reason: {}", view.failureReason());
        }
        if (view.persistenceError() != null) {
            log.info("Persistence error: {}", view.persistenceError());
        }

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> view.status() == PipelineRunStatus.FAILED ? 1 : 0);
            System.exit(exitCode);
        }
    }

    static List<String> splitCsv(String value) {
        if (value == null) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .collect(Collectors.toList());
    }
}

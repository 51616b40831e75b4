package com.delta.signaltracker.config;

import com.delta.signaltracker.ingest.embedding.EmbeddingEngine;
import com.delta.signaltracker.ingest.embedding.HashingEmbeddingEngine;
import com.delta.signaltracker.ingest.embedding.RemoteEmbeddingEngine;
import com.delta.signaltracker.ingest.http.SignalHttpClient;
import com.delta.signaltracker.ingest.plugin.LinkedInPlugin;
import com.delta.signaltracker.ingest.plugin.PluginRegistry;
import com.delta.signaltracker.ingest.plugin.RssFeedPlugin;
import com.delta.signaltracker.ingest.ratelimit.CallQuotaTracker;
import com.delta.signaltracker.ingest.ratelimit.GlobalConcurrencyLimiter;
import com.delta.signaltracker.ingest.ratelimit.SourceThrottle;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class IngestionConfig {
    private static final Logger log = LoggerFactory.getLogger(IngestionConfig.class);

    @Bean(name = "pipelineExecutor", destroyMethod = "shutdown")
    public ExecutorService pipelineExecutor(IngestionProperties properties) {
        return Executors.newFixedThreadPool(properties.getGlobalConcurrency());
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(IngestionProperties properties) {
        int size = Math.max(4, properties.getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "pipelineRunExecutor", destroyMethod = "shutdown")
    public ExecutorService pipelineRunExecutor(IngestionProperties properties) {
        return Executors.newFixedThreadPool(properties.getMaxConcurrentRuns());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public GlobalConcurrencyLimiter globalConcurrencyLimiter(IngestionProperties properties) {
        return new GlobalConcurrencyLimiter(properties.getGlobalConcurrency(), properties.getMinDelayBetweenStartsMs());
    }

    @Bean
    public SourceThrottle sourceThrottle(IngestionProperties properties) {
        IngestionProperties.Throttle throttle = properties.getThrottle();
        SourceThrottle.BucketSettings defaults = new SourceThrottle.BucketSettings(
            throttle.getDefaultCapacity(),
            throttle.getDefaultRefillPerSecond()
        );
        Map<String, SourceThrottle.BucketSettings> overrides = new LinkedHashMap<>();
        throttle.getSources().forEach((source, bucket) -> overrides.put(
            source,
            new SourceThrottle.BucketSettings(
                bucket.getCapacity() == null ? defaults.capacity() : bucket.getCapacity(),
                bucket.getRefillPerSecond() == null ? defaults.refillPerSecond() : bucket.getRefillPerSecond()
            )
        ));
        return new SourceThrottle(defaults, overrides);
    }

    @Bean
    public EmbeddingEngine embeddingEngine(
        IngestionProperties properties,
        SignalHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        IngestionProperties.Embedding embedding = properties.getEmbedding();
        String provider = embedding.getProvider() == null ? "hashing" : embedding.getProvider().trim().toLowerCase(Locale.ROOT);
        switch (provider) {
            case "hashing":
                log.info("Using local hashing embeddings (dimension {})", embedding.getDimension());
                return new HashingEmbeddingEngine(embedding.getDimension());
            case "remote":
                log.info("Using remote embeddings at {} (model {})", embedding.getEndpoint(), embedding.getModel());
                return new RemoteEmbeddingEngine(
                    httpClient,
                    objectMapper,
                    embedding.getEndpoint(),
                    embedding.getApiKey(),
                    embedding.getModel(),
                    embedding.getDimension(),
                    Duration.ofSeconds(embedding.getTimeoutSeconds())
                );
            default:
                throw new IllegalStateException("Unknown embedding provider: " + embedding.getProvider());
        }
    }

    @Bean
    public PluginRegistry pluginRegistry(
        IngestionProperties properties,
        SignalHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        PluginRegistry registry = new PluginRegistry();
        properties.getSources().forEach((name, source) -> {
            if (!source.isEnabled()) {
                log.info("Source {} is disabled", name);
                return;
            }
            String type = source.getType() == null ? "" : source.getType().trim().toLowerCase(Locale.ROOT);
            switch (type) {
                case "rss": {
                    List<String> urls = List.copyOf(source.getUrls());
                    registry.register(name, pluginName -> new RssFeedPlugin(
                        pluginName,
                        source.getSourceType(),
                        urls,
                        source.isRequireCompanyMention(),
                        httpClient
                    ));
                    break;
                }
                case "linkedin": {
                    IngestionProperties.LinkedIn settings = source.getLinkedin();
                    CallQuotaTracker quotaTracker = new CallQuotaTracker(
                        settings.getMaxCallsPerHour(),
                        settings.getMaxCallsPerDay(),
                        Duration.ofMillis(settings.getMinDelayBetweenCallsMs()),
                        settings.getMaxConcurrentCalls(),
                        Duration.ofMillis(settings.getRandomDelayMinMs()),
                        Duration.ofMillis(settings.getRandomDelayMaxMs())
                    );
                    registry.register(name, pluginName -> new LinkedInPlugin(
                        pluginName,
                        source.getSourceType(),
                        settings,
                        quotaTracker,
                        httpClient,
                        objectMapper
                    ));
                    break;
                }
                default:
                    throw new IllegalStateException("Source " + name + " has unknown type '" + source.getType() + "'");
            }
        });
        log.info("Registered sources: {}", registry.registeredNames());
        return registry;
    }
}

package com.delta.signaltracker.ingest.persistence;

import com.delta.signaltracker.config.IngestionProperties;
import com.delta.signaltracker.ingest.model.CompanyTarget;
import com.delta.signaltracker.ingest.model.RawRecord;
import com.delta.signaltracker.ingest.model.ScoredRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.text.Normalizer;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Appends accepted records to {@code <output-dir>/<company-slug>.jsonl}, one JSON object
 * per line. Embedding vectors are not written.
 */
@Service
public class JsonLinesRecordSink implements ScoredRecordSink {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesRecordSink.class);

    private final ObjectMapper objectMapper;
    private final IngestionProperties properties;

    public JsonLinesRecordSink(ObjectMapper objectMapper, IngestionProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public synchronized void save(CompanyTarget target, List<ScoredRecord> records) {
        Path file = outputFile(target);
        if (records.isEmpty()) {
            log.info("No accepted records for '{}', nothing written", target.name());
            return;
        }
        Instant savedAt = Instant.now();
        try {
            Files.createDirectories(file.getParent());
            try (BufferedWriter writer = Files.newBufferedWriter(
                file,
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND
            )) {
                for (ScoredRecord scored : records) {
                    writer.write(objectMapper.writeValueAsString(toRow(target, scored, savedAt)));
                    writer.newLine();
                }
            }
        } catch (IOException e) {
            throw new RecordPersistenceException("Unable to write " + records.size() + " record(s) to " + file, e);
        }
        log.info("Wrote {} record(s) for '{}' to {}", records.size(), target.name(), file);
    }

    Path outputFile(CompanyTarget target) {
        return Path.of(properties.getSink().getOutputDir()).resolve(slug(target.name()) + ".jsonl");
    }

    private ObjectNode toRow(CompanyTarget target, ScoredRecord scored, Instant savedAt) {
        RawRecord record = scored.record();
        ObjectNode row = objectMapper.createObjectNode();
        row.put("company", target.name());
        row.put("source", record.source());
        row.put("source_type", record.sourceType());
        row.put("title", record.title());
        row.put("body", record.body());
        row.put("url", record.url());
        row.put("published_at", record.publishedAt() == null ? null : record.publishedAt().toString());
        row.put("score", scored.score());
        row.set("metadata", objectMapper.valueToTree(record.metadata()));
        row.put("saved_at", savedAt.toString());
        return row;
    }

    static String slug(String name) {
        String ascii = Normalizer.normalize(name == null ? "" : name, Normalizer.Form.NFD)
            .replaceAll("\\p{M}+", "");
        String slug = ascii.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", "-")
            .replaceAll("(^-+|-+$)", "");
        return slug.isEmpty() ? "company" : slug;
    }
}

package com.di.suitesplit.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a JSON array of {@link TestStatsRecord} (a historical test-statistics export) and serves
 * one {@link DurationSample} per record with at least one passing run.
 *
 * <p>The file is loaded on first lookup. A missing or unreadable file surfaces as
 * {@link DurationCatalogUnavailableException}.
 */
@Slf4j
public class JsonFileDurationCatalog implements DurationCatalog {

    private static final TypeReference<List<TestStatsRecord>> RECORDS = new TypeReference<>() {};

    private final Path historyFile;
    private final ObjectMapper objectMapper;
    private volatile Map<TestRef, List<DurationSample>> samplesByTest;

    public JsonFileDurationCatalog(Path historyFile) {
        this.historyFile = historyFile;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public List<DurationSample> lookup(TestRef test) {
        return loaded().getOrDefault(test, List.of());
    }

    private Map<TestRef, List<DurationSample>> loaded() {
        Map<TestRef, List<DurationSample>> current = samplesByTest;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (samplesByTest == null) {
                samplesByTest = load();
            }
            return samplesByTest;
        }
    }

    private Map<TestRef, List<DurationSample>> load() {
        if (!Files.isReadable(historyFile)) {
            throw new DurationCatalogUnavailableException("Test history file not readable: " + historyFile);
        }
        List<TestStatsRecord> records;
        try (InputStream in = Files.newInputStream(historyFile)) {
            records = objectMapper.readValue(in, RECORDS);
        } catch (IOException e) {
            throw new DurationCatalogUnavailableException("Failed to read test history " + historyFile, e);
        }
        Map<TestRef, List<DurationSample>> byTest = new HashMap<>();
        int skipped = 0;
        for (TestStatsRecord r : records) {
            if (r.getTestFile() == null || r.getTestFile().isBlank() || r.getNumPass() <= 0
                    || r.getAvgDurationPass() < 0) {
                skipped++;
                continue;
            }
            TestRef ref = TestRef.of(r.getTestFile());
            byTest.computeIfAbsent(ref, k -> new ArrayList<>()).add(DurationSample.builder()
                    .test(ref)
                    .durationSeconds(r.getAvgDurationPass())
                    .observedAt(r.getDate() != null ? r.getDate().atStartOfDay().toInstant(ZoneOffset.UTC) : null)
                    .build());
        }
        byTest.replaceAll((k, v) -> List.copyOf(v));
        log.info("[CATALOG] Loaded {} tests from {} ({} records skipped)", byTest.size(), historyFile, skipped);
        return Map.copyOf(byTest);
    }
}

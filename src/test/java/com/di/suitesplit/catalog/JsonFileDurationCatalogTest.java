package com.di.suitesplit.catalog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JsonFileDurationCatalog Tests")
class JsonFileDurationCatalogTest {

    private static Path fixture() throws URISyntaxException {
        return Path.of(JsonFileDurationCatalogTest.class.getResource("/test-history.json").toURI());
    }

    @Test
    @DisplayName("One sample per record with passing runs, dated at the start of the UTC day")
    void loadsRecords() throws Exception {
        JsonFileDurationCatalog catalog = new JsonFileDurationCatalog(fixture());

        List<DurationSample> samples = catalog.lookup(TestRef.of("jstests/core/find.js"));

        assertEquals(2, samples.size());
        assertEquals(30.0, samples.get(0).getDurationSeconds(), 1e-9);
        assertEquals(Instant.parse("2026-01-10T00:00:00Z"), samples.get(0).getObservedAt());
        assertEquals(50.0, samples.get(1).getDurationSeconds(), 1e-9);
    }

    @Test
    @DisplayName("Records without passing runs are skipped")
    void skipsFailingOnly() throws Exception {
        JsonFileDurationCatalog catalog = new JsonFileDurationCatalog(fixture());

        assertTrue(catalog.lookup(TestRef.of("jstests/core/always_fails.js")).isEmpty());
    }

    @Test
    @DisplayName("Windows-style paths in history are normalized")
    void normalizesPaths() throws Exception {
        JsonFileDurationCatalog catalog = new JsonFileDurationCatalog(fixture());

        assertEquals(1, catalog.lookup(TestRef.of("jstests/core/update.js")).size());
    }

    @Test
    @DisplayName("Missing file surfaces as catalog unavailable")
    void missingFile(@TempDir Path dir) {
        JsonFileDurationCatalog catalog = new JsonFileDurationCatalog(dir.resolve("absent.json"));

        assertThrows(DurationCatalogUnavailableException.class, () -> catalog.lookup(TestRef.of("a.js")));
    }

    @Test
    @DisplayName("Malformed file surfaces as catalog unavailable")
    void malformedFile(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("history.json"), "{ not json");
        JsonFileDurationCatalog catalog = new JsonFileDurationCatalog(file);

        assertThrows(DurationCatalogUnavailableException.class, () -> catalog.lookup(TestRef.of("a.js")));
    }
}

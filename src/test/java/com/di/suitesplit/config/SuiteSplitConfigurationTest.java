package com.di.suitesplit.config;

import com.di.suitesplit.catalog.CachingDurationCatalog;
import com.di.suitesplit.catalog.DurationCatalog;
import com.di.suitesplit.catalog.InMemoryDurationCatalog;
import com.di.suitesplit.catalog.JsonFileDurationCatalog;
import com.di.suitesplit.timeout.TimeoutPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SuiteSplitConfiguration Tests")
class SuiteSplitConfigurationTest {

    private final SuiteSplitConfiguration configuration = new SuiteSplitConfiguration();

    @Test
    @DisplayName("No history file gives an empty in-memory catalog")
    void catalog_noFile() {
        DurationCatalog catalog = configuration.durationCatalog(new CatalogProperties());

        assertInstanceOf(InMemoryDurationCatalog.class, catalog);
    }

    @Test
    @DisplayName("History file is cached unless caching is disabled")
    void catalog_file() {
        CatalogProperties properties = new CatalogProperties();
        properties.setHistoryFile("/tmp/history.json");
        assertInstanceOf(CachingDurationCatalog.class, configuration.durationCatalog(properties));

        properties.getCache().setEnabled(false);
        assertInstanceOf(JsonFileDurationCatalog.class, configuration.durationCatalog(properties));
    }

    @Test
    @DisplayName("Property defaults match the built-in policy and limits")
    void propertyDefaults() {
        assertEquals(TimeoutPolicy.DEFAULT, new TimeoutProperties().toPolicy());

        Instant now = Instant.parse("2026-01-15T00:00:00Z");
        var split = new SuiteSplitProperties().toSplitConfig(now);
        assertEquals(Duration.ofMinutes(60), split.getTargetTimePerSuite());
        assertEquals(5, split.getMaxSubSuites());
        assertEquals(100, split.getMaxTestsPerSuite());
        assertEquals(now.minus(Duration.ofDays(14)), split.getLookbackStart());
    }

    @Test
    @DisplayName("Unknown cost reduction fails at startup")
    void partitioner_unknownReduction() {
        SuiteSplitProperties properties = new SuiteSplitProperties();
        properties.setCostReduction("p99");

        assertThrows(IllegalArgumentException.class, () -> configuration.suitePartitioner(properties));
    }
}

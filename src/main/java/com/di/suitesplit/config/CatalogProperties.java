package com.di.suitesplit.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Where historical durations come from, bound from {@code suitesplit.catalog.*}.
 * Without a history file every split uses the round-robin fallback unless the request carries history.
 */
@Data
@ConfigurationProperties(prefix = "suitesplit.catalog")
public class CatalogProperties {

    /** JSON test-statistics export; blank = no default history. */
    private String historyFile;
    private Cache cache = new Cache();

    @Data
    public static class Cache {
        private boolean enabled = true;
        private long maxSize = 10_000;
        private int expireAfterWriteMinutes = 30;
    }
}

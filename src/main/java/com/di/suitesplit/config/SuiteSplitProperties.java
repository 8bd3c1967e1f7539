package com.di.suitesplit.config;

import com.di.suitesplit.split.SplitConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.Instant;

/**
 * Default split limits.
 *
 * <pre>
 * suitesplit:
 *   split:
 *     target-time-per-suite: 60m
 *     max-sub-suites: 5
 *     max-tests-per-suite: 100
 *     lookback: 14d
 *     cost-reduction: MEAN
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "suitesplit.split")
public class SuiteSplitProperties {

    private Duration targetTimePerSuite = Duration.ofMinutes(60);
    private int maxSubSuites = 5;
    private int maxTestsPerSuite = 100;
    /** History window ending at generation time. */
    private Duration lookback = Duration.ofDays(14);
    /** MEAN, MEDIAN or MAX. */
    private String costReduction = "MEAN";

    /** Split limits with the lookback window ending at {@code now}. */
    public SplitConfig toSplitConfig(Instant now) {
        return SplitConfig.builder()
                .targetTimePerSuite(targetTimePerSuite)
                .maxSubSuites(maxSubSuites)
                .maxTestsPerSuite(maxTestsPerSuite)
                .lookbackStart(now.minus(lookback))
                .lookbackEnd(now)
                .build();
    }
}

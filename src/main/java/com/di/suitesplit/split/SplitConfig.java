package com.di.suitesplit.split;

import com.di.suitesplit.exception.ConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Limits for one split: target runtime per sub-suite, hard caps, and the history window.
 * {@code maxSubSuites * maxTestsPerSuite} may be smaller than the test count; the
 * overflow policy handles that case.
 */
@Value
@Builder(toBuilder = true)
public class SplitConfig {
    Duration targetTimePerSuite;
    int maxSubSuites;
    int maxTestsPerSuite;
    /** Inclusive start of the history window; null = unbounded. */
    Instant lookbackStart;
    /** Inclusive end of the history window; null = unbounded. */
    Instant lookbackEnd;

    public double getTargetSecondsPerSuite() {
        return targetTimePerSuite.toMillis() / 1000.0;
    }

    /**
     * @throws ConfigurationException if a cap is below 1 or the target time is not positive
     */
    public void validate() {
        if (maxSubSuites < 1) {
            throw new ConfigurationException("maxSubSuites must be >= 1, got " + maxSubSuites);
        }
        if (maxTestsPerSuite < 1) {
            throw new ConfigurationException("maxTestsPerSuite must be >= 1, got " + maxTestsPerSuite);
        }
        if (targetTimePerSuite == null || targetTimePerSuite.isZero() || targetTimePerSuite.isNegative()) {
            throw new ConfigurationException("targetTimePerSuite must be positive, got " + targetTimePerSuite);
        }
        if (lookbackStart != null && lookbackEnd != null && lookbackStart.isAfter(lookbackEnd)) {
            throw new ConfigurationException("lookback window start " + lookbackStart + " is after end " + lookbackEnd);
        }
    }
}

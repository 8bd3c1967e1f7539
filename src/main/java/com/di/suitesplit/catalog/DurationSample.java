package com.di.suitesplit.catalog;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One observed execution of a test, as reported by the historical statistics source.
 */
@Value
@Builder
public class DurationSample {
    TestRef test;
    /** Observed duration in seconds; never negative. */
    double durationSeconds;
    /** When the run was observed. Null when the source does not report it. */
    Instant observedAt;

    /** True when the sample lies in {@code [start, end]}; samples without a timestamp always match. */
    public boolean isWithin(Instant start, Instant end) {
        if (observedAt == null) {
            return true;
        }
        return (start == null || !observedAt.isBefore(start)) && (end == null || !observedAt.isAfter(end));
    }
}

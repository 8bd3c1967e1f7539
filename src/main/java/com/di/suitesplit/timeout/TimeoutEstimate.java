package com.di.suitesplit.timeout;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Duration;

/**
 * Recommended timeouts for one generated task. When {@link #isSpecified()} is false the
 * platform default applies and both durations are null.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TimeoutEstimate {

    private static final TimeoutEstimate UNSPECIFIED = new TimeoutEstimate(null, null, false);

    Duration executionTimeout;
    /** Bound on time without output; null when not produced. */
    Duration idleTimeout;
    boolean specified;

    public static TimeoutEstimate unspecified() {
        return UNSPECIFIED;
    }

    public static TimeoutEstimate of(Duration executionTimeout, Duration idleTimeout) {
        if (executionTimeout == null) {
            throw new IllegalArgumentException("executionTimeout is required for a specified estimate");
        }
        return new TimeoutEstimate(executionTimeout, idleTimeout, true);
    }

    /**
     * Scales the execution timeout for a suite that repeats {@code repeatSuites} times.
     * The idle timeout guards a single test and is left as is.
     */
    public TimeoutEstimate repeated(int repeatSuites) {
        if (!specified || repeatSuites <= 1) {
            return this;
        }
        return new TimeoutEstimate(executionTimeout.multipliedBy(repeatSuites), idleTimeout, true);
    }
}

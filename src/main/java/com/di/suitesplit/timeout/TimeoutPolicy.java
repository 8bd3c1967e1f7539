package com.di.suitesplit.timeout;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Tunables for {@link TimeoutEstimator}.
 */
@Value
@Builder
public class TimeoutPolicy {

    public static final TimeoutPolicy DEFAULT = TimeoutPolicy.builder().build();

    /** Inflates the summed per-test cost to cover machine variance and tail latency; must be > 1. */
    @Builder.Default
    double safetyFactor = 3.0;
    /** Fixture startup and teardown allowance added to the execution timeout. */
    @Builder.Default
    Duration fixedOverhead = Duration.ofMinutes(5);
    @Builder.Default
    double idleSafetyFactor = 3.0;
    @Builder.Default
    Duration idleOverhead = Duration.ofMinutes(1);
    /** Floor for both timeouts. */
    @Builder.Default
    Duration minimum = Duration.ofMinutes(5);
    /** Ceiling for the execution timeout; null = none. */
    @Builder.Default
    Duration maximum = Duration.ofHours(48);
}

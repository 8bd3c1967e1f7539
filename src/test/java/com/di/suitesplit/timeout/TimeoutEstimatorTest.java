package com.di.suitesplit.timeout;

import com.di.suitesplit.catalog.TestRef;
import com.di.suitesplit.split.SubSuite;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TimeoutEstimator Tests")
class TimeoutEstimatorTest {

    private final TimeoutEstimator estimator = new TimeoutEstimator(TimeoutPolicy.DEFAULT);

    private static SubSuite timed(double cost, double longest) {
        return SubSuite.builder()
                .index(0)
                .members(List.of(TestRef.of("a.js")))
                .estimatedCost(cost)
                .maxTestCost(longest)
                .hasTimingData(true)
                .build();
    }

    @Test
    @DisplayName("Execution and idle timeouts follow the configured factors and overheads")
    void formula() {
        TimeoutEstimate estimate = estimator.estimate(timed(600, 100));

        assertTrue(estimate.isSpecified());
        // 600s * 3 + 5m, and 100s * 3 + 1m
        assertEquals(Duration.ofSeconds(2100), estimate.getExecutionTimeout());
        assertEquals(Duration.ofSeconds(360), estimate.getIdleTimeout());
    }

    @Test
    @DisplayName("Short suites are raised to the floor; idle never exceeds execution")
    void floor() {
        TimeoutEstimate estimate = estimator.estimate(timed(10, 10));

        assertEquals(Duration.ofSeconds(330), estimate.getExecutionTimeout());
        assertEquals(Duration.ofMinutes(5), estimate.getIdleTimeout());
        assertTrue(estimate.getIdleTimeout().compareTo(estimate.getExecutionTimeout()) <= 0);

        TimeoutEstimate zero = estimator.estimate(timed(0, 0));
        assertEquals(Duration.ofMinutes(5), zero.getExecutionTimeout());
        assertEquals(Duration.ofMinutes(5), zero.getIdleTimeout());
    }

    @Test
    @DisplayName("Huge suites are capped at the ceiling")
    void ceiling() {
        TimeoutEstimate estimate = estimator.estimate(timed(100_000, 60_000));

        assertEquals(Duration.ofHours(48), estimate.getExecutionTimeout());
        assertEquals(Duration.ofHours(48), estimate.getIdleTimeout());
    }

    @Test
    @DisplayName("A larger cost never yields a shorter execution timeout")
    void monotonic() {
        Duration previous = Duration.ZERO;
        for (double cost = 0; cost <= 20_000; cost += 250) {
            Duration current = estimator.estimate(timed(cost, 0)).getExecutionTimeout();
            assertTrue(current.compareTo(previous) >= 0, "cost " + cost);
            previous = current;
        }
    }

    @Test
    @DisplayName("Sub-suites without timing data and misc get no estimate")
    void unspecified() {
        SubSuite untimed = SubSuite.builder().index(0).members(List.of()).hasTimingData(false).build();

        assertFalse(estimator.estimate(untimed).isSpecified());
        assertFalse(estimator.estimate(SubSuite.misc(List.of(TestRef.of("a.js")))).isSpecified());
        assertNull(estimator.estimate(untimed).getExecutionTimeout());
    }

    @Test
    @DisplayName("Repeating a suite scales only the execution timeout")
    void repeated() {
        TimeoutEstimate once = estimator.estimate(timed(600, 100));
        TimeoutEstimate thrice = once.repeated(3);

        assertEquals(Duration.ofSeconds(6300), thrice.getExecutionTimeout());
        assertEquals(once.getIdleTimeout(), thrice.getIdleTimeout());
        assertSame(TimeoutEstimate.unspecified(), TimeoutEstimate.unspecified().repeated(3));
    }

    @Test
    @DisplayName("Safety factor must exceed one")
    void invalidPolicy() {
        assertThrows(IllegalArgumentException.class,
                () -> new TimeoutEstimator(TimeoutPolicy.builder().safetyFactor(1.0).build()));
        assertThrows(IllegalArgumentException.class,
                () -> new TimeoutEstimator(TimeoutPolicy.builder().idleSafetyFactor(0).build()));
    }
}

package com.di.suitesplit.timeout;

import com.di.suitesplit.split.SubSuite;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Derives task timeouts from a sub-suite's historical cost.
 *
 * <ul>
 *   <li>execution: {@code ceil(estimatedCost * safetyFactor) + fixedOverhead}, clamped to
 *       {@code [minimum, maximum]}. Sums of means match the packing objective.</li>
 *   <li>idle: {@code ceil(longestTest * idleSafetyFactor) + idleOverhead}, at least {@code minimum}
 *       and at most the execution timeout. Guards a single hung test.</li>
 * </ul>
 *
 * Sub-suites without timing data and the misc suite get {@link TimeoutEstimate#unspecified()}.
 */
@Slf4j
public class TimeoutEstimator {

    private final TimeoutPolicy policy;

    public TimeoutEstimator(TimeoutPolicy policy) {
        if (policy.getSafetyFactor() <= 1.0) {
            throw new IllegalArgumentException("safetyFactor must be > 1, got " + policy.getSafetyFactor());
        }
        if (policy.getIdleSafetyFactor() <= 0) {
            throw new IllegalArgumentException("idleSafetyFactor must be > 0, got " + policy.getIdleSafetyFactor());
        }
        this.policy = policy;
    }

    public TimeoutEstimate estimate(SubSuite subSuite) {
        if (subSuite == null || subSuite.isMisc() || !subSuite.hasTimingData()) {
            return TimeoutEstimate.unspecified();
        }
        long execSeconds = (long) Math.ceil(subSuite.getEstimatedCost() * policy.getSafetyFactor());
        Duration execution = clamp(Duration.ofSeconds(execSeconds).plus(policy.getFixedOverhead()));

        long idleSeconds = (long) Math.ceil(subSuite.getMaxTestCost() * policy.getIdleSafetyFactor());
        Duration idle = Duration.ofSeconds(idleSeconds).plus(policy.getIdleOverhead());
        if (idle.compareTo(policy.getMinimum()) < 0) {
            idle = policy.getMinimum();
        }
        if (idle.compareTo(execution) > 0) {
            idle = execution;
        }

        log.debug("[TIMEOUT] sub-suite {}: cost={}s longest={}s -> exec={}s idle={}s",
                subSuite.getIndex(), Math.round(subSuite.getEstimatedCost()), Math.round(subSuite.getMaxTestCost()),
                execution.getSeconds(), idle.getSeconds());
        return TimeoutEstimate.of(execution, idle);
    }

    private Duration clamp(Duration d) {
        if (d.compareTo(policy.getMinimum()) < 0) {
            return policy.getMinimum();
        }
        if (policy.getMaximum() != null && d.compareTo(policy.getMaximum()) > 0) {
            log.warn("[TIMEOUT] Estimated {}s exceeds ceiling, capping at {}s", d.getSeconds(), policy.getMaximum().getSeconds());
            return policy.getMaximum();
        }
        return d;
    }
}

package com.di.suitesplit.util;

import com.di.suitesplit.split.GeneratedSuite;
import com.di.suitesplit.split.OverflowEvent;
import com.di.suitesplit.split.SplitStrategy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Metrics for suite splitting: which strategy ran, how many sub-suites were produced,
 * and how often the overflow policy was applied.
 */
public class SplitMetrics {

    private final Map<SplitStrategy.Kind, Counter> splitsByStrategy = new EnumMap<>(SplitStrategy.Kind.class);
    private final Map<OverflowEvent.Policy, Counter> overflowByPolicy = new EnumMap<>(OverflowEvent.Policy.class);
    private final DistributionSummary subSuiteCount;
    private final DistributionSummary generatedTaskCount;
    private final Timer generationTimer;

    public SplitMetrics(MeterRegistry meterRegistry) {
        for (SplitStrategy.Kind kind : SplitStrategy.Kind.values()) {
            splitsByStrategy.put(kind, Counter.builder("suitesplit.split.total")
                    .description("Suite splits by strategy")
                    .tag("strategy", kind.name().toLowerCase())
                    .register(meterRegistry));
        }
        for (OverflowEvent.Policy policy : OverflowEvent.Policy.values()) {
            overflowByPolicy.put(policy, Counter.builder("suitesplit.overflow.total")
                    .description("Tests placed by the overflow policy")
                    .tag("policy", policy.name().toLowerCase())
                    .register(meterRegistry));
        }
        this.subSuiteCount = DistributionSummary.builder("suitesplit.subsuite.count")
                .description("Indexed sub-suites per split")
                .register(meterRegistry);
        this.generatedTaskCount = DistributionSummary.builder("suitesplit.task.count")
                .description("Tasks generated per request")
                .register(meterRegistry);
        this.generationTimer = Timer.builder("suitesplit.generation.duration")
                .description("Time taken to split a suite and generate its tasks")
                .register(meterRegistry);
    }

    public void recordSplit(GeneratedSuite suite) {
        splitsByStrategy.get(suite.getStrategy()).increment();
        subSuiteCount.record(suite.size());
        for (OverflowEvent e : suite.getOverflowEvents()) {
            overflowByPolicy.get(e.getPolicy()).increment();
        }
    }

    public void recordTasks(int count) {
        generatedTaskCount.record(count);
    }

    public <T> T timeGeneration(Supplier<T> generation) {
        return generationTimer.record(generation);
    }
}

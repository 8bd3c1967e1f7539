package com.di.suitesplit.split;

import com.di.suitesplit.catalog.TestRef;

import java.util.ArrayList;
import java.util.List;

/**
 * Fallback when timing data is missing: test {@code i} goes to bin {@code i mod k}, in input order,
 * with {@code k = min(maxSubSuites, ceil(n / maxTestsPerSuite))}. Costs are ignored.
 *
 * <p>Only the first {@code k * maxTestsPerSuite} tests are dealt out, so no bin exceeds the cap.
 * When {@code k} is clamped by {@code maxSubSuites} the remainder goes to the misc suite, or past
 * the cap into the last bin when there is no misc suite, with an {@link OverflowEvent} per test.
 */
public class RoundRobinStrategy implements SplitStrategy {

    @Override
    public Kind kind() {
        return Kind.ROUND_ROBIN;
    }

    @Override
    public SplitResult split(List<TestCost> tests, SplitConfig config, boolean createMisc) {
        int binCount = binCount(tests.size(), config);
        List<List<TestRef>> bins = new ArrayList<>(binCount);
        for (int i = 0; i < binCount; i++) {
            bins.add(new ArrayList<>());
        }
        int capacity = (int) Math.min(tests.size(), (long) binCount * config.getMaxTestsPerSuite());
        for (int i = 0; i < capacity; i++) {
            bins.get(i % binCount).add(tests.get(i).getTest());
        }

        List<TestRef> toMisc = new ArrayList<>();
        List<OverflowEvent> events = new ArrayList<>();
        int last = binCount - 1;
        for (int i = capacity; i < tests.size(); i++) {
            TestRef test = tests.get(i).getTest();
            if (createMisc) {
                toMisc.add(test);
                events.add(new OverflowEvent(test, OverflowEvent.Policy.ROUTED_TO_MISC, -1));
            } else {
                bins.get(last).add(test);
                events.add(new OverflowEvent(test, OverflowEvent.Policy.APPENDED_PAST_CAP, last));
            }
        }

        List<SubSuite> subSuites = new ArrayList<>(binCount);
        for (int i = 0; i < binCount; i++) {
            subSuites.add(SubSuite.builder()
                    .index(i)
                    .members(List.copyOf(bins.get(i)))
                    .estimatedCost(0)
                    .maxTestCost(0)
                    .hasTimingData(false)
                    .build());
        }
        return new SplitResult(List.copyOf(subSuites), List.copyOf(toMisc), List.copyOf(events));
    }

    static int binCount(int testCount, SplitConfig config) {
        int needed = (int) Math.ceil(testCount / (double) config.getMaxTestsPerSuite());
        return Math.max(1, Math.min(config.getMaxSubSuites(), needed));
    }
}

package com.di.suitesplit.split;

import com.di.suitesplit.catalog.TestRef;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Longest-processing-time packing: heaviest tests first, each into the bin with the lowest
 * accumulated cost. Does not guarantee the optimal makespan, but stays within
 * {@code 4/3 - 1/(3k)} of it for k bins.
 *
 * <p>{@code maxTestsPerSuite} is a hard cap: a full bin is skipped in favour of the next
 * cheapest one. When every bin is full a new bin is opened while under {@code maxSubSuites};
 * after that tests go to the misc suite, or past the cap into the last bin when there is no misc suite.
 */
@Slf4j
public class GreedyBalanceStrategy implements SplitStrategy {

    /** Descending cost, then identifier, so repeated runs produce the same assignment. */
    static final Comparator<TestCost> HEAVIEST_FIRST = Comparator
            .comparingDouble(TestCost::getSeconds).reversed()
            .thenComparing(TestCost::getTest);

    @Override
    public Kind kind() {
        return Kind.GREEDY_BALANCE;
    }

    @Override
    public SplitResult split(List<TestCost> tests, SplitConfig config, boolean createMisc) {
        List<TestCost> sorted = new ArrayList<>(tests);
        sorted.sort(HEAVIEST_FIRST);

        int binCount = initialBinCount(sorted, config);
        List<Bin> bins = new ArrayList<>(binCount);
        for (int i = 0; i < binCount; i++) {
            bins.add(new Bin(i));
        }

        List<TestRef> toMisc = new ArrayList<>();
        List<OverflowEvent> events = new ArrayList<>();
        for (TestCost test : sorted) {
            Bin target = cheapestWithCapacity(bins, config.getMaxTestsPerSuite());
            if (target == null) {
                if (bins.size() < config.getMaxSubSuites()) {
                    target = new Bin(bins.size());
                    bins.add(target);
                    log.debug("[SPLIT] All bins at {} tests, opened bin {}", config.getMaxTestsPerSuite(), target.index);
                } else if (createMisc) {
                    toMisc.add(test.getTest());
                    events.add(new OverflowEvent(test.getTest(), OverflowEvent.Policy.ROUTED_TO_MISC, -1));
                    continue;
                } else {
                    target = bins.get(bins.size() - 1);
                    events.add(new OverflowEvent(test.getTest(), OverflowEvent.Policy.APPENDED_PAST_CAP, target.index));
                }
            }
            target.add(test);
        }

        // zero-cost tests can leave trailing bins untouched
        List<SubSuite> subSuites = new ArrayList<>(bins.size());
        for (Bin bin : bins) {
            if (!bin.members.isEmpty()) {
                subSuites.add(bin.toSubSuite());
            }
        }
        return new SplitResult(List.copyOf(subSuites), List.copyOf(toMisc), List.copyOf(events));
    }

    /**
     * {@code min(maxSubSuites, max(1, ceil(totalCost / target)))}, never more bins than tests.
     */
    static int initialBinCount(List<TestCost> tests, SplitConfig config) {
        double total = 0;
        for (TestCost t : tests) {
            total += t.getSeconds();
        }
        int byTime = (int) Math.min(Integer.MAX_VALUE, Math.ceil(total / config.getTargetSecondsPerSuite()));
        int bins = Math.min(config.getMaxSubSuites(), Math.max(1, byTime));
        return Math.max(1, Math.min(bins, tests.size()));
    }

    /** Lowest cost, ties to the lowest index; null when every bin is full. */
    private static Bin cheapestWithCapacity(List<Bin> bins, int cap) {
        Bin best = null;
        for (Bin bin : bins) {
            if (bin.members.size() >= cap) {
                continue;
            }
            if (best == null || bin.total < best.total) {
                best = bin;
            }
        }
        return best;
    }

    private static final class Bin {
        final int index;
        final List<TestRef> members = new ArrayList<>();
        double total;
        double longest;

        Bin(int index) {
            this.index = index;
        }

        void add(TestCost test) {
            members.add(test.getTest());
            total += test.getSeconds();
            longest = Math.max(longest, test.getSeconds());
        }

        SubSuite toSubSuite() {
            return SubSuite.builder()
                    .index(index)
                    .members(List.copyOf(members))
                    .estimatedCost(total)
                    .maxTestCost(longest)
                    .hasTimingData(true)
                    .build();
        }
    }
}

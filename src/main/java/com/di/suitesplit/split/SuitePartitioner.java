package com.di.suitesplit.split;

import com.di.suitesplit.catalog.DurationCatalog;
import com.di.suitesplit.catalog.DurationCatalogUnavailableException;
import com.di.suitesplit.catalog.DurationSample;
import com.di.suitesplit.catalog.TestRef;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Splits a suite's tests into sub-suites sized to a target runtime.
 *
 * <p>The strategy is chosen once per call: {@link GreedyBalanceStrategy} when every test has at
 * least one sample in the lookback window, otherwise {@link RoundRobinStrategy}. Mixing known and
 * unknown costs would skew the balance, so a single missing test switches the whole call to the
 * fallback. An unreachable catalog has the same effect and is never an error.
 *
 * <p>Every input test ends up in exactly one sub-suite or in the misc suite.
 */
@Slf4j
public class SuitePartitioner {

    private final CostReducer costReducer;
    private final SplitStrategy primary;
    private final SplitStrategy fallback;

    public SuitePartitioner(CostReducer costReducer, SplitStrategy primary, SplitStrategy fallback) {
        this.costReducer = costReducer;
        this.primary = primary;
        this.fallback = fallback;
    }

    /** Mean-cost greedy split with round-robin fallback. */
    public static SuitePartitioner withDefaults() {
        return new SuitePartitioner(StandardCostReducer.MEAN, new GreedyBalanceStrategy(), new RoundRobinStrategy());
    }

    /**
     * @param params  suite identity and misc handling
     * @param tests   tests to split; duplicates are collapsed, first occurrence wins
     * @param catalog historical durations
     * @param config  split limits
     * @throws com.di.suitesplit.exception.ConfigurationException if {@code config} is invalid
     */
    public GeneratedSuite partition(SuiteSplitParameters params, Collection<TestRef> tests,
                                    DurationCatalog catalog, SplitConfig config) {
        config.validate();
        Set<TestRef> unique = new LinkedHashSet<>(tests);

        GeneratedSuite.GeneratedSuiteBuilder result = GeneratedSuite.builder()
                .taskName(params.getTaskName())
                .suiteName(params.getSuiteName())
                .buildVariant(params.getBuildVariant())
                .totalTestCount(unique.size());
        if (unique.isEmpty()) {
            log.info("[SPLIT] {}: no tests, nothing to split", params.getTaskName());
            return result.strategy(primary.kind()).build();
        }

        List<TestRef> candidates = new ArrayList<>(unique.size());
        List<TestRef> misc = new ArrayList<>();
        for (TestRef test : unique) {
            if (params.isCreateMisc() && !params.isKnown(test)) {
                misc.add(test);
            } else {
                candidates.add(test);
            }
        }
        if (!misc.isEmpty()) {
            log.info("[SPLIT] {}: {} tests not in the suite definition go to misc", params.getTaskName(), misc.size());
        }

        SplitResult split;
        SplitStrategy strategy = primary;
        if (candidates.isEmpty()) {
            split = new SplitResult(List.of(), List.of(), List.of());
        } else {
            List<TestCost> costs = lookupCosts(candidates, catalog, config);
            if (costs == null) {
                strategy = fallback;
                costs = new ArrayList<>(candidates.size());
                for (TestRef t : candidates) {
                    costs.add(new TestCost(t, 0));
                }
            }
            split = strategy.split(costs, config, params.isCreateMisc());
        }
        misc.addAll(split.getOverflowToMisc());

        for (OverflowEvent e : split.getOverflowEvents()) {
            log.warn("[SPLIT] Overflow: {} {} (maxTestsPerSuite={}, maxSubSuites={})",
                    e.getTest(), e.getPolicy(), config.getMaxTestsPerSuite(), config.getMaxSubSuites());
        }
        logSummary(params.getTaskName(), strategy.kind(), split.getSubSuites(), misc.size());

        return result
                .strategy(strategy.kind())
                .subSuites(split.getSubSuites())
                .misc(params.isCreateMisc() ? SubSuite.misc(misc) : null)
                .overflowEvents(split.getOverflowEvents())
                .build();
    }

    /** Reduced costs for every test, or null when any test lacks data or the catalog is unreachable. */
    private List<TestCost> lookupCosts(List<TestRef> tests, DurationCatalog catalog, SplitConfig config) {
        List<TestCost> costs = new ArrayList<>(tests.size());
        try {
            for (TestRef test : tests) {
                List<DurationSample> inWindow = new ArrayList<>();
                for (DurationSample s : catalog.lookup(test)) {
                    if (s.isWithin(config.getLookbackStart(), config.getLookbackEnd())) {
                        inWindow.add(s);
                    }
                }
                OptionalDouble cost = inWindow.isEmpty() ? OptionalDouble.empty() : costReducer.reduce(inWindow);
                if (cost.isEmpty()) {
                    log.info("[SPLIT] No timing data for {} in window, using round-robin split", test);
                    return null;
                }
                costs.add(new TestCost(test, Math.max(0, cost.getAsDouble())));
            }
        } catch (DurationCatalogUnavailableException e) {
            log.warn("[SPLIT] Duration catalog unavailable ({}), using round-robin split", e.getMessage());
            return null;
        }
        return costs;
    }

    private static void logSummary(String taskName, SplitStrategy.Kind kind, List<SubSuite> subSuites, int miscSize) {
        if (subSuites.isEmpty()) {
            log.info("[SPLIT] {}: 0 sub-suites ({}), misc={}", taskName, kind, miscSize);
            return;
        }
        double total = 0, min = Double.MAX_VALUE, max = 0;
        for (SubSuite s : subSuites) {
            total += s.getEstimatedCost();
            min = Math.min(min, s.getEstimatedCost());
            max = Math.max(max, s.getEstimatedCost());
        }
        log.info("[SPLIT] {}: {} sub-suites ({}), misc={}. Cost min={}s avg={}s max={}s",
                taskName, subSuites.size(), kind, miscSize,
                Math.round(min), Math.round(total / subSuites.size()), Math.round(max));
    }
}

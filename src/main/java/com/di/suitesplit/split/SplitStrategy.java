package com.di.suitesplit.split;

import java.util.List;

/**
 * Assigns tests to sub-suites. One implementation is chosen per call by {@link SuitePartitioner}.
 */
public interface SplitStrategy {

    enum Kind {
        GREEDY_BALANCE,
        ROUND_ROBIN
    }

    Kind kind();

    /**
     * @param tests       tests to place, in caller order; costs are zero for strategies that ignore them
     * @param config      validated split limits
     * @param createMisc  whether tests that do not fit may be diverted to the misc suite
     */
    SplitResult split(List<TestCost> tests, SplitConfig config, boolean createMisc);
}

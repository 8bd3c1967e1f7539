package com.di.suitesplit.split;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Result of partitioning one suite: ordered sub-suites plus the optional misc suite.
 * Read-only once built.
 */
@Value
@Builder
public class GeneratedSuite {
    String taskName;
    String suiteName;
    String buildVariant;
    @Singular
    List<SubSuite> subSuites;
    SubSuite misc;
    int totalTestCount;
    SplitStrategy.Kind strategy;
    @Singular
    List<OverflowEvent> overflowEvents;

    public Optional<SubSuite> getMisc() {
        return Optional.ofNullable(misc);
    }

    public boolean hasMisc() {
        return misc != null;
    }

    /** Number of indexed sub-suites (misc excluded). */
    public int size() {
        return subSuites.size();
    }
}

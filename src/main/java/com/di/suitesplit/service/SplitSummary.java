package com.di.suitesplit.service;

import com.di.suitesplit.split.SplitStrategy;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Shape of a split, reported alongside the generated tasks.
 */
@Value
@Builder
public class SplitSummary {
    SplitStrategy.Kind strategy;
    int totalTestCount;
    int subSuiteCount;
    /** Member count of the misc suite; null when there is none. */
    Integer miscTestCount;
    List<Double> estimatedCostSeconds;
    int overflowCount;
}

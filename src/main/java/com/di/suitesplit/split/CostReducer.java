package com.di.suitesplit.split;

import com.di.suitesplit.catalog.DurationSample;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Reduces the bag of samples observed for one test to the single cost used for packing.
 */
@FunctionalInterface
public interface CostReducer {

    /** @return the estimated cost in seconds, or empty when {@code samples} is empty */
    OptionalDouble reduce(List<DurationSample> samples);
}

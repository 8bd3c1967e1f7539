package com.di.suitesplit.split;

import com.di.suitesplit.catalog.DurationSample;

import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Built-in reductions, selectable by name from configuration.
 */
public enum StandardCostReducer implements CostReducer {

    MEAN {
        @Override
        public OptionalDouble reduce(List<DurationSample> samples) {
            return samples.stream().mapToDouble(DurationSample::getDurationSeconds).average();
        }
    },
    MEDIAN {
        @Override
        public OptionalDouble reduce(List<DurationSample> samples) {
            if (samples.isEmpty()) return OptionalDouble.empty();
            double[] sorted = samples.stream().mapToDouble(DurationSample::getDurationSeconds).sorted().toArray();
            int mid = sorted.length / 2;
            return OptionalDouble.of(sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0);
        }
    },
    MAX {
        @Override
        public OptionalDouble reduce(List<DurationSample> samples) {
            return samples.stream().mapToDouble(DurationSample::getDurationSeconds).max();
        }
    };

    /** Case-insensitive lookup; blank defaults to {@link #MEAN}. */
    public static StandardCostReducer fromName(String name) {
        if (name == null || name.isBlank()) return MEAN;
        try {
            return valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown cost reduction '" + name + "', expected one of "
                    + Arrays.toString(values()), e);
        }
    }
}

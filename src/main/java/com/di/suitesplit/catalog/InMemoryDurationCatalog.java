package com.di.suitesplit.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link DurationCatalog}. Used for request-supplied history and tests.
 */
public class InMemoryDurationCatalog implements DurationCatalog {

    private final Map<TestRef, List<DurationSample>> samplesByTest = new ConcurrentHashMap<>();

    public static InMemoryDurationCatalog empty() {
        return new InMemoryDurationCatalog();
    }

    public InMemoryDurationCatalog record(DurationSample sample) {
        samplesByTest.computeIfAbsent(sample.getTest(), k -> Collections.synchronizedList(new ArrayList<>()))
                .add(sample);
        return this;
    }

    /** Records one untimestamped sample per duration. */
    public InMemoryDurationCatalog record(String test, double... durationsSeconds) {
        TestRef ref = TestRef.of(test);
        for (double d : durationsSeconds) {
            record(DurationSample.builder().test(ref).durationSeconds(d).build());
        }
        return this;
    }

    @Override
    public List<DurationSample> lookup(TestRef test) {
        List<DurationSample> samples = samplesByTest.get(test);
        if (samples == null) return List.of();
        synchronized (samples) {
            return List.copyOf(samples);
        }
    }

    public int size() {
        return samplesByTest.size();
    }
}

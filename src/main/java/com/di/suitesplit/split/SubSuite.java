package com.di.suitesplit.split;

import com.di.suitesplit.catalog.TestRef;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One bin of a split suite. Members are in assignment order, not execution order.
 */
@Value
@Builder
public class SubSuite {
    /** Position among the indexed sub-suites; -1 for the misc suite. */
    int index;
    List<TestRef> members;
    /** Sum of member costs, seconds. Zero when no timing data. */
    double estimatedCost;
    /** Cost of the single longest member, seconds. */
    double maxTestCost;
    boolean hasTimingData;
    boolean misc;

    public static SubSuite misc(List<TestRef> members) {
        return SubSuite.builder()
                .index(-1)
                .members(List.copyOf(members))
                .misc(true)
                .build();
    }

    public boolean hasTimingData() {
        return hasTimingData;
    }

    public int size() {
        return members.size();
    }
}

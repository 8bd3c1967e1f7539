package com.di.suitesplit.split;

import com.di.suitesplit.catalog.TestRef;
import lombok.Value;

/**
 * Informational record that a test could not be placed within the per-suite cap.
 * Never an error: the test is still placed.
 */
@Value
public class OverflowEvent {

    public enum Policy {
        /** Routed to the misc suite because every bin was full. */
        ROUTED_TO_MISC,
        /** Placed in a bin that was already at {@code maxTestsPerSuite}. */
        APPENDED_PAST_CAP
    }

    TestRef test;
    Policy policy;
    /** Bin the test landed in; -1 for the misc suite. */
    int subSuiteIndex;
}

package com.di.suitesplit.split;

import com.di.suitesplit.catalog.TestRef;
import lombok.Value;

import java.util.List;

/**
 * Output of a {@link SplitStrategy}: the indexed bins, tests diverted to misc, and overflow signals.
 */
@Value
public class SplitResult {
    List<SubSuite> subSuites;
    List<TestRef> overflowToMisc;
    List<OverflowEvent> overflowEvents;
}

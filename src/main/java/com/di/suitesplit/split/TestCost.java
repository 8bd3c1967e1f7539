package com.di.suitesplit.split;

import com.di.suitesplit.catalog.TestRef;
import lombok.Value;

/** A test with its reduced cost in seconds. */
@Value
public class TestCost {
    TestRef test;
    double seconds;
}

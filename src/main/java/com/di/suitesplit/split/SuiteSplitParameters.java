package com.di.suitesplit.split;

import com.di.suitesplit.catalog.TestRef;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Identifies the suite being split and how leftovers are handled.
 */
@Value
@Builder(toBuilder = true)
public class SuiteSplitParameters {

    public static final String GEN_SUFFIX = "_gen";

    /** Name of the task being generated; a trailing {@code _gen} is dropped. */
    String taskName;
    /** Suite the generated sub-suites are derived from (may be a path). */
    String suiteName;
    String buildVariant;
    /** When true, a misc suite collects new tests and overflow. */
    boolean createMisc;
    /**
     * Tests known to the historical suite definition. Null = every supplied test is known.
     * Supplied tests outside this set go to the misc suite when {@link #createMisc} is set.
     */
    Set<TestRef> suiteDefinition;

    public String getTaskName() {
        return removeGenSuffix(taskName);
    }

    /** Origin suite, defaulting to the task name when no suite was given. */
    public String getSuiteName() {
        return suiteName != null && !suiteName.isBlank() ? suiteName : getTaskName();
    }

    public boolean isKnown(TestRef test) {
        return suiteDefinition == null || suiteDefinition.contains(test);
    }

    static String removeGenSuffix(String name) {
        if (name != null && name.endsWith(GEN_SUFFIX)) {
            return name.substring(0, name.length() - GEN_SUFFIX.length());
        }
        return name;
    }
}

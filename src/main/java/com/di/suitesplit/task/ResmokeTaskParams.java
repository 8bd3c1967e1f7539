package com.di.suitesplit.task;

import lombok.Builder;
import lombok.Value;

/**
 * Per-suite parameters for generated runner tasks.
 */
@Value
@Builder(toBuilder = true)
public class ResmokeTaskParams {
    /** Caller-supplied runner arguments, appended after {@code --suite} and {@code --originSuite}. */
    String resmokeArgs;
    /** How many times each generated suite repeats; null or 1 = once. */
    Integer repeatSuites;
    /** Max parallel jobs for the runner; null = runner default. */
    Integer resmokeJobsMax;
    /** Remote location of the generated configuration archive. */
    String genTaskConfigLocation;

    public int getEffectiveRepeatSuites() {
        return repeatSuites == null || repeatSuites < 1 ? 1 : repeatSuites;
    }
}

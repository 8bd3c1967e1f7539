package com.di.suitesplit.service;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything needed to split one suite and generate its tasks.
 * Null split overrides fall back to configured defaults.
 */
@Value
@Builder
public class GenerationRequest {
    String taskName;
    String suiteName;
    String buildVariant;
    @Singular
    List<String> tests;
    /** Tests of the historical suite definition; null = all requested tests are known. */
    List<String> suiteDefinition;

    Integer maxSubSuites;
    Integer maxTestsPerSuite;
    Integer targetTimePerSuiteSeconds;

    String resmokeArgs;
    Integer repeatSuites;
    Integer resmokeJobsMax;
    String genTaskConfigLocation;

    boolean multiversion;
    boolean sharded;
    /** Explicit version mixes; empty = defaults for the topology. */
    @Singular
    List<String> versionMixes;
    String testList;
}

package com.di.suitesplit.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

/**
 * Body of {@code POST /api/suites/generate}.
 */
@Data
public class GenerateSuitesRequest {

    @NotBlank
    private String taskName;
    private String suiteName;
    @NotBlank
    private String buildVariant;
    @NotEmpty
    private List<String> tests;
    private List<String> suiteDefinition;

    /** Inline history; when present it replaces the configured history source for this request. */
    @Valid
    private List<HistoricalDuration> history;

    @Min(1)
    private Integer maxSubSuites;
    @Min(1)
    private Integer maxTestsPerSuite;
    @Min(1)
    private Integer targetTimePerSuiteSeconds;

    private String resmokeArgs;
    @Min(1)
    private Integer repeatSuites;
    @Min(1)
    private Integer resmokeJobsMax;
    private String genTaskConfigLocation;

    private boolean multiversion;
    private boolean sharded;
    private List<String> versionMixes;
    private String testList;
}

package com.di.suitesplit.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * One row of a historical test-statistics export: the aggregated passing runs of a test
 * for a single day.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TestStatsRecord {

    @JsonProperty("test_file")
    private String testFile;

    @JsonProperty("task_name")
    private String taskName;

    @JsonProperty("variant")
    private String variant;

    @JsonProperty("num_pass")
    private int numPass;

    @JsonProperty("num_fail")
    private int numFail;

    /** Average duration of passing runs, seconds. */
    @JsonProperty("avg_duration_pass")
    private double avgDurationPass;

    @JsonProperty("date")
    private LocalDate date;
}

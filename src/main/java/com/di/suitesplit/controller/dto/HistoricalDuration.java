package com.di.suitesplit.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** One observed run of a test, supplied inline with a generation request. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HistoricalDuration {
    @NotBlank
    private String test;
    @PositiveOrZero
    private double durationSeconds;
    private Instant observedAt;
}

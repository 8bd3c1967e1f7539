package com.di.suitesplit.service;

import com.di.suitesplit.task.DisplayTask;
import com.di.suitesplit.task.GeneratedTask;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class GenerationResult {
    List<GeneratedTask> tasks;
    List<DisplayTask> displayTasks;
    SplitSummary summary;
}

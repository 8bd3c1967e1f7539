package com.di.suitesplit.task;

import lombok.Value;

import java.util.List;

/**
 * Groups generated tasks under one parent name in the CI provider's UI.
 */
@Value
public class DisplayTask {
    String name;
    List<String> executionTasks;
    String buildVariant;
}

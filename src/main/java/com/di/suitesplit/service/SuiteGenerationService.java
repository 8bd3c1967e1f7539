package com.di.suitesplit.service;

import com.di.suitesplit.catalog.DurationCatalog;
import com.di.suitesplit.catalog.TestRef;
import com.di.suitesplit.config.SuiteSplitProperties;
import com.di.suitesplit.config.TaskGenerationProperties;
import com.di.suitesplit.multiversion.MultiversionExpander;
import com.di.suitesplit.multiversion.MultiversionParams;
import com.di.suitesplit.multiversion.VersionMixConfig;
import com.di.suitesplit.multiversion.VersionMixConfigs;
import com.di.suitesplit.split.GeneratedSuite;
import com.di.suitesplit.split.SplitConfig;
import com.di.suitesplit.split.SubSuite;
import com.di.suitesplit.split.SuitePartitioner;
import com.di.suitesplit.split.SuiteSplitParameters;
import com.di.suitesplit.task.DisplayTask;
import com.di.suitesplit.task.GeneratedTask;
import com.di.suitesplit.task.ResmokeTaskGenerator;
import com.di.suitesplit.task.ResmokeTaskParams;
import com.di.suitesplit.util.SplitMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs the generation pipeline for one suite: partition, estimate timeouts, name, and either
 * emit one task per sub-suite or expand across version mixes.
 */
@Slf4j
@RequiredArgsConstructor
public class SuiteGenerationService {

    public static final String GEN_PARENT_TASK = "generator_tasks";

    private final SuitePartitioner partitioner;
    private final ResmokeTaskGenerator taskGenerator;
    private final MultiversionExpander multiversionExpander;
    private final DurationCatalog defaultCatalog;
    private final SuiteSplitProperties splitProperties;
    private final TaskGenerationProperties generationProperties;
    private final SplitMetrics metrics;
    private final Clock clock;

    /** Generates with the configured history source. */
    public GenerationResult generate(GenerationRequest request) {
        return generate(request, defaultCatalog);
    }

    public GenerationResult generate(GenerationRequest request, DurationCatalog catalog) {
        if (request.getTaskName() == null || request.getTaskName().isBlank()) {
            throw new IllegalArgumentException("taskName is required");
        }
        return metrics.timeGeneration(() -> doGenerate(request, catalog));
    }

    private GenerationResult doGenerate(GenerationRequest request, DurationCatalog catalog) {
        SuiteSplitParameters splitParams = SuiteSplitParameters.builder()
                .taskName(request.getTaskName())
                .suiteName(request.getSuiteName())
                .buildVariant(request.getBuildVariant())
                .createMisc(generationProperties.isCreateMiscSuite())
                .suiteDefinition(toRefs(request.getSuiteDefinition()))
                .build();
        List<TestRef> tests = new ArrayList<>(request.getTests().size());
        for (String t : request.getTests()) {
            tests.add(TestRef.of(t));
        }

        GeneratedSuite suite = partitioner.partition(splitParams, tests, catalog, splitConfig(request));
        metrics.recordSplit(suite);

        ResmokeTaskParams params = ResmokeTaskParams.builder()
                .resmokeArgs(request.getResmokeArgs())
                .repeatSuites(request.getRepeatSuites() != null
                        ? request.getRepeatSuites() : generationProperties.getRepeatSuites())
                .resmokeJobsMax(request.getResmokeJobsMax() != null
                        ? request.getResmokeJobsMax() : generationProperties.getResmokeJobsMax())
                .genTaskConfigLocation(request.getGenTaskConfigLocation())
                .build();

        List<GeneratedTask> tasks;
        if (request.isMultiversion()) {
            List<VersionMixConfig> configs = request.getVersionMixes().isEmpty()
                    ? VersionMixConfigs.forSuite(request.isSharded())
                    : VersionMixConfigs.of(request.getVersionMixes(), request.isSharded());
            MultiversionParams multiversion = MultiversionParams.builder()
                    .parentTaskName(suite.getTaskName())
                    .requiresFcvTag(generationProperties.getRequiresFcvTag())
                    .testList(request.getTestList())
                    .build();
            tasks = multiversionExpander.expand(suite, configs, multiversion, params);
        } else {
            tasks = taskGenerator.generate(suite, params);
        }
        metrics.recordTasks(tasks.size());
        log.info("[GENERATE] {} on {}: {} tasks from {} tests", suite.getTaskName(), suite.getBuildVariant(),
                tasks.size(), suite.getTotalTestCount());

        return GenerationResult.builder()
                .tasks(tasks)
                .displayTasks(displayTasks(suite, tasks))
                .summary(summarize(suite))
                .build();
    }

    SplitConfig splitConfig(GenerationRequest request) {
        SplitConfig defaults = splitProperties.toSplitConfig(clock.instant());
        SplitConfig.SplitConfigBuilder config = defaults.toBuilder();
        if (request.getMaxSubSuites() != null) {
            config.maxSubSuites(request.getMaxSubSuites());
        }
        if (request.getMaxTestsPerSuite() != null) {
            config.maxTestsPerSuite(request.getMaxTestsPerSuite());
        }
        if (request.getTargetTimePerSuiteSeconds() != null) {
            config.targetTimePerSuite(Duration.ofSeconds(request.getTargetTimePerSuiteSeconds()));
        }
        return config.build();
    }

    private static List<DisplayTask> displayTasks(GeneratedSuite suite, List<GeneratedTask> tasks) {
        Set<String> names = new LinkedHashSet<>();
        for (GeneratedTask t : tasks) {
            names.add(t.getName());
        }
        String generator = suite.getTaskName() + SuiteSplitParameters.GEN_SUFFIX;
        names.add(generator);
        return List.of(
                new DisplayTask(suite.getTaskName(), List.copyOf(names), suite.getBuildVariant()),
                new DisplayTask(GEN_PARENT_TASK, List.of(generator), suite.getBuildVariant()));
    }

    private static SplitSummary summarize(GeneratedSuite suite) {
        List<Double> costs = new ArrayList<>(suite.size());
        for (SubSuite s : suite.getSubSuites()) {
            costs.add(s.getEstimatedCost());
        }
        return SplitSummary.builder()
                .strategy(suite.getStrategy())
                .totalTestCount(suite.getTotalTestCount())
                .subSuiteCount(suite.size())
                .miscTestCount(suite.getMisc().map(SubSuite::size).orElse(null))
                .estimatedCostSeconds(costs)
                .overflowCount(suite.getOverflowEvents().size())
                .build();
    }

    private static Set<TestRef> toRefs(List<String> tests) {
        if (tests == null) return null;
        Set<TestRef> refs = new LinkedHashSet<>();
        for (String t : tests) {
            refs.add(TestRef.of(t));
        }
        return refs;
    }
}

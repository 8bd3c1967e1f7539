package com.di.suitesplit.task;

import com.di.suitesplit.naming.SubSuiteIdentity;
import com.di.suitesplit.split.GeneratedSuite;
import com.di.suitesplit.split.SubSuite;
import com.di.suitesplit.timeout.TimeoutEstimate;
import com.di.suitesplit.timeout.TimeoutEstimator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a {@link GeneratedSuite} into one runner task per sub-suite, plus one for the misc suite.
 */
@Slf4j
public class ResmokeTaskGenerator {

    static final String ARCHIVE_DEPENDENCY = "archive_dist_test_debug";
    static final String RESMOKE_JOBS_MAX = "resmoke_jobs_max";
    static final String GEN_TASK_CONFIG_LOCATION = "gen_task_config_location";

    private final TimeoutEstimator timeoutEstimator;
    private final SubSuiteIdentity identity;
    private final TaskGenerationOptions options;

    public ResmokeTaskGenerator(TimeoutEstimator timeoutEstimator, SubSuiteIdentity identity,
                                TaskGenerationOptions options) {
        this.timeoutEstimator = timeoutEstimator;
        this.identity = identity;
        this.options = options;
    }

    public List<GeneratedTask> generate(GeneratedSuite suite, ResmokeTaskParams params) {
        List<GeneratedTask> tasks = new ArrayList<>(suite.size() + 1);
        for (SubSuite subSuite : suite.getSubSuites()) {
            tasks.add(createTask(suite.getTaskName(), suite, subSuite, params));
        }
        suite.getMisc().ifPresent(misc -> tasks.add(createTask(suite.getTaskName(), suite, misc, params)));
        return tasks;
    }

    /**
     * Builds the task for one sub-suite.
     *
     * @param baseName task name before index and build variant
     */
    public GeneratedTask createTask(String baseName, GeneratedSuite suite, SubSuite subSuite, ResmokeTaskParams params) {
        String subSuiteName = identity.suiteName(suite.getSuiteName(), subSuite, suite.size());
        String taskName = identity.name(baseName, subSuite, suite.size(), suite.getBuildVariant());
        String suiteFile = options.suiteLocation(identity.suiteFileName(subSuiteName, suite.getBuildVariant()));
        log.debug("[GENERATE] task={} sub-suite={}", taskName, subSuiteName);

        GeneratedTask.GeneratedTaskBuilder task = GeneratedTask.builder()
                .name(taskName)
                .subSuiteName(subSuiteName)
                .suiteFile(suiteFile)
                .members(subSuite.isMisc() ? List.of() : subSuite.getMembers())
                .timeout(timeoutFor(subSuite, params))
                .extraArgs(resmokeArgs(suiteFile, suite.getSuiteName(), params))
                .dependency(ARCHIVE_DEPENDENCY);
        if (params.getResmokeJobsMax() != null) {
            task.variable(RESMOKE_JOBS_MAX, String.valueOf(params.getResmokeJobsMax()));
        }
        if (params.getGenTaskConfigLocation() != null) {
            task.variable(GEN_TASK_CONFIG_LOCATION, params.getGenTaskConfigLocation());
        }
        return task.build();
    }

    /** Estimate for the sub-suite, scaled by repeats; unspecified when default timeouts are forced. */
    public TimeoutEstimate timeoutFor(SubSuite subSuite, ResmokeTaskParams params) {
        if (options.isUseDefaultTimeouts()) {
            return TimeoutEstimate.unspecified();
        }
        return timeoutEstimator.estimate(subSuite).repeated(params.getEffectiveRepeatSuites());
    }

    static List<TaskArgument> resmokeArgs(String suiteFile, String originSuite, ResmokeTaskParams params) {
        List<TaskArgument> args = new ArrayList<>();
        args.add(TaskArgument.of("--suite", suiteFile));
        args.add(TaskArgument.of("--originSuite", originSuite));
        List<TaskArgument> callerArgs = TaskArgument.parse(params.getResmokeArgs());
        args.addAll(callerArgs);
        boolean repeatGiven = callerArgs.stream().anyMatch(a -> a.getKey().contains("repeat"));
        if (params.getRepeatSuites() != null && !repeatGiven) {
            args.add(TaskArgument.of("--repeatSuites", params.getRepeatSuites()));
        }
        return args;
    }
}

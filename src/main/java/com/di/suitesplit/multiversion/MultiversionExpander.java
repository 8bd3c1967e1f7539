package com.di.suitesplit.multiversion;

import com.di.suitesplit.split.GeneratedSuite;
import com.di.suitesplit.split.SubSuite;
import com.di.suitesplit.task.GeneratedTask;
import com.di.suitesplit.task.ResmokeTaskGenerator;
import com.di.suitesplit.task.ResmokeTaskParams;
import com.di.suitesplit.task.TaskArgument;
import com.di.suitesplit.task.TaskGenerationOptions;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Fans a split suite out across version mixes: one task per (sub-suite, version mix), misc included.
 *
 * <p>The output size is always {@code (subSuites + misc) * versionConfigs}. Duplicate configs yield
 * duplicate tasks. Task names carry the mix label after the task name, e.g.
 * {@code core_new-old-new_0_3_linux}. Timeouts come from the sub-suite, so every mix of a
 * sub-suite gets the same estimate.
 */
@Slf4j
public class MultiversionExpander {

    public static final String BACKPORT_REQUIRED_TAG = "backport_required_multiversion";
    public static final String MULTIVERSION_INCOMPATIBLE_TAG = "multiversion_incompatible";
    public static final String EXCLUDE_TAGS_FILE = "multiversion_exclude_tags.yml";

    private final ResmokeTaskGenerator taskGenerator;
    private final TaskGenerationOptions options;

    public MultiversionExpander(ResmokeTaskGenerator taskGenerator, TaskGenerationOptions options) {
        this.taskGenerator = taskGenerator;
        this.options = options;
    }

    public List<GeneratedTask> expand(GeneratedSuite suite, List<VersionMixConfig> versionConfigs,
                                      MultiversionParams multiversion, ResmokeTaskParams params) {
        List<SubSuite> subSuites = new ArrayList<>(suite.getSubSuites());
        suite.getMisc().ifPresent(subSuites::add);

        List<TaskArgument> exclusions = exclusionArgs(multiversion);
        List<GeneratedTask> tasks = new ArrayList<>(subSuites.size() * versionConfigs.size());
        for (VersionMixConfig config : versionConfigs) {
            String baseName = suite.getTaskName() + "_" + config.getLabel();
            for (SubSuite subSuite : subSuites) {
                GeneratedTask template = taskGenerator.createTask(baseName, suite, subSuite, params);
                tasks.add(forVersionMix(template, config, exclusions, multiversion));
            }
        }
        log.info("[MULTIVERSION] {}: {} sub-suites x {} version mixes = {} tasks",
                suite.getTaskName(), subSuites.size(), versionConfigs.size(), tasks.size());
        return tasks;
    }

    private static GeneratedTask forVersionMix(GeneratedTask template, VersionMixConfig config,
                                               List<TaskArgument> exclusions, MultiversionParams multiversion) {
        GeneratedTask.GeneratedTaskBuilder task = template.toBuilder()
                .versionMix(config.getLabel())
                .extraArgs(config.getFlags())
                .extraArgs(exclusions);
        if (multiversion.getTestList() != null && !multiversion.getTestList().isBlank()) {
            task.extraArgs(TaskArgument.parse(multiversion.getTestList()));
        }
        return task.build();
    }

    private List<TaskArgument> exclusionArgs(MultiversionParams multiversion) {
        return List.of(
                TaskArgument.of("--excludeWithAnyTags", excludeTags(multiversion)),
                TaskArgument.of("--tagFile", options.generatedFileLocation(EXCLUDE_TAGS_FILE)));
    }

    /** Base exclusion tags plus the parent task's backport tag. */
    static String excludeTags(MultiversionParams multiversion) {
        StringBuilder tags = new StringBuilder();
        if (multiversion.getRequiresFcvTag() != null && !multiversion.getRequiresFcvTag().isBlank()) {
            tags.append(multiversion.getRequiresFcvTag()).append(',');
        }
        tags.append(MULTIVERSION_INCOMPATIBLE_TAG).append(',')
                .append(BACKPORT_REQUIRED_TAG).append(',')
                .append(multiversion.getParentTaskName()).append('_').append(BACKPORT_REQUIRED_TAG);
        return tags.toString();
    }
}

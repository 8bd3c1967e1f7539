package com.di.suitesplit.task;

import com.di.suitesplit.catalog.TestRef;
import com.di.suitesplit.timeout.TimeoutEstimate;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * One schedulable task produced from a sub-suite (and, for multiversion, one version mix).
 * Immutable; per-version-mix variants are derived with {@code toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class GeneratedTask {
    String name;
    /** Name of the generated suite the task runs. */
    String subSuiteName;
    /** Generated suite definition file passed to the runner. */
    String suiteFile;
    /** Tests in the sub-suite; empty for the misc suite. */
    @Singular
    List<TestRef> members;
    TimeoutEstimate timeout;
    @Singular
    List<TaskArgument> extraArgs;
    /** Variables passed to the task's run command, e.g. {@code resmoke_jobs_max}. */
    @Singular
    Map<String, String> variables;
    @Singular
    List<String> dependencies;
    /** Version-mix label; null outside multiversion generation. */
    String versionMix;

    /** Runner arguments joined as a command line. */
    public String getCommandLine() {
        return extraArgs.stream().map(TaskArgument::render).collect(Collectors.joining(" "));
    }

    public boolean hasArgument(String key) {
        return extraArgs.stream().anyMatch(a -> a.getKey().equals(key));
    }
}

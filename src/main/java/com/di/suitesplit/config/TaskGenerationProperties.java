package com.di.suitesplit.config;

import com.di.suitesplit.task.TaskGenerationOptions;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * How tasks are generated, bound from {@code suitesplit.generation.*}.
 */
@Data
@ConfigurationProperties(prefix = "suitesplit.generation")
public class TaskGenerationProperties {

    private boolean createMiscSuite = true;
    private boolean useDefaultTimeouts = false;
    private String generatedConfigDir = "generated_resmoke_config";
    /** Default repeat count when a request gives none. */
    private Integer repeatSuites = 1;
    private Integer resmokeJobsMax;
    /** Feature-compatibility tag excluded from multiversion runs. */
    private String requiresFcvTag = "requires_fcv_51";

    public TaskGenerationOptions toOptions() {
        return TaskGenerationOptions.builder()
                .useDefaultTimeouts(useDefaultTimeouts)
                .generatedConfigDir(generatedConfigDir)
                .build();
    }
}

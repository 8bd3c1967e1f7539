package com.di.suitesplit.task;

import lombok.Builder;
import lombok.Value;

/**
 * Global options for how tasks are generated, shared by every suite in a run.
 */
@Value
@Builder
public class TaskGenerationOptions {
    /** Ignore estimates and let every task use the platform default timeout. */
    boolean useDefaultTimeouts;
    @Builder.Default
    String generatedConfigDir = "generated_resmoke_config";

    /** Location of a generated suite file. */
    public String suiteLocation(String suiteFile) {
        return generatedFileLocation(suiteFile);
    }

    public String generatedFileLocation(String fileName) {
        return generatedConfigDir + "/" + fileName;
    }
}

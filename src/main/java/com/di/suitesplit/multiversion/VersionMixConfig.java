package com.di.suitesplit.multiversion;

import com.di.suitesplit.task.TaskArgument;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * A labeled assignment of old/new binaries to cluster nodes, e.g. {@code new-old-new}.
 */
@Value
@Builder
public class VersionMixConfig {
    String label;
    ClusterTopology topology;

    /** {@code --mixedBinVersions=<label>} followed by the topology flags. */
    public List<TaskArgument> getFlags() {
        List<TaskArgument> flags = new ArrayList<>();
        flags.add(TaskArgument.of("--mixedBinVersions", label));
        flags.addAll(topology.toArguments());
        return flags;
    }
}

package com.di.suitesplit.multiversion;

import java.util.List;

/**
 * Version mixes generated by default for replica-set and sharded suites.
 */
public final class VersionMixConfigs {

    public static final List<String> REPLICA_SET_LABELS = List.of("new-old-new", "new-new-old", "old-new-new");
    public static final List<String> SHARDED_LABELS = List.of("new-old-old-new");

    private VersionMixConfigs() {
    }

    public static List<VersionMixConfig> forSuite(boolean sharded) {
        return sharded ? of(SHARDED_LABELS, true) : of(REPLICA_SET_LABELS, false);
    }

    /** Builds configs for explicit labels, all on the topology implied by {@code sharded}. */
    public static List<VersionMixConfig> of(List<String> labels, boolean sharded) {
        ClusterTopology topology = sharded ? ClusterTopology.TWO_SHARDS : ClusterTopology.LINEAR_REPLICA_SET;
        return labels.stream()
                .map(label -> VersionMixConfig.builder().label(label).topology(topology).build())
                .toList();
    }
}

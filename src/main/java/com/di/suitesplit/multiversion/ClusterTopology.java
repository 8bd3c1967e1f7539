package com.di.suitesplit.multiversion;

import com.di.suitesplit.task.TaskArgument;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixture shape a version mix runs against.
 */
@Value
public class ClusterTopology {

    public enum Kind { REPLICA_SET, SHARDED_CLUSTER }

    /** Three-node replica set with chained replication. */
    public static final ClusterTopology LINEAR_REPLICA_SET = new ClusterTopology(Kind.REPLICA_SET, 0, 3, true);
    /** Two shards of two-node replica sets. */
    public static final ClusterTopology TWO_SHARDS = new ClusterTopology(Kind.SHARDED_CLUSTER, 2, 2, false);

    Kind kind;
    /** Shard count; 0 for a replica set. */
    int numShards;
    int numReplSetNodes;
    boolean linearChain;

    public boolean isSharded() {
        return kind == Kind.SHARDED_CLUSTER;
    }

    /** Fixture flags for the runner. */
    public List<TaskArgument> toArguments() {
        List<TaskArgument> args = new ArrayList<>(3);
        if (isSharded()) {
            args.add(TaskArgument.of("--numShards", numShards));
        }
        args.add(TaskArgument.of("--numReplSetNodes", numReplSetNodes));
        if (linearChain) {
            args.add(TaskArgument.of("--linearChain", "on"));
        }
        return args;
    }
}

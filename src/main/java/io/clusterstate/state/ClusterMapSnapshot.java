package io.clusterstate.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;
import io.clusterstate.models.NodeStats;
import io.clusterstate.models.PartitionId;
import io.clusterstate.models.PartitionStats;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * Immutable copy of the {@link AggregatedMap} at one committed version,
 * handed to collaborators outside the store lock.
 */
@Value
public class ClusterMapSnapshot {

    @JsonProperty("version")
    long version;

    @JsonProperty("stamp_millis")
    long stampMillis;

    @JsonProperty("node_stats")
    ImmutableMap<Integer, NodeStats> nodeStats;

    @JsonProperty("node_epochs")
    ImmutableMap<Integer, Long> nodeEpochs;

    @JsonProperty("partition_stats")
    ImmutableMap<PartitionId, PartitionStats> partitionStats;

    ClusterMapSnapshot(long version,
                       long stampMillis,
                       Map<Integer, NodeStats> nodeStats,
                       Map<Integer, Long> nodeEpochs,
                       Map<PartitionId, PartitionStats> partitionStats) {
        this.version = version;
        this.stampMillis = stampMillis;
        this.nodeStats = ImmutableMap.copyOf(nodeStats);
        this.nodeEpochs = ImmutableMap.copyOf(nodeEpochs);
        this.partitionStats = ImmutableMap.copyOf(partitionStats);
    }

    public Optional<PartitionStats> getPartitionStats(PartitionId partitionId) {
        return Optional.ofNullable(partitionStats.get(partitionId));
    }

    public Optional<NodeStats> getNodeStats(int nodeId) {
        return Optional.ofNullable(nodeStats.get(nodeId));
    }
}

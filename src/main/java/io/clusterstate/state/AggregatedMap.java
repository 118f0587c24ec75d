package io.clusterstate.state;

import io.clusterstate.models.NodeStats;
import io.clusterstate.models.PartitionId;
import io.clusterstate.models.PartitionStats;
import lombok.Getter;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Committed global view of the cluster: the latest accepted statistics of
 * every node and partition, stamped with a version that advances by exactly
 * one per commit.
 *
 * <p>Mutated only through {@link #applyDelta(VersionedDelta)}, which the
 * {@link ClusterStateStore} calls under its lock. Readers outside the store
 * get a {@link ClusterMapSnapshot} instead of this object.
 */
@Getter
public class AggregatedMap {

    private long version;
    private long stampMillis;

    private final Map<Integer, NodeStats> nodeStats = new HashMap<>();
    private final Map<Integer, Long> nodeEpochs = new HashMap<>();
    private final Map<PartitionId, PartitionStats> partitionStats = new HashMap<>();

    public Optional<PartitionStats> getPartitionStats(PartitionId partitionId) {
        return Optional.ofNullable(partitionStats.get(partitionId));
    }

    public Map<Integer, NodeStats> getNodeStats() {
        return Collections.unmodifiableMap(nodeStats);
    }

    public Map<Integer, Long> getNodeEpochs() {
        return Collections.unmodifiableMap(nodeEpochs);
    }

    public Map<PartitionId, PartitionStats> getPartitionStats() {
        return Collections.unmodifiableMap(partitionStats);
    }

    /**
     * Fold a staged delta into this map. Cost is proportional to the size of the delta.
     *
     * @throws IllegalStateException if the delta is not for the next version
     */
    void applyDelta(VersionedDelta delta) {
        if (delta.getVersion() != version + 1) {
            throw new IllegalStateException("Delta version " + delta.getVersion()
                + " does not follow committed version " + version);
        }
        nodeStats.putAll(delta.getNodeStatUpdates());
        nodeEpochs.putAll(delta.getNodeEpochUpdates());
        for (Integer nodeId : delta.getNodeStatRemovals()) {
            nodeStats.remove(nodeId);
            nodeEpochs.remove(nodeId);
        }
        partitionStats.putAll(delta.getPartitionStatUpdates());
        for (PartitionId partitionId : delta.getPartitionRemovals()) {
            partitionStats.remove(partitionId);
        }
        version = delta.getVersion();
        stampMillis = delta.getStampMillis();
    }

    ClusterMapSnapshot toSnapshot() {
        return new ClusterMapSnapshot(version, stampMillis, nodeStats, nodeEpochs, partitionStats);
    }
}

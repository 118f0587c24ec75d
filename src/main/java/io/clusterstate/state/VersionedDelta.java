package io.clusterstate.state;

import io.clusterstate.models.NodeStats;
import io.clusterstate.models.PartitionId;
import io.clusterstate.models.PartitionStats;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Staging area for changes not yet folded into the {@link AggregatedMap}.
 *
 * <p>Updates are whole-value replacements keyed by node or partition; a later
 * stage for the same key overwrites the earlier one. Removals and updates for
 * the same key are mutually exclusive, the last call wins. A delta is never
 * cleared in place: after a commit the store discards it and starts a new one.
 *
 * <p>Not thread-safe. Only touched while holding the {@link ClusterStateStore} lock.
 */
@Getter
@ToString
public class VersionedDelta {

    @Setter
    private long version;

    @Setter
    private long stampMillis;

    private final Map<Integer, NodeStats> nodeStatUpdates = new HashMap<>();
    private final Map<Integer, Long> nodeEpochUpdates = new HashMap<>();
    private final Set<Integer> nodeStatRemovals = new HashSet<>();
    private final Map<PartitionId, PartitionStats> partitionStatUpdates = new HashMap<>();
    private final Set<PartitionId> partitionRemovals = new HashSet<>();

    public void updateNodeStats(int nodeId, long epoch, NodeStats stats) {
        nodeStatRemovals.remove(nodeId);
        nodeStatUpdates.put(nodeId, stats);
        nodeEpochUpdates.put(nodeId, epoch);
    }

    public void removeNode(int nodeId) {
        nodeStatUpdates.remove(nodeId);
        nodeEpochUpdates.remove(nodeId);
        nodeStatRemovals.add(nodeId);
    }

    public void updatePartitionStats(PartitionId partitionId, PartitionStats stats) {
        partitionRemovals.remove(partitionId);
        partitionStatUpdates.put(partitionId, stats);
    }

    public void removePartition(PartitionId partitionId) {
        partitionStatUpdates.remove(partitionId);
        partitionRemovals.add(partitionId);
    }

    public Optional<PartitionStats> getStagedPartitionStats(PartitionId partitionId) {
        return Optional.ofNullable(partitionStatUpdates.get(partitionId));
    }

    public boolean isEmpty() {
        return nodeStatUpdates.isEmpty()
            && nodeStatRemovals.isEmpty()
            && partitionStatUpdates.isEmpty()
            && partitionRemovals.isEmpty();
    }

    public int size() {
        return nodeStatUpdates.size() + nodeStatRemovals.size()
            + partitionStatUpdates.size() + partitionRemovals.size();
    }

    public Map<Integer, NodeStats> getNodeStatUpdates() {
        return Collections.unmodifiableMap(nodeStatUpdates);
    }

    public Map<Integer, Long> getNodeEpochUpdates() {
        return Collections.unmodifiableMap(nodeEpochUpdates);
    }

    public Set<Integer> getNodeStatRemovals() {
        return Collections.unmodifiableSet(nodeStatRemovals);
    }

    public Map<PartitionId, PartitionStats> getPartitionStatUpdates() {
        return Collections.unmodifiableMap(partitionStatUpdates);
    }

    public Set<PartitionId> getPartitionRemovals() {
        return Collections.unmodifiableSet(partitionRemovals);
    }
}

package io.clusterstate.topology;

import io.clusterstate.metrics.MetricsProvider;
import io.clusterstate.models.PartitionId;
import io.clusterstate.models.PartitionStats;
import io.clusterstate.models.TopologySnapshot;
import io.clusterstate.state.AdmissionFilter;
import io.clusterstate.state.AggregatedMap;
import io.clusterstate.state.ClusterStateStore;
import io.clusterstate.state.VersionedDelta;
import io.micrometer.core.instrument.Counter;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static io.clusterstate.metrics.MetricsConstants.STALE_MARKED_PARTITIONS_METRIC_NAME;

/**
 * Reconciles the aggregated map with a new authoritative topology snapshot.
 *
 * <p>Every call re-scans all tracked nodes and partitions against the snapshot
 * instead of diffing it against the previous one. The corrective changes,
 * the admission filter refresh and the commit all happen under the store lock
 * in one step, so topology changes are never left pending.
 */
@Slf4j
public class TopologySyncEngine {

    private final ClusterStateStore store;
    private final Counter partitionsMarkedStale;

    public TopologySyncEngine(ClusterStateStore store, MetricsProvider metricsProvider) {
        this.store = store;
        this.partitionsMarkedStale = metricsProvider.counter(STALE_MARKED_PARTITIONS_METRIC_NAME, Map.of());
    }

    /**
     * Take the store lock and apply the snapshot.
     *
     * @return the version committed for this snapshot
     */
    public long applyTopology(TopologySnapshot topology) {
        return store.withLock(() -> onTopologyChange(topology));
    }

    /**
     * Apply a topology snapshot. The caller must already hold the store lock.
     *
     * @return the version committed for this snapshot
     * @throws IllegalStateException if the store lock is not held by the calling thread
     */
    public long onTopologyChange(TopologySnapshot topology) {
        store.assertLockHeld();

        store.stageNextVersion();
        log.info("Applying topology epoch {}: {} pools, {} nodes",
            topology.getEpoch(), topology.getPools().size(), topology.getNodes().size());

        checkNodes(topology);
        // Uses the filter from the previous snapshot, so pools dropped just now survive until the next pass
        checkDeletedPools();
        checkDownPartitions(topology);

        // Keep the pools we filter partition updates by in step with this topology
        store.getAdmissionFilter().replace(topology.getPools());

        return store.commitLocked();
    }

    /**
     * Drop the stats of nodes that no longer exist in the topology, whether
     * committed or only staged since the last commit.
     */
    private void checkNodes(TopologySnapshot topology) {
        AggregatedMap committed = store.getAggregatedMap();
        VersionedDelta delta = store.getPendingDelta();
        Set<Integer> tracked = new TreeSet<>(committed.getNodeStats().keySet());
        tracked.addAll(delta.getNodeStatUpdates().keySet());
        for (Integer nodeId : tracked) {
            if (!topology.nodeExists(nodeId)) {
                log.info("Node {} no longer exists, removing its stats", nodeId);
                delta.removeNode(nodeId);
            }
        }
    }

    /**
     * Drop partitions whose pool was already absent from the admission filter.
     */
    private void checkDeletedPools() {
        AggregatedMap committed = store.getAggregatedMap();
        AdmissionFilter filter = store.getAdmissionFilter();
        VersionedDelta delta = store.getPendingDelta();
        int removed = 0;
        for (PartitionId partitionId : committed.getPartitionStats().keySet()) {
            if (!filter.admits(partitionId)) {
                delta.removePartition(partitionId);
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Removing {} partitions of deleted pools", removed);
        }
    }

    /**
     * Mark stale every partition whose primary is missing or down, including
     * partitions staged since the last commit.
     * Brute force over all partitions rather than only those of nodes that changed state.
     */
    private void checkDownPartitions(TopologySnapshot topology) {
        AggregatedMap committed = store.getAggregatedMap();
        VersionedDelta delta = store.getPendingDelta();
        long now = store.currentTimeMillis();
        Set<PartitionId> tracked = new TreeSet<>(committed.getPartitionStats().keySet());
        tracked.addAll(delta.getPartitionStatUpdates().keySet());
        tracked.removeAll(delta.getPartitionRemovals());
        int marked = 0;
        for (PartitionId partitionId : tracked) {
            // Prefer what this delta already staged for the partition
            PartitionStats current = delta.getStagedPartitionStats(partitionId)
                .or(() -> committed.getPartitionStats(partitionId))
                .orElseThrow();
            int primary = current.getPrimary();
            if (current.isStale() || topology.isNodeUp(primary)) {
                continue;
            }
            log.debug("Marking {} stale, primary {} is {}", partitionId, primary,
                topology.nodeExists(primary) ? "down" : "gone");
            delta.updatePartitionStats(partitionId, current.markStale(now));
            marked++;
        }
        if (marked > 0) {
            log.info("Marked {} partitions stale", marked);
            partitionsMarkedStale.increment(marked);
        }
    }
}

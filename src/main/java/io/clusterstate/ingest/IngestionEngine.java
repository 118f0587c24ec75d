package io.clusterstate.ingest;

import io.clusterstate.metrics.MetricsProvider;
import io.clusterstate.models.NodeStatusReport;
import io.clusterstate.models.PartitionId;
import io.clusterstate.models.PartitionStats;
import io.clusterstate.models.VersionPair;
import io.clusterstate.state.AdmissionFilter;
import io.clusterstate.state.AggregatedMap;
import io.clusterstate.state.ClusterStateStore;
import io.clusterstate.state.VersionedDelta;
import io.micrometer.core.instrument.Counter;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

import static io.clusterstate.metrics.MetricsConstants.NODE_REPORTS_METRIC_NAME;
import static io.clusterstate.metrics.MetricsConstants.OUTCOME_ACCEPTED;
import static io.clusterstate.metrics.MetricsConstants.OUTCOME_INVALID;
import static io.clusterstate.metrics.MetricsConstants.OUTCOME_STALE;
import static io.clusterstate.metrics.MetricsConstants.OUTCOME_TAG;
import static io.clusterstate.metrics.MetricsConstants.OUTCOME_UNKNOWN_POOL;
import static io.clusterstate.metrics.MetricsConstants.PARTITION_UPDATES_METRIC_NAME;

/**
 * Merges node status reports into the pending delta.
 *
 * <p>Node statistics are staged unconditionally, latest arrival wins. Each
 * partition entry is staged only if its pool passes the admission filter and
 * its version pair is strictly newer than anything already committed or
 * staged for that partition, so the outcome does not depend on the order in
 * which reports from different nodes arrive.
 *
 * <p>Rejected entries are logged and counted; they never fail the report.
 * Ingestion does not commit.
 */
@Slf4j
public class IngestionEngine {

    private final ClusterStateStore store;
    private final Counter reportsIngested;
    private final Counter partitionsAccepted;
    private final Counter partitionsUnknownPool;
    private final Counter partitionsStale;
    private final Counter partitionsInvalid;

    public IngestionEngine(ClusterStateStore store, MetricsProvider metricsProvider) {
        this.store = store;
        this.reportsIngested = metricsProvider.counter(NODE_REPORTS_METRIC_NAME, Map.of());
        this.partitionsAccepted = metricsProvider.counter(PARTITION_UPDATES_METRIC_NAME, Map.of(OUTCOME_TAG, OUTCOME_ACCEPTED));
        this.partitionsUnknownPool = metricsProvider.counter(PARTITION_UPDATES_METRIC_NAME, Map.of(OUTCOME_TAG, OUTCOME_UNKNOWN_POOL));
        this.partitionsStale = metricsProvider.counter(PARTITION_UPDATES_METRIC_NAME, Map.of(OUTCOME_TAG, OUTCOME_STALE));
        this.partitionsInvalid = metricsProvider.counter(PARTITION_UPDATES_METRIC_NAME, Map.of(OUTCOME_TAG, OUTCOME_INVALID));
    }

    public IngestResult ingest(NodeStatusReport report) {
        IngestResult result = store.withLock(() -> ingestLocked(report));
        reportsIngested.increment();
        partitionsAccepted.increment(result.getAccepted());
        partitionsUnknownPool.increment(result.getRejectedUnknownPool());
        partitionsStale.increment(result.getRejectedStale());
        partitionsInvalid.increment(result.getRejectedInvalid());
        return result;
    }

    private IngestResult ingestLocked(NodeStatusReport report) {
        final int from = report.getNodeId();
        VersionedDelta delta = store.getPendingDelta();
        AggregatedMap committed = store.getAggregatedMap();
        AdmissionFilter filter = store.getAdmissionFilter();

        if (report.getNodeStats() != null) {
            delta.updateNodeStats(from, report.getEpoch(), report.getNodeStats());
        } else {
            // Keep whatever we already have for the node
            log.debug("Node {} sent a report without node stats", from);
        }

        int accepted = 0;
        int unknownPool = 0;
        int stale = 0;
        int invalid = 0;
        for (Map.Entry<PartitionId, PartitionStats> entry : report.getPartitionStats().entrySet()) {
            PartitionId partitionId = entry.getKey();
            PartitionStats stats = entry.getValue();
            if (partitionId == null || stats == null) {
                log.debug("Node {} reported {} without stats, skipping", from, partitionId);
                invalid++;
                continue;
            }
            VersionPair incoming = stats.getVersionOrZero();

            // Topology says this partition should not exist
            if (!filter.admits(partitionId)) {
                log.debug("Node {} reported {} at {} state {} but pool not in {}",
                    from, partitionId, incoming, stats.getState(), filter.getPools());
                unknownPool++;
                continue;
            }

            VersionPair known = knownVersion(partitionId, committed, delta);
            if (known != null && !incoming.isNewerThan(known)) {
                log.debug("Node {} reported {} at {}, already have {}", from, partitionId, incoming, known);
                stale++;
                continue;
            }

            delta.updatePartitionStats(partitionId, stats);
            accepted++;
        }

        log.debug("Ingested report from node {} epoch {}: {} accepted, {} unknown pool, {} stale, {} invalid",
            from, report.getEpoch(), accepted, unknownPool, stale, invalid);
        return new IngestResult(accepted, unknownPool, stale, invalid);
    }

    /**
     * Highest version pair seen so far for a partition, across the committed map and the pending delta.
     */
    private VersionPair knownVersion(PartitionId partitionId, AggregatedMap committed, VersionedDelta delta) {
        VersionPair committedVersion = committed.getPartitionStats(partitionId)
            .map(PartitionStats::getVersionOrZero)
            .orElse(null);
        VersionPair stagedVersion = delta.getStagedPartitionStats(partitionId)
            .map(PartitionStats::getVersionOrZero)
            .orElse(null);
        if (committedVersion == null) {
            return stagedVersion;
        }
        if (stagedVersion == null) {
            return committedVersion;
        }
        return stagedVersion.compareTo(committedVersion) > 0 ? stagedVersion : committedVersion;
    }
}

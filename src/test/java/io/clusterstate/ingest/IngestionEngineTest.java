package io.clusterstate.ingest;

import io.clusterstate.metrics.MetricsProvider;
import io.clusterstate.models.NodeMembership;
import io.clusterstate.models.NodeStats;
import io.clusterstate.models.NodeStatusReport;
import io.clusterstate.models.PartitionId;
import io.clusterstate.models.PartitionStats;
import io.clusterstate.models.TopologySnapshot;
import io.clusterstate.models.VersionPair;
import io.clusterstate.state.ClusterMapSnapshot;
import io.clusterstate.state.ClusterStateStore;
import io.clusterstate.topology.TopologySyncEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;

class IngestionEngineTest {

    private static final PartitionId P1 = PartitionId.of(1, 0);
    private static final PartitionId P2 = PartitionId.of(1, 1);

    private SimpleMeterRegistry registry;
    private ClusterStateStore store;
    private IngestionEngine ingestionEngine;
    private TopologySyncEngine topologySyncEngine;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        MetricsProvider metricsProvider = new MetricsProvider(registry, "test-aggregator");
        store = new ClusterStateStore(metricsProvider);
        ingestionEngine = new IngestionEngine(store, metricsProvider);
        topologySyncEngine = new TopologySyncEngine(store, metricsProvider);
        topologySyncEngine.applyTopology(topology(1L, 7L));
    }

    @Test
    void testIngest_OlderVersionDoesNotOverwriteNewer() {
        // Given
        ingestionEngine.ingest(report(0, P1, partition(5, 10, "active")));

        // When
        IngestResult result = ingestionEngine.ingest(report(1, P1, partition(5, 9, "inactive")));
        store.commit();

        // Then
        assertThat(result.getRejectedStale()).isEqualTo(1);
        PartitionStats committed = store.snapshot().getPartitionStats(P1).orElseThrow();
        assertThat(committed.getState()).isEqualTo("active");
        assertThat(committed.getVersion()).isEqualTo(VersionPair.of(5, 10));
    }

    @Test
    void testIngest_StaleAgainstCommittedVersion() {
        // Given
        ingestionEngine.ingest(report(0, P1, partition(5, 10, "active")));
        store.commit();

        // When
        IngestResult result = ingestionEngine.ingest(report(1, P1, partition(4, 99, "inactive")));

        // Then
        assertThat(result.getRejectedStale()).isEqualTo(1);
        store.runWithLock(() -> assertThat(store.getPendingDelta().getPartitionStatUpdates()).doesNotContainKey(P1));
    }

    @Test
    void testIngest_EqualVersionIsDuplicate() {
        // Given
        ingestionEngine.ingest(report(0, P1, partition(5, 10, "active")));
        store.commit();

        // When
        IngestResult result = ingestionEngine.ingest(report(0, P1, partition(5, 10, "peering")));
        store.commit();

        // Then
        assertThat(result.getAccepted()).isZero();
        assertThat(store.snapshot().getPartitionStats(P1).orElseThrow().getState()).isEqualTo("active");
    }

    @Test
    void testIngest_NewerEpochWinsOverHigherSequence() {
        // Given
        ingestionEngine.ingest(report(0, P1, partition(5, 100, "active")));

        // When
        IngestResult result = ingestionEngine.ingest(report(1, P1, partition(6, 1, "active+remapped")));
        store.commit();

        // Then
        assertThat(result.getAccepted()).isEqualTo(1);
        assertThat(store.snapshot().getPartitionStats(P1).orElseThrow().getState()).isEqualTo("active+remapped");
    }

    @Test
    void testIngest_UnknownPoolIsDiscarded() {
        // When
        IngestResult result = ingestionEngine.ingest(report(0, PartitionId.of(9, 0), partition(1, 1, "active")));
        store.commit();

        // Then
        assertThat(result.getRejectedUnknownPool()).isEqualTo(1);
        assertThat(store.snapshot().getPartitionStats()).isEmpty();
        assertThat(registry.find("partition_stat_updates").tag("outcome", "unknown_pool").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    void testIngest_RejectedEntriesDoNotAbortBatch() {
        // Given
        NodeStatusReport report = NodeStatusReport.builder()
            .nodeId(0)
            .epoch(20)
            .nodeStats(NodeStats.builder().build())
            .partitionStat(PartitionId.of(9, 0), partition(1, 1, "active"))
            .partitionStat(P1, partition(1, 1, "active"))
            .partitionStat(P2, partition(1, 2, "active"))
            .build();

        // When
        IngestResult result = ingestionEngine.ingest(report);

        // Then
        assertThat(result.getAccepted()).isEqualTo(2);
        assertThat(result.getRejectedUnknownPool()).isEqualTo(1);
        assertThat(result.getTotal()).isEqualTo(3);
    }

    @Test
    void testIngest_MissingNodeStatsKeepsSnapshotReadable() {
        // Given
        ingestionEngine.ingest(NodeStatusReport.builder()
            .nodeId(2).epoch(20).nodeStats(NodeStats.builder().usedBytes(70).build()).build());
        store.commit();

        // When
        IngestResult result = ingestionEngine.ingest(NodeStatusReport.builder()
            .nodeId(2).epoch(21)
            .partitionStat(P1, partition(1, 1, "active"))
            .build());
        ingestionEngine.ingest(NodeStatusReport.builder()
            .nodeId(5).epoch(21)
            .partitionStat(P2, partition(1, 1, "active"))
            .build());
        store.commit();

        // Then
        assertThat(result.getAccepted()).isEqualTo(1);
        ClusterMapSnapshot snapshot = store.snapshot();
        assertThat(snapshot.getNodeStats(2).orElseThrow().getUsedBytes()).isEqualTo(70L);
        assertThat(snapshot.getNodeEpochs()).containsEntry(2, 20L);
        assertThat(snapshot.getNodeStats()).doesNotContainKey(5);
        assertThat(snapshot.getPartitionStats()).containsOnlyKeys(P1, P2);
    }

    @Test
    void testIngest_NullPartitionEntrySkipped() {
        // Given
        NodeStatusReport report = NodeStatusReport.builder()
            .nodeId(0)
            .epoch(20)
            .nodeStats(NodeStats.builder().build())
            .partitionStat(P1, null)
            .partitionStat(P2, partition(1, 1, "active"))
            .build();

        // When
        IngestResult result = ingestionEngine.ingest(report);
        store.commit();

        // Then
        assertThat(result.getRejectedInvalid()).isEqualTo(1);
        assertThat(result.getAccepted()).isEqualTo(1);
        assertThat(result.getTotal()).isEqualTo(2);
        assertThat(store.snapshot().getPartitionStats()).containsOnlyKeys(P2);
        assertThat(registry.find("partition_stat_updates").tag("outcome", "invalid").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    void testIngest_NodeStatsLastArrivalWins() {
        // Given
        ingestionEngine.ingest(NodeStatusReport.builder()
            .nodeId(3).epoch(20).nodeStats(NodeStats.builder().usedBytes(100).build()).build());

        // When
        ingestionEngine.ingest(NodeStatusReport.builder()
            .nodeId(3).epoch(19).nodeStats(NodeStats.builder().usedBytes(50).build()).build());
        store.commit();

        // Then
        ClusterMapSnapshot snapshot = store.snapshot();
        assertThat(snapshot.getNodeStats(3).orElseThrow().getUsedBytes()).isEqualTo(50L);
        assertThat(snapshot.getNodeEpochs()).containsEntry(3, 19L);
    }

    @Test
    void testIngest_DoesNotCommit() {
        long before = store.getCommittedVersion();

        ingestionEngine.ingest(report(0, P1, partition(1, 1, "active")));

        assertThat(store.getCommittedVersion()).isEqualTo(before);
        assertThat(store.snapshot().getPartitionStats()).isEmpty();
    }

    @Test
    void testIngest_OutcomeIndependentOfArrivalOrder() {
        // Given
        List<NodeStatusReport> reports = List.of(
            report(0, P1, partition(5, 8, "peering")),
            report(1, P1, partition(5, 12, "active+clean")),
            report(2, P1, partition(5, 11, "active")),
            report(1, P1, partition(4, 30, "down")));

        // When
        PartitionStats forward = ingestAllAndCommit(reports);
        List<NodeStatusReport> reversed = new ArrayList<>(reports);
        Collections.reverse(reversed);
        setUp();
        PartitionStats backward = ingestAllAndCommit(reversed);

        // Then
        assertThat(forward).isEqualTo(backward);
        assertThat(forward.getVersion()).isEqualTo(VersionPair.of(5, 12));
    }

    @Test
    void testIngest_ConcurrentReportsKeepHighestVersion() throws Exception {
        // Given
        int threads = 8;
        int reportsPerThread = 200;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (int t = 0; t < threads; t++) {
            final int nodeId = t;
            futures.add(executor.submit(() -> {
                start.await();
                for (int seq = 1; seq <= reportsPerThread; seq++) {
                    ingestionEngine.ingest(report(nodeId, P1, partition(5, seq * threads + nodeId, "active")));
                    if (seq % 50 == 0) {
                        store.commit();
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get();
        }
        executor.shutdown();
        store.commit();

        // Then
        PartitionStats committed = store.snapshot().getPartitionStats(P1).orElseThrow();
        assertThat(committed.getVersion())
            .isEqualTo(VersionPair.of(5, (long) reportsPerThread * threads + threads - 1));
    }

    private PartitionStats ingestAllAndCommit(List<NodeStatusReport> reports) {
        reports.forEach(ingestionEngine::ingest);
        store.commit();
        return store.snapshot().getPartitionStats(P1).orElseThrow();
    }

    private TopologySnapshot topology(Long... pools) {
        TopologySnapshot.TopologySnapshotBuilder builder = TopologySnapshot.builder().epoch(20);
        for (Long pool : pools) {
            builder.pool(pool);
        }
        for (int node = 0; node < 8; node++) {
            builder.node(node, NodeMembership.up());
        }
        return builder.build();
    }

    private NodeStatusReport report(int nodeId, PartitionId partitionId, PartitionStats stats) {
        return NodeStatusReport.builder()
            .nodeId(nodeId)
            .epoch(20)
            .nodeStats(NodeStats.builder().build())
            .partitionStat(partitionId, stats)
            .build();
    }

    private PartitionStats partition(long epoch, long seq, String state) {
        return PartitionStats.builder()
            .version(VersionPair.of(epoch, seq))
            .state(state)
            .actingPrimary(0)
            .upPrimary(0)
            .build();
    }
}

package io.clusterstate.diagnostics;

import io.clusterstate.config.ClusterStateConfig;
import io.clusterstate.enums.InterfaceClass;
import io.clusterstate.models.InterfacePingStats;
import io.clusterstate.models.NodeStats;
import io.clusterstate.models.PeerPingTimes;
import io.clusterstate.state.ClusterStateStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.clusterstate.config.Constants.MICROS_PER_SECOND;

/**
 * Read-only queries over the committed cluster map.
 */
@Slf4j
public class DiagnosticsQueryEngine {

    private final ClusterStateStore store;
    private final ClusterStateConfig config;

    public DiagnosticsQueryEngine(ClusterStateStore store, ClusterStateConfig config) {
        this.store = store;
        this.config = config;
    }

    /**
     * List heartbeat latencies between nodes whose worst rolling average reaches the threshold.
     *
     * @param thresholdMicros minimum latency to report; {@code 0} reports everything,
     *                        {@code null} uses the configured slow ping warning level
     * @return entries ordered by {@link NetworkPingEntry#REPORT_ORDER}
     */
    public NetworkPingReport queryTopLatencies(Long thresholdMicros) {
        long threshold = resolveThreshold(thresholdMicros);
        List<NetworkPingEntry> entries = store.withLock(() -> collectEntries(threshold));
        entries.sort(NetworkPingEntry.REPORT_ORDER);
        log.debug("Network ping query with threshold {}us matched {} entries", threshold, entries.size());
        return new NetworkPingReport(threshold, List.copyOf(entries));
    }

    long resolveThreshold(Long requested) {
        long threshold;
        if (requested != null) {
            threshold = requested;
        } else {
            // Default to the health warning level
            threshold = config.getWarnOnSlowPingTimeMicros();
            if (threshold == 0) {
                threshold = (long) (config.getHeartbeatGraceSeconds() * MICROS_PER_SECOND * config.getWarnOnSlowPingRatio());
            }
        }
        return Math.max(threshold, 0L);
    }

    private List<NetworkPingEntry> collectEntries(long threshold) {
        List<NetworkPingEntry> entries = new ArrayList<>();
        for (Map.Entry<Integer, NodeStats> node : store.getAggregatedMap().getNodeStats().entrySet()) {
            if (node.getValue() == null) {
                continue;
            }
            for (Map.Entry<Integer, PeerPingTimes> peer : node.getValue().getPeerPingTimes().entrySet()) {
                for (InterfaceClass interfaceClass : InterfaceClass.values()) {
                    InterfacePingStats stats = peer.getValue().get(interfaceClass);
                    if (stats == null || !stats.hasSamples()) {
                        continue;
                    }
                    long observed = stats.getObservedLatency();
                    if (threshold == 0 || observed >= threshold) {
                        entries.add(NetworkPingEntry.builder()
                            .observedLatency(observed)
                            .from(node.getKey())
                            .to(peer.getKey())
                            .interfaceClass(interfaceClass)
                            .average(stats.getAverage())
                            .min(stats.getMin())
                            .max(stats.getMax())
                            .last(stats.getLast())
                            .build());
                    }
                }
            }
        }
        return entries;
    }
}

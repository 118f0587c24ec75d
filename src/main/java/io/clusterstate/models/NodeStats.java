package io.clusterstate.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Node-level statistics carried by every status report: capacity usage and
 * heartbeat latency towards each peer node.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class NodeStats {

    @JsonProperty("total_bytes")
    long totalBytes;

    @JsonProperty("used_bytes")
    long usedBytes;

    @JsonProperty("available_bytes")
    long availableBytes;

    @JsonProperty("num_partitions")
    int numPartitions;

    @JsonProperty("heartbeat_peers")
    @Singular
    List<Integer> heartbeatPeers;

    // peer node id -> latency samples towards that peer
    @JsonProperty("peer_ping_times")
    @Singular
    Map<Integer, PeerPingTimes> peerPingTimes;
}

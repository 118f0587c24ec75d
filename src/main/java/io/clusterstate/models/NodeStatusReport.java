package io.clusterstate.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Periodic status report sent by a storage node, already decoded by the transport.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class NodeStatusReport {

    @JsonProperty("node_id")
    int nodeId;

    // topology epoch the node was at when it built the report
    @JsonProperty("epoch")
    long epoch;

    @JsonProperty("node_stats")
    NodeStats nodeStats;

    @JsonProperty("partition_stats")
    @Singular("partitionStat")
    Map<PartitionId, PartitionStats> partitionStats;
}

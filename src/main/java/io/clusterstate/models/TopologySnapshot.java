package io.clusterstate.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;
import java.util.Set;

/**
 * Full authoritative topology as published by the topology service: the pools
 * that exist and the membership of every known node. Always a complete
 * snapshot, never a diff.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class TopologySnapshot {

    @JsonProperty("epoch")
    long epoch;

    @JsonProperty("pools")
    @Singular
    Set<Long> pools;

    // node id -> membership; nodes absent from this map no longer exist
    @JsonProperty("nodes")
    @Singular
    Map<Integer, NodeMembership> nodes;

    public boolean nodeExists(int nodeId) {
        return nodes.containsKey(nodeId);
    }

    public boolean isNodeUp(int nodeId) {
        NodeMembership membership = nodes.get(nodeId);
        return membership != null && membership.isUp();
    }
}

package io.clusterstate.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Membership of a single node in a topology snapshot.
 */
@Value
public class NodeMembership {

    @JsonProperty("up")
    boolean up;

    @JsonCreator
    public NodeMembership(@JsonProperty("up") boolean up) {
        this.up = up;
    }

    public static NodeMembership up() {
        return new NodeMembership(true);
    }

    public static NodeMembership down() {
        return new NodeMembership(false);
    }
}

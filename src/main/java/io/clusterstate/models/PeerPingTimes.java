package io.clusterstate.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusterstate.enums.InterfaceClass;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Latency samples from a reporting node to one of its heartbeat peers.
 * Either interface may be absent; the front network is optional in most deployments.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class PeerPingTimes {

    @JsonProperty("front")
    InterfacePingStats front;

    @JsonProperty("back")
    InterfacePingStats back;

    public InterfacePingStats get(InterfaceClass interfaceClass) {
        switch (interfaceClass) {
            case FRONT:
                return front;
            case BACK:
                return back;
            default:
                throw new IllegalArgumentException("Unknown interface class: " + interfaceClass);
        }
    }
}

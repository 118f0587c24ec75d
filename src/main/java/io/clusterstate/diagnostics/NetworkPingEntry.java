package io.clusterstate.diagnostics;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.clusterstate.enums.InterfaceClass;
import io.clusterstate.models.PingWindows;
import lombok.Builder;
import lombok.Value;

import java.util.Comparator;

/**
 * Latency from one node to one peer over one interface, as listed in a {@link NetworkPingReport}.
 */
@Value
@Builder
@JsonPropertyOrder({"from osd", "to osd", "interface", "average", "min", "max", "last"})
public class NetworkPingEntry {

    /**
     * Worst latency first; ties broken by source, target, then front before back.
     */
    public static final Comparator<NetworkPingEntry> REPORT_ORDER =
        Comparator.comparingLong(NetworkPingEntry::getObservedLatency).reversed()
            .thenComparingInt(NetworkPingEntry::getFrom)
            .thenComparingInt(NetworkPingEntry::getTo)
            .thenComparing(NetworkPingEntry::getInterfaceClass);

    @JsonIgnore
    long observedLatency;

    @JsonProperty("from osd")
    int from;

    @JsonProperty("to osd")
    int to;

    @JsonProperty("interface")
    InterfaceClass interfaceClass;

    @JsonProperty("average")
    PingWindows average;

    @JsonProperty("min")
    PingWindows min;

    @JsonProperty("max")
    PingWindows max;

    @JsonProperty("last")
    long last;
}

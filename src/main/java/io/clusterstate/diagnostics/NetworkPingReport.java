package io.clusterstate.diagnostics;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/**
 * Result of the {@code dump_osd_network} command: the threshold actually
 * applied and the entries at or above it, worst first.
 */
@Value
public class NetworkPingReport {

    @JsonProperty("threshold")
    long threshold;

    @JsonProperty("entries")
    List<NetworkPingEntry> entries;
}

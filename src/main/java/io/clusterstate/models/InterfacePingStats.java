package io.clusterstate.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Heartbeat latency samples to one peer over one interface class.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class InterfacePingStats {

    @JsonProperty("average")
    @Builder.Default
    PingWindows average = PingWindows.EMPTY;

    @JsonProperty("min")
    @Builder.Default
    PingWindows min = PingWindows.EMPTY;

    @JsonProperty("max")
    @Builder.Default
    PingWindows max = PingWindows.EMPTY;

    @JsonProperty("last")
    long last;

    /**
     * Worst rolling average across the three windows.
     */
    @JsonIgnore
    public long getObservedLatency() {
        return average.getMax();
    }

    @JsonIgnore
    public boolean hasSamples() {
        return last != 0 || average.getMax() != 0;
    }
}

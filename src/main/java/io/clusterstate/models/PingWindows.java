package io.clusterstate.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

/**
 * One value per rolling window (1, 5 and 15 minutes), in microseconds.
 */
@Value
@JsonPropertyOrder({"1min", "5min", "15min"})
public class PingWindows {

    public static final PingWindows EMPTY = new PingWindows(0, 0, 0);

    @JsonProperty("1min")
    long oneMinute;

    @JsonProperty("5min")
    long fiveMinutes;

    @JsonProperty("15min")
    long fifteenMinutes;

    @JsonCreator
    public PingWindows(@JsonProperty("1min") long oneMinute,
                       @JsonProperty("5min") long fiveMinutes,
                       @JsonProperty("15min") long fifteenMinutes) {
        this.oneMinute = oneMinute;
        this.fiveMinutes = fiveMinutes;
        this.fifteenMinutes = fifteenMinutes;
    }

    public static PingWindows of(long oneMinute, long fiveMinutes, long fifteenMinutes) {
        return new PingWindows(oneMinute, fiveMinutes, fifteenMinutes);
    }

    @JsonIgnore
    public long getMax() {
        return Math.max(oneMinute, Math.max(fiveMinutes, fifteenMinutes));
    }
}

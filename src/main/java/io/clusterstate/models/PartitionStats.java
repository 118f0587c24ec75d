package io.clusterstate.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusterstate.config.Constants;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Arrays;

/**
 * Status of a single partition as reported by the node currently serving it.
 * Instances are immutable; corrective transitions produce modified copies
 * through {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class PartitionStats {

    @JsonProperty("version")
    VersionPair version;

    // "+"-joined state flags, e.g. "active+clean"
    @JsonProperty("state")
    String state;

    @JsonProperty("up_primary")
    @Builder.Default
    int upPrimary = -1;

    @JsonProperty("acting_primary")
    @Builder.Default
    int actingPrimary = -1;

    @JsonProperty("reported_at")
    long reportedAt;

    @JsonProperty("last_unstale")
    long lastUnstale;

    @JsonProperty("num_objects")
    long numObjects;

    @JsonProperty("num_bytes")
    long numBytes;

    @JsonIgnore
    public VersionPair getVersionOrZero() {
        return version != null ? version : VersionPair.ZERO;
    }

    /**
     * The node responsible for this partition: acting primary if known, else up primary.
     */
    @JsonIgnore
    public int getPrimary() {
        return actingPrimary >= 0 ? actingPrimary : upPrimary;
    }

    public boolean hasStateFlag(String flag) {
        if (state == null || state.isEmpty()) {
            return false;
        }
        return Arrays.asList(state.split("\\" + Constants.STATE_SEPARATOR)).contains(flag);
    }

    @JsonIgnore
    public boolean isStale() {
        return hasStateFlag(Constants.STATE_STALE);
    }

    /**
     * Copy of these stats with the stale flag added and {@code lastUnstale} moved to {@code nowMillis}.
     */
    public PartitionStats markStale(long nowMillis) {
        String newState = (state == null || state.isEmpty())
            ? Constants.STATE_STALE
            : state + Constants.STATE_SEPARATOR + Constants.STATE_STALE;
        return toBuilder()
            .state(newState)
            .lastUnstale(nowMillis)
            .build();
    }
}

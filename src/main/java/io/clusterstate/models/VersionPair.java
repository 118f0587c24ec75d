package io.clusterstate.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Two-level logical clock stamped on partition stats by the reporting node:
 * the topology epoch the report was made in, and a per-partition sequence.
 * Ordered lexicographically, epoch first.
 */
@Value
public class VersionPair implements Comparable<VersionPair> {

    public static final VersionPair ZERO = new VersionPair(0, 0);

    @JsonProperty("epoch")
    long epoch;

    @JsonProperty("sequence")
    long sequence;

    @JsonCreator
    public VersionPair(@JsonProperty("epoch") long epoch, @JsonProperty("sequence") long sequence) {
        this.epoch = epoch;
        this.sequence = sequence;
    }

    public static VersionPair of(long epoch, long sequence) {
        return new VersionPair(epoch, sequence);
    }

    public boolean isNewerThan(VersionPair other) {
        return other == null || compareTo(other) > 0;
    }

    @Override
    public int compareTo(VersionPair other) {
        int byEpoch = Long.compare(epoch, other.epoch);
        return byEpoch != 0 ? byEpoch : Long.compare(sequence, other.sequence);
    }

    @Override
    public String toString() {
        return epoch + ":" + sequence;
    }
}

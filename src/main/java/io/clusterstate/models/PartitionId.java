package io.clusterstate.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

/**
 * Identifies a partition by the pool it belongs to and its seed within that pool.
 * Rendered as {@code <pool>.<seed hex>}, for example {@code 7.1a}.
 */
@Value
public class PartitionId implements Comparable<PartitionId> {

    long pool;
    int seed;

    public static PartitionId of(long pool, int seed) {
        return new PartitionId(pool, seed);
    }

    /**
     * Parse the text form produced by {@link #toString()}.
     */
    @JsonCreator
    public static PartitionId parse(String text) {
        int dot = text.indexOf('.');
        if (dot <= 0 || dot == text.length() - 1) {
            throw new IllegalArgumentException("Invalid partition id: " + text);
        }
        try {
            long pool = Long.parseLong(text.substring(0, dot));
            int seed = Integer.parseUnsignedInt(text.substring(dot + 1), 16);
            return new PartitionId(pool, seed);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid partition id: " + text, e);
        }
    }

    @Override
    public int compareTo(PartitionId other) {
        int byPool = Long.compare(pool, other.pool);
        return byPool != 0 ? byPool : Integer.compareUnsigned(seed, other.seed);
    }

    @Override
    @JsonValue
    public String toString() {
        return pool + "." + Integer.toHexString(seed);
    }
}

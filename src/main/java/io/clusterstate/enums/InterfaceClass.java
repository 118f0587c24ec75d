package io.clusterstate.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Network path over which heartbeat latency between two nodes is sampled.
 * Declaration order is the tie-break order in latency reports: {@code FRONT} sorts before {@code BACK}.
 *
 * <ul>
 *   <li><strong>FRONT</strong> - public network, shared with client traffic</li>
 *   <li><strong>BACK</strong> - cluster network used for replication and heartbeats</li>
 * </ul>
 */
public enum InterfaceClass {
    FRONT("front"),
    BACK("back");

    private final String value;

    InterfaceClass(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static InterfaceClass fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Interface class cannot be null");
        }
        for (InterfaceClass ic : values()) {
            if (ic.value.equalsIgnoreCase(value.trim())) {
                return ic;
            }
        }
        throw new IllegalArgumentException("Unknown interface class: " + value);
    }
}

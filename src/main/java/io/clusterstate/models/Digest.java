package io.clusterstate.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Opaque health and monitor status blobs pushed by the monitor cluster.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Digest {

    @JsonProperty("health_json")
    private String healthJson;

    @JsonProperty("mon_status_json")
    private String monStatusJson;
}

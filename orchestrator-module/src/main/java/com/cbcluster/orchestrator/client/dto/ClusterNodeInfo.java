package com.cbcluster.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A node as listed by {@code /pools/nodes}; hostname includes the management port.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClusterNodeInfo(
        @JsonProperty("hostname")
        String hostname
) {
}

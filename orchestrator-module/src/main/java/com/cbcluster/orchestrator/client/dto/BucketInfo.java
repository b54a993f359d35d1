package com.cbcluster.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BucketInfo(
        @JsonProperty("name")
        String name,

        @JsonProperty("nodes")
        List<BucketNode> nodes
) {

    public static final String HEALTHY_STATUS = "healthy";

    /**
     * Whether every node hosting the bucket reports it healthy. A missing node list is not healthy.
     */
    public boolean isHealthy() {
        return nodes != null && nodes.stream().allMatch(node -> HEALTHY_STATUS.equals(node.status()));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BucketNode(
            @JsonProperty("hostname")
            String hostname,

            @JsonProperty("status")
            String status
    ) {
    }
}

package com.cbcluster.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NodeServices(
        @JsonProperty("hostname")
        String hostname,

        @JsonProperty("services")
        Map<String, Integer> services,

        @JsonProperty("thisNode")
        boolean thisNode
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Response(
            @JsonProperty("nodesExt")
            List<NodeServices> nodesExt
    ) {
    }
}

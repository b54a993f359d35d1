package com.cbcluster.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Pool(
        @JsonProperty("nodes")
        List<ClusterNodeInfo> nodes
) {

    public Pool {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }

    public List<String> hostnames() {
        return nodes.stream().map(ClusterNodeInfo::hostname).toList();
    }
}

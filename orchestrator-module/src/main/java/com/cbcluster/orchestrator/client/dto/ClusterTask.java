package com.cbcluster.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ClusterTask(
        @JsonProperty("task_id")
        String taskId,

        @JsonProperty("type")
        String type,

        @JsonProperty("status")
        String status
) {
}

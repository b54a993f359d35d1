package com.cbcluster.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SampleBucketResponse(
        @JsonProperty("tasks")
        List<ClusterTask> tasks
) {

    public SampleBucketResponse {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public Optional<String> firstTaskId() {
        return tasks.stream()
                .map(ClusterTask::taskId)
                .filter(id -> id != null && !id.isEmpty())
                .findFirst();
    }
}

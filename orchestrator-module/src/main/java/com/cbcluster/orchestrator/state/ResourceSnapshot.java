package com.cbcluster.orchestrator.state;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable published state of one resource.
 *
 * @param stateDetail transient text shown while the state lasts, e.g. {@code Rebalancing}
 * @param exitCode    set once the resource stopped
 * @param properties  values exposed to dependents, e.g. the connection string
 * @param urls        active URLs; cleared when the resource stops
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResourceSnapshot(
        String name,
        ResourceKind kind,
        String parentName,
        ResourceState state,
        String stateDetail,
        Integer exitCode,
        Instant startedAt,
        Instant stoppedAt,
        Map<String, String> properties,
        List<String> urls
) {

    public ResourceSnapshot {
        properties = properties == null ? Map.of() : Map.copyOf(properties);
        urls = urls == null ? List.of() : List.copyOf(urls);
    }

    public static ResourceSnapshot initial(OrchestratedResource resource) {
        return new ResourceSnapshot(resource.name(), resource.kind(), resource.parentName(),
                ResourceState.NOT_STARTED, null, null, null, null, Map.of(), List.of());
    }

    public ResourceSnapshot starting(String detail) {
        return new ResourceSnapshot(name, kind, parentName, ResourceState.STARTING, detail, null,
                null, null, properties, List.of());
    }

    public ResourceSnapshot running() {
        return new ResourceSnapshot(name, kind, parentName, ResourceState.RUNNING, null, null,
                Instant.now(), null, properties, urls);
    }

    public ResourceSnapshot stopping() {
        return new ResourceSnapshot(name, kind, parentName, ResourceState.STOPPING, null, exitCode,
                startedAt, stoppedAt, properties, urls);
    }

    /**
     * Terminal state: a non-zero exit while starting is a failed start, anything else an exit.
     */
    public ResourceSnapshot stopped(int code) {
        ResourceState terminal = state == ResourceState.STARTING && code != 0
                ? ResourceState.FAILED_TO_START
                : ResourceState.EXITED;
        return new ResourceSnapshot(name, kind, parentName, terminal, null, code,
                startedAt, Instant.now(), properties, List.of());
    }

    public ResourceSnapshot withStateDetail(String detail) {
        return new ResourceSnapshot(name, kind, parentName, state, detail, exitCode,
                startedAt, stoppedAt, properties, urls);
    }

    public ResourceSnapshot withProperty(String key, String value) {
        Map<String, String> changed = new LinkedHashMap<>(properties);
        changed.put(key, value);
        return new ResourceSnapshot(name, kind, parentName, state, stateDetail, exitCode,
                startedAt, stoppedAt, changed, urls);
    }

    public ResourceSnapshot withUrls(List<String> activeUrls) {
        return new ResourceSnapshot(name, kind, parentName, state, stateDetail, exitCode,
                startedAt, stoppedAt, properties, activeUrls);
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }
}

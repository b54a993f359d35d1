package com.cbcluster.orchestrator.health;

import com.cbcluster.common.model.ClusterTopology;
import com.cbcluster.orchestrator.state.ResourceKind;
import com.cbcluster.orchestrator.state.ResourceSnapshot;
import com.cbcluster.orchestrator.state.ResourceState;
import com.cbcluster.orchestrator.state.ResourceStateRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Evaluates the node-count requirement of the cluster over the published node states.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClusterHealthService {

    private final ResourceStateRegistry resourceStateRegistry;
    private final ClusterTopology topology;

    private volatile NodeCountHealthRequirement requirement;

    /**
     * Starts evaluating the requirement; called once the cluster is running.
     */
    public void register(NodeCountHealthRequirement healthRequirement) {
        if (requirement == null) {
            log.info("Registered health requirement {}", healthRequirement);
        }
        this.requirement = healthRequirement;
    }

    public ClusterHealth health() {
        ResourceState clusterState = resourceStateRegistry.snapshot(topology.resourceName())
                .map(ResourceSnapshot::state)
                .orElse(ResourceState.NOT_STARTED);
        List<ResourceSnapshot> nodes = resourceStateRegistry.snapshots().stream()
                .filter(snapshot -> snapshot.kind() == ResourceKind.SERVER)
                .toList();
        int healthy = (int) nodes.stream().filter(node -> node.state() == ResourceState.RUNNING).count();
        int unhealthy = nodes.size() - healthy;

        NodeCountHealthRequirement current = requirement;
        if (current == null) {
            return new ClusterHealth(ClusterHealth.Status.UNKNOWN, clusterState, healthy, unhealthy);
        }
        boolean up = clusterState == ResourceState.RUNNING && current.isSatisfied(healthy, unhealthy);
        return new ClusterHealth(up ? ClusterHealth.Status.UP : ClusterHealth.Status.DOWN,
                clusterState, healthy, unhealthy);
    }
}

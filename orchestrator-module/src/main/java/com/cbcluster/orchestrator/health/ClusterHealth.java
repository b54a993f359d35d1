package com.cbcluster.orchestrator.health;

import com.cbcluster.orchestrator.state.ResourceState;

public record ClusterHealth(
        Status status,
        ResourceState clusterState,
        int healthyNodes,
        int unhealthyNodes
) {

    public enum Status {
        UP,
        DOWN,
        /** No requirement registered yet: the cluster never reached running. */
        UNKNOWN
    }

    public boolean isUp() {
        return status == Status.UP;
    }
}

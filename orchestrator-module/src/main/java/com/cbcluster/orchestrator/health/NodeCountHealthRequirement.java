package com.cbcluster.orchestrator.health;

/**
 * Health of the cluster measured by how many of its nodes are running.
 */
public record NodeCountHealthRequirement(int minimumHealthyNodes, int maximumUnhealthyNodes) {

    public NodeCountHealthRequirement {
        if (minimumHealthyNodes < 0 || maximumUnhealthyNodes < 0) {
            throw new IllegalArgumentException("Node counts cannot be negative");
        }
    }

    public static NodeCountHealthRequirement defaults() {
        return new NodeCountHealthRequirement(1, Integer.MAX_VALUE);
    }

    public boolean isSatisfied(int healthyNodes, int unhealthyNodes) {
        return healthyNodes >= minimumHealthyNodes && unhealthyNodes <= maximumUnhealthyNodes;
    }
}

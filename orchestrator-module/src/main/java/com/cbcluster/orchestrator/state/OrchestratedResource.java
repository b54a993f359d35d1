package com.cbcluster.orchestrator.state;

import com.cbcluster.common.model.BucketDefinition;
import com.cbcluster.common.model.ClusterTopology;
import com.cbcluster.common.model.ServerGroup;
import com.cbcluster.common.model.ServerNode;

/**
 * A resource whose lifecycle state is published. Server groups and buckets are children of the cluster.
 */
public sealed interface OrchestratedResource {

    String name();

    ResourceKind kind();

    /**
     * Name of the parent resource, {@code null} for top-level resources.
     */
    String parentName();

    record ClusterResource(ClusterTopology topology) implements OrchestratedResource {
        @Override
        public String name() {
            return topology.resourceName();
        }

        @Override
        public ResourceKind kind() {
            return ResourceKind.CLUSTER;
        }

        @Override
        public String parentName() {
            return null;
        }
    }

    record ServerGroupResource(ServerGroup group, String parentName) implements OrchestratedResource {
        @Override
        public String name() {
            return group.name();
        }

        @Override
        public ResourceKind kind() {
            return ResourceKind.SERVER_GROUP;
        }
    }

    /**
     * A node; it runs as its own process, so its state follows that process rather than the cluster.
     */
    record ServerResource(ServerNode node) implements OrchestratedResource {
        @Override
        public String name() {
            return node.name();
        }

        @Override
        public ResourceKind kind() {
            return ResourceKind.SERVER;
        }

        @Override
        public String parentName() {
            return null;
        }
    }

    record BucketResource(BucketDefinition bucket, String parentName) implements OrchestratedResource {
        @Override
        public String name() {
            return bucket.resourceName();
        }

        @Override
        public ResourceKind kind() {
            return ResourceKind.BUCKET;
        }
    }
}

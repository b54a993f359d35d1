package com.cbcluster.common.model;

import com.cbcluster.common.exception.TopologyValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Declared shape of the cluster: its server groups, nodes and buckets.
 * Built once; exactly one data-service node is flagged as the initial (primary) node.
 */
public final class ClusterTopology {

    public static final String DEFAULT_NODE_PREFIX = "ns_1@";

    private final String resourceName;
    private final String clusterName;
    private final ClusterCredentials credentials;
    private final String nodePrefix;
    private final boolean explicitStart;
    private final CertificateAuthority certificateAuthority;
    private final List<ServerGroup> serverGroups;
    private final List<BucketDefinition> buckets;

    private ClusterTopology(Builder builder, List<ServerGroup> serverGroups) {
        this.resourceName = builder.resourceName;
        this.clusterName = builder.clusterName == null || builder.clusterName.isBlank()
                ? builder.resourceName
                : builder.clusterName;
        this.credentials = builder.credentials;
        this.nodePrefix = builder.nodePrefix;
        this.explicitStart = builder.explicitStart;
        this.certificateAuthority = builder.certificateAuthority;
        this.serverGroups = List.copyOf(serverGroups);
        this.buckets = List.copyOf(builder.buckets.values());
    }

    public static Builder builder(String resourceName, ClusterCredentials credentials) {
        return new Builder(resourceName, credentials);
    }

    public String resourceName() {
        return resourceName;
    }

    public String clusterName() {
        return clusterName;
    }

    public ClusterCredentials credentials() {
        return credentials;
    }

    public String nodePrefix() {
        return nodePrefix;
    }

    public boolean explicitStart() {
        return explicitStart;
    }

    public Optional<CertificateAuthority> certificateAuthority() {
        return Optional.ofNullable(certificateAuthority);
    }

    public boolean isSecure() {
        return certificateAuthority != null;
    }

    public List<ServerGroup> serverGroups() {
        return serverGroups;
    }

    public List<BucketDefinition> buckets() {
        return buckets;
    }

    public List<ServerNode> servers() {
        return serverGroups.stream()
                .flatMap(group -> group.nodes().stream())
                .toList();
    }

    /**
     * The node cluster-init and every later management call goes through.
     *
     * @throws TopologyValidationException if no node runs the data service
     */
    public ServerNode primaryNode() {
        return servers().stream()
                .filter(ServerNode::initialNode)
                .findFirst()
                .orElseThrow(() -> new TopologyValidationException(
                        "Couchbase cluster must have at least one server with the data service."));
    }

    public Optional<ServerNode> server(String name) {
        return servers().stream().filter(node -> node.name().equals(name)).findFirst();
    }

    public Optional<BucketDefinition> bucket(String resourceName) {
        return buckets.stream().filter(bucket -> bucket.resourceName().equals(resourceName)).findFirst();
    }

    @Override
    public String toString() {
        return "ClusterTopology[" + resourceName + ", groups=" + serverGroups.size()
                + ", servers=" + servers().size() + ", buckets=" + buckets.size() + "]";
    }

    public static final class Builder {

        private final String resourceName;
        private final ClusterCredentials credentials;
        private final Map<String, ServerGroup> serverGroups = new LinkedHashMap<>();
        private final Map<String, BucketDefinition> buckets = new LinkedHashMap<>();
        private String clusterName;
        private String nodePrefix = DEFAULT_NODE_PREFIX;
        private boolean explicitStart;
        private CertificateAuthority certificateAuthority;
        private String primaryNodeName;

        private Builder(String resourceName, ClusterCredentials credentials) {
            if (resourceName == null || resourceName.isBlank()) {
                throw new TopologyValidationException("Cluster resource name must be provided");
            }
            if (credentials == null) {
                throw new TopologyValidationException("Cluster credentials must be provided");
            }
            this.resourceName = resourceName;
            this.credentials = credentials;
        }

        public Builder clusterName(String clusterName) {
            this.clusterName = clusterName;
            return this;
        }

        public Builder nodePrefix(String nodePrefix) {
            this.nodePrefix = nodePrefix == null || nodePrefix.isBlank() ? DEFAULT_NODE_PREFIX : nodePrefix;
            return this;
        }

        public Builder explicitStart(boolean explicitStart) {
            this.explicitStart = explicitStart;
            return this;
        }

        public Builder certificateAuthority(CertificateAuthority certificateAuthority) {
            this.certificateAuthority = certificateAuthority;
            return this;
        }

        public Builder addServerGroup(String name, Set<CouchbaseService> services, List<ServerNode> nodes) {
            if (serverGroups.containsKey(name)) {
                throw new TopologyValidationException("Duplicate server group '" + name + "'");
            }
            ServerGroup group = new ServerGroup(name, services, List.of());
            List<ServerNode> groupNodes = new ArrayList<>();
            for (ServerNode node : nodes) {
                groupNodes.add(new ServerNode(node.name(), node.hostname(), node.externalHostname(), name,
                        group.services(), node.endpoints(), false));
            }
            serverGroups.put(name, new ServerGroup(name, group.services(), groupNodes));
            updatePrimary();
            return this;
        }

        /**
         * Changes the services of a group. A primary that loses the data service is replaced.
         */
        public Builder withServices(String groupName, Set<CouchbaseService> services) {
            ServerGroup existing = serverGroups.get(groupName);
            if (existing == null) {
                throw new TopologyValidationException("Unknown server group '" + groupName + "'");
            }
            ServerGroup changed = new ServerGroup(groupName, services, List.of());
            List<ServerNode> nodes = existing.nodes().stream()
                    .map(node -> node.withServices(changed.services()))
                    .toList();
            serverGroups.put(groupName, new ServerGroup(groupName, changed.services(), nodes));
            updatePrimary();
            return this;
        }

        public Builder removeServerGroup(String groupName) {
            serverGroups.remove(groupName);
            updatePrimary();
            return this;
        }

        public Builder addBucket(BucketDefinition bucket) {
            if (buckets.containsKey(bucket.resourceName())) {
                throw new TopologyValidationException("Duplicate bucket '" + bucket.resourceName() + "'");
            }
            buckets.put(bucket.resourceName(), bucket);
            return this;
        }

        public ClusterTopology build() {
            validateNames();
            List<ServerGroup> groups = serverGroups.values().stream()
                    .map(group -> new ServerGroup(group.name(), group.services(), group.nodes().stream()
                            .map(node -> node.withInitialNode(node.name().equals(primaryNodeName)))
                            .toList()))
                    .toList();
            return new ClusterTopology(this, groups);
        }

        private void updatePrimary() {
            List<ServerNode> nodes = serverGroups.values().stream()
                    .flatMap(group -> group.nodes().stream())
                    .toList();
            boolean primaryStillValid = nodes.stream()
                    .anyMatch(node -> node.name().equals(primaryNodeName) && node.hasService(CouchbaseService.DATA));
            if (!primaryStillValid) {
                primaryNodeName = nodes.stream()
                        .filter(node -> node.hasService(CouchbaseService.DATA))
                        .map(ServerNode::name)
                        .findFirst()
                        .orElse(null);
            }
        }

        private void validateNames() {
            Set<String> names = new HashSet<>(Collections.singleton(resourceName));
            for (ServerGroup group : serverGroups.values()) {
                requireUnique(names, group.name());
                for (ServerNode node : group.nodes()) {
                    requireUnique(names, node.name());
                }
            }
            Set<String> bucketNames = new HashSet<>();
            for (BucketDefinition bucket : buckets.values()) {
                requireUnique(names, bucket.resourceName());
                if (!bucketNames.add(bucket.bucketName())) {
                    throw new TopologyValidationException("Duplicate bucket name '" + bucket.bucketName() + "'");
                }
            }
        }

        private static void requireUnique(Set<String> names, String name) {
            if (!names.add(name)) {
                throw new TopologyValidationException("Duplicate resource name '" + name + "'");
            }
        }
    }
}

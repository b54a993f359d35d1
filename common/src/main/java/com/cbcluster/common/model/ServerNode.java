package com.cbcluster.common.model;

import java.net.URI;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A node of the cluster.
 *
 * @param name             resource name of the node
 * @param hostname         hostname the other nodes reach this node by
 * @param externalHostname hostname clients outside the node network reach this node by
 * @param groupName        server group the node belongs to
 * @param services         services enabled on the node
 * @param endpoints        externally published port per endpoint name
 * @param initialNode      whether the node is the primary the cluster is initialized on
 */
public record ServerNode(
        String name,
        String hostname,
        String externalHostname,
        String groupName,
        Set<CouchbaseService> services,
        Map<String, Integer> endpoints,
        boolean initialNode
) {

    /** Management port every node listens on inside the node network. */
    public static final int INTERNAL_MANAGEMENT_PORT = 8091;

    public static final String INTERNAL_DOMAIN_SUFFIX = ".dev.internal";

    public ServerNode {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Node name must be provided");
        }
        hostname = hostname == null || hostname.isBlank() ? name + INTERNAL_DOMAIN_SUFFIX : hostname;
        externalHostname = externalHostname == null || externalHostname.isBlank() ? "localhost" : externalHostname;
        services = services == null || services.isEmpty()
                ? CouchbaseService.DEFAULT_SERVICES
                : Set.copyOf(EnumSet.copyOf(services));
        endpoints = endpoints == null ? Map.of() : Map.copyOf(endpoints);
    }

    public boolean hasService(CouchbaseService service) {
        return services.contains(service);
    }

    /**
     * Address of the node as listed by the cluster, e.g. {@code node-0.dev.internal:8091}.
     */
    public String clusterAddress() {
        return hostname + ":" + INTERNAL_MANAGEMENT_PORT;
    }

    public Optional<Integer> port(String endpointName) {
        return Optional.ofNullable(endpoints.get(endpointName));
    }

    public URI managementUri(boolean secure) {
        String endpointName = secure ? EndpointNames.MANAGEMENT_SECURE : EndpointNames.MANAGEMENT;
        Integer port = endpoints.get(endpointName);
        if (port == null) {
            throw new IllegalStateException("Endpoint '" + endpointName + "' on node '" + name + "' has no published port");
        }
        return URI.create((secure ? "https" : "http") + "://" + externalHostname + ":" + port);
    }

    ServerNode withInitialNode(boolean initial) {
        return initial == initialNode ? this
                : new ServerNode(name, hostname, externalHostname, groupName, services, endpoints, initial);
    }

    ServerNode withServices(Set<CouchbaseService> newServices) {
        return new ServerNode(name, hostname, externalHostname, groupName, newServices, endpoints, initialNode);
    }
}

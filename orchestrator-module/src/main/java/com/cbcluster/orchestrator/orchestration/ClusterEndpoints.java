package com.cbcluster.orchestrator.orchestration;

import com.cbcluster.common.model.ClusterTopology;
import com.cbcluster.common.model.CouchbaseService;
import com.cbcluster.common.model.EndpointNames;
import com.cbcluster.common.model.ServerNode;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Addresses a running cluster is reachable at from outside the node network.
 */
final class ClusterEndpoints {

    private ClusterEndpoints() {
    }

    /**
     * {@code couchbase://} (or {@code couchbases://} with a CA) followed by every data node, with its published data port.
     */
    static String connectionString(ClusterTopology topology) {
        boolean secure = topology.isSecure();
        String endpointName = secure ? EndpointNames.DATA_SECURE : EndpointNames.DATA;
        String hosts = topology.servers().stream()
                .filter(node -> node.hasService(CouchbaseService.DATA))
                .map(node -> node.port(endpointName)
                        .map(port -> node.externalHostname() + ":" + port)
                        .orElse(node.externalHostname()))
                .collect(Collectors.joining(","));
        return (secure ? "couchbases://" : "couchbase://") + hosts;
    }

    static String connectionString(ClusterTopology topology, String bucketName) {
        return connectionString(topology) + "/" + bucketName;
    }

    static List<String> managementUrls(ClusterTopology topology) {
        List<String> urls = new ArrayList<>();
        for (ServerNode node : topology.servers()) {
            if (node.port(EndpointNames.MANAGEMENT).isPresent()) {
                urls.add(node.managementUri(false).toString());
            }
            if (node.port(EndpointNames.MANAGEMENT_SECURE).isPresent()) {
                urls.add(node.managementUri(true).toString());
            }
        }
        return urls;
    }
}

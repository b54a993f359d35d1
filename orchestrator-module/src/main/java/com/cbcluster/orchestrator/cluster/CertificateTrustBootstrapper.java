package com.cbcluster.orchestrator.cluster;

import com.cbcluster.common.model.ClusterTopology;
import com.cbcluster.common.model.ServerNode;
import com.cbcluster.orchestrator.client.ManagementApiClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Makes a node load the cluster CA and present a certificate issued by it. Both calls go to the
 * insecure endpoint without credentials, since the secure endpoint is not trusted yet.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CertificateTrustBootstrapper {

    private final ManagementApiClient managementApiClient;
    private final ClusterTopology topology;

    /**
     * Completes immediately when the cluster has no CA.
     */
    public Mono<Void> loadAndTrust(ServerNode node) {
        if (!topology.isSecure()) {
            return Mono.empty();
        }
        return Mono.defer(() -> {
            log.info("Loading trusted CAs on node {}", node.name());
            return managementApiClient.loadTrustedCAs(node)
                    .then(managementApiClient.reloadCertificate(node))
                    .doOnSuccess(ignored -> log.debug("Node {} reloaded its certificate", node.name()));
        });
    }
}

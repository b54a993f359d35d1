package com.cbcluster.orchestrator.cluster;

import com.cbcluster.common.model.ClusterSettings;
import com.cbcluster.common.model.ClusterTopology;
import com.cbcluster.common.model.CouchbaseService;
import com.cbcluster.common.model.MemoryQuotas;
import com.cbcluster.common.model.ServerNode;
import com.cbcluster.orchestrator.client.ManagementApiClient;
import com.cbcluster.orchestrator.config.ClusterSettingsProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import reactor.core.publisher.Mono;

/**
 * Initializes the primary node into a one-node cluster, once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClusterBootstrapper {

    private final ManagementApiClient managementApiClient;
    private final ClusterTopology topology;
    private final ClusterSettingsProvider clusterSettingsProvider;

    public Mono<Boolean> isInitialized(ServerNode node) {
        return managementApiClient.isPoolInitialized(node);
    }

    /**
     * Not idempotent: only valid once {@link #isInitialized(ServerNode)} answered {@code false}.
     */
    public Mono<Void> initialize(ServerNode node, ClusterSettings settings) {
        return Mono.defer(() -> {
            log.info("Initializing cluster {} on node {}", topology.clusterName(), node.name());
            return managementApiClient.initializeCluster(node, initForm(node, settings));
        });
    }

    /**
     * Initializes the node unless it already belongs to a cluster.
     *
     * @return whether the node was initialized by this call
     */
    public Mono<Boolean> ensureInitialized(ServerNode node) {
        return isInitialized(node).flatMap(initialized -> {
            if (initialized) {
                log.info("Node {} is already initialized", node.name());
                return Mono.just(false);
            }
            return initialize(node, clusterSettingsProvider.clusterSettings()).thenReturn(true);
        });
    }

    MultiValueMap<String, String> initForm(ServerNode node, ClusterSettings settings) {
        MemoryQuotas quotas = settings.memoryQuotas();
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("username", topology.credentials().username());
        form.add("password", topology.credentials().password());
        form.add("clusterName", topology.clusterName());
        form.add("hostname", node.hostname());
        form.add("memoryQuota", Integer.toString(quotas.dataServiceMegabytes()));
        form.add("queryMemoryQuota", Integer.toString(quotas.queryServiceMegabytes()));
        form.add("indexMemoryQuota", Integer.toString(quotas.indexServiceMegabytes()));
        form.add("ftsMemoryQuota", Integer.toString(quotas.ftsServiceMegabytes()));
        if (settings.isEnterprise()) {
            form.add("cbasMemoryQuota", Integer.toString(quotas.analyticsServiceMegabytes()));
            form.add("eventingMemoryQuota", Integer.toString(quotas.eventingServiceMegabytes()));
            form.add("nodeEncryption", "on");
        }
        form.add("indexerStorageMode", settings.indexStorageMode().wireValue());
        form.add("services", CouchbaseService.toServicesParameter(node.services()));
        form.add("port", settings.managementPort() == null ? "SAME" : settings.managementPort().toString());
        return form;
    }
}

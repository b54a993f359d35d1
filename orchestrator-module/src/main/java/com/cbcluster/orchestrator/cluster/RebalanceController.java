package com.cbcluster.orchestrator.cluster;

import com.cbcluster.common.model.ClusterTopology;
import com.cbcluster.common.model.ServerNode;
import com.cbcluster.orchestrator.client.ManagementApiClient;
import com.cbcluster.orchestrator.client.Polling;
import com.cbcluster.orchestrator.client.dto.RebalanceStatus;
import com.cbcluster.orchestrator.config.PollingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class RebalanceController {

    private final ManagementApiClient managementApiClient;
    private final ClusterTopology topology;
    private final PollingProperties pollingProperties;

    /**
     * Starts a rebalance over the given nodes.
     *
     * @param knownNodeHostnames internal hostnames of every node of the cluster, without prefix
     */
    public Mono<Void> trigger(ServerNode primary, List<String> knownNodeHostnames) {
        List<String> knownNodes = knownNodeHostnames.stream()
                .map(hostname -> topology.nodePrefix() + hostname)
                .toList();
        return Mono.defer(() -> {
            log.info("Rebalancing cluster over {}", knownNodes);
            return managementApiClient.rebalance(primary, knownNodes);
        });
    }

    /**
     * Completes once the cluster reports no rebalance in progress.
     */
    public Mono<Void> awaitCompletion(ServerNode primary) {
        return Polling.until(
                        () -> managementApiClient.getRebalanceProgress(primary)
                                .doOnNext(status -> log.debug("Rebalance status: {}", status.status())),
                        RebalanceStatus::isIdle,
                        pollingProperties.getRebalanceInterval())
                .doOnSuccess(status -> log.info("Rebalance complete"))
                .then();
    }

    public Mono<Void> rebalance(ServerNode primary, List<String> knownNodeHostnames) {
        return trigger(primary, knownNodeHostnames).then(awaitCompletion(primary));
    }
}

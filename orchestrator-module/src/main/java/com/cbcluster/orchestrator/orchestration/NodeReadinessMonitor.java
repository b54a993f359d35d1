package com.cbcluster.orchestrator.orchestration;

import com.cbcluster.common.model.ClusterTopology;
import com.cbcluster.common.model.ServerNode;
import com.cbcluster.orchestrator.client.ManagementApiClient;
import com.cbcluster.orchestrator.state.ResourceSnapshot;
import com.cbcluster.orchestrator.state.ResourceState;
import com.cbcluster.orchestrator.state.ResourceStateRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.Optional;

/**
 * Probes the management endpoint of every node and publishes a node as running when it starts
 * answering, and as exited when a running node stops answering. A node lost that way is
 * published running again once it answers; a node stopped by command is left alone.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NodeReadinessMonitor {

    static final String UNREACHABLE_DETAIL = "Unreachable";

    private static final Duration PROBE_ROUND_TIMEOUT = Duration.ofSeconds(30);

    private final ClusterTopology topology;
    private final ManagementApiClient managementApiClient;
    private final ResourceStateRegistry resourceStateRegistry;

    @Scheduled(fixedDelayString = "${orchestrator.polling.node-readiness-interval:PT2S}")
    public void probeNodes() {
        log.trace("Probing {} nodes", topology.servers().size());
        Flux.fromIterable(topology.servers())
                .flatMap(node -> managementApiClient.isReachable(node)
                        .doOnNext(reachable -> record(node, reachable)))
                .then()
                .block(PROBE_ROUND_TIMEOUT);
    }

    void record(ServerNode node, boolean reachable) {
        Optional<ResourceSnapshot> snapshot = resourceStateRegistry.snapshot(node.name());
        if (snapshot.isEmpty()) {
            return;
        }
        ResourceState state = snapshot.get().state();
        if (reachable && (state == ResourceState.NOT_STARTED || state == ResourceState.STARTING)) {
            log.info("Node {} is reachable", node.name());
            resourceStateRegistry.publish(node.name(), ResourceSnapshot::running);
        } else if (reachable && wasUnreachable(snapshot.get())) {
            log.info("Node {} is reachable again", node.name());
            resourceStateRegistry.publish(node.name(), ResourceSnapshot::running);
        } else if (!reachable && state == ResourceState.RUNNING) {
            log.warn("Node {} stopped answering", node.name());
            resourceStateRegistry.publish(node.name(), current -> current.stopped(1).withStateDetail(UNREACHABLE_DETAIL));
        }
    }

    // a node stopped by command carries no detail and stays stopped
    private static boolean wasUnreachable(ResourceSnapshot snapshot) {
        return snapshot.state() == ResourceState.EXITED && UNREACHABLE_DETAIL.equals(snapshot.stateDetail());
    }
}

package com.cbcluster.orchestrator.orchestration;

import com.cbcluster.common.model.ServerNode;
import com.cbcluster.orchestrator.state.ResourceStateRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * For nodes whose processes are run by someone else: a start only marks the node as starting,
 * leaving {@link NodeReadinessMonitor} to mark it running once it answers; a stop marks it exited.
 */
@Slf4j
@RequiredArgsConstructor
public class ExternallyManagedNodeCommandDispatcher implements NodeCommandDispatcher {

    static final String WAITING_DETAIL = "Waiting for node";

    private final ResourceStateRegistry resourceStateRegistry;

    @Override
    public Mono<Void> start(ServerNode node) {
        return Mono.fromRunnable(() -> {
            log.info("Starting node {}", node.name());
            resourceStateRegistry.publish(node.name(), snapshot -> snapshot.starting(WAITING_DETAIL));
        });
    }

    @Override
    public Mono<Void> stop(ServerNode node) {
        return Mono.fromRunnable(() -> {
            log.info("Stopping node {}", node.name());
            resourceStateRegistry.publish(node.name(), snapshot -> snapshot.stopping().stopped(0));
        });
    }
}

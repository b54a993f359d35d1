package com.cbcluster.orchestrator.orchestration;

import com.cbcluster.common.model.ServerNode;
import reactor.core.publisher.Mono;

/**
 * Starts and stops the processes running the nodes.
 */
public interface NodeCommandDispatcher {

    /**
     * Requests the node to start; completes once the request was issued, not once the node runs.
     */
    Mono<Void> start(ServerNode node);

    /**
     * Requests the node to stop; completes once the request was issued.
     */
    Mono<Void> stop(ServerNode node);
}

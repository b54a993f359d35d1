package com.cbcluster.orchestrator.cluster;

import com.cbcluster.common.model.EndpointNames;
import com.cbcluster.common.model.ServerNode;
import com.cbcluster.orchestrator.client.ManagementApiClient;
import com.cbcluster.orchestrator.state.ResourceState;
import com.cbcluster.orchestrator.state.ResourceStateRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Joins nodes to the cluster through the primary and registers their alternate addresses.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NodeJoinCoordinator {

    private final ManagementApiClient managementApiClient;
    private final CertificateTrustBootstrapper certificateTrustBootstrapper;
    private final ResourceStateRegistry resourceStateRegistry;

    /**
     * Joins every node other than the primary, all at once. A failed join is logged and reported
     * in its result; it does not affect the other joins.
     *
     * @param existingNodes hostnames with management port of the nodes already in the cluster
     * @return one result per joined node, once every join finished
     */
    public Mono<List<JoinResult>> joinAll(ServerNode primary, List<ServerNode> nodes, Collection<String> existingNodes) {
        Set<String> existing = Set.copyOf(existingNodes);
        return Flux.fromIterable(nodes)
                .filter(node -> !node.name().equals(primary.name()))
                .flatMap(node -> join(primary, node, existing))
                .collectList();
    }

    Mono<JoinResult> join(ServerNode primary, ServerNode node, Set<String> existingNodes) {
        return resourceStateRegistry.waitFor(node.name(), Set.of(ResourceState.RUNNING))
                .doOnSubscribe(subscription -> log.info("Waiting for node {}", node.name()))
                .then(Mono.defer(() -> {
                    if (existingNodes.contains(node.clusterAddress())) {
                        log.info("Node {} is already a member of the cluster", node.name());
                        return Mono.just(JoinResult.alreadyMember(node));
                    }
                    return certificateTrustBootstrapper.loadAndTrust(node)
                            .then(addNode(primary, node))
                            .thenReturn(JoinResult.added(node));
                }))
                .flatMap(result -> setAlternateAddresses(node).thenReturn(result))
                .onErrorResume(error -> {
                    log.warn("Failed to join node {}: {}", node.name(), error.getMessage());
                    return Mono.just(JoinResult.failed(node, error));
                });
    }

    private Mono<Void> addNode(ServerNode primary, ServerNode node) {
        return Mono.defer(() -> {
            log.info("Adding node {} to the cluster", node.name());
            return managementApiClient.addNode(primary, node);
        });
    }

    /**
     * Registers the external hostname of the node with every published port that maps to a service port.
     */
    public Mono<Void> setAlternateAddresses(ServerNode node) {
        return Mono.defer(() -> {
            MultiValueMap<String, String> form = alternateAddressForm(node);
            log.debug("Setting alternate addresses of node {}: {}", node.name(), form);
            return managementApiClient.setAlternateAddresses(node, form);
        });
    }

    static MultiValueMap<String, String> alternateAddressForm(ServerNode node) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("hostname", node.externalHostname());
        for (Map.Entry<String, Integer> endpoint : node.endpoints().entrySet()) {
            EndpointNames.servicePortKey(endpoint.getKey())
                    .ifPresent(key -> form.add(key, endpoint.getValue().toString()));
        }
        return form;
    }
}

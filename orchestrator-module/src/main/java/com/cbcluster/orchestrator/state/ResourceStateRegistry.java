package com.cbcluster.orchestrator.state;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Publish/subscribe channel of resource states. Each resource has one current snapshot;
 * every change is published to the watchers.
 */
public interface ResourceStateRegistry {

    /**
     * Registers a resource in state {@link ResourceState#NOT_STARTED}; registering it again is a no-op.
     */
    void register(OrchestratedResource resource);

    /**
     * Applies {@code transform} to the current snapshot of the resource and publishes the result.
     *
     * @throws com.cbcluster.orchestrator.exception.UnknownResourceException if the resource is not registered
     */
    ResourceSnapshot publish(String resourceName, UnaryOperator<ResourceSnapshot> transform);

    Optional<OrchestratedResource> resource(String resourceName);

    Optional<ResourceSnapshot> snapshot(String resourceName);

    List<ResourceSnapshot> snapshots();

    /**
     * Resources whose parent is {@code parentName}.
     */
    List<OrchestratedResource> children(String parentName);

    /**
     * Current snapshot of every resource followed by every later change.
     */
    Flux<ResourceSnapshot> watch();

    /**
     * Completes with the first snapshot of the resource, current or later, in one of {@code states}.
     */
    default Mono<ResourceSnapshot> waitFor(String resourceName, Collection<ResourceState> states) {
        return watch()
                .filter(snapshot -> snapshot.name().equals(resourceName) && states.contains(snapshot.state()))
                .next();
    }
}

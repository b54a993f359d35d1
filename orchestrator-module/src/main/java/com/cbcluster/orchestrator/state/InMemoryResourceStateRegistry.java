package com.cbcluster.orchestrator.state;

import com.cbcluster.orchestrator.exception.UnknownResourceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Registry kept in memory; nothing survives a restart. Watchers are served off the publishing
 * thread, so a watcher may publish in reaction to an update.
 */
@Slf4j
@Component
public class InMemoryResourceStateRegistry implements ResourceStateRegistry {

    private final Map<String, OrchestratedResource> resources = new ConcurrentHashMap<>();
    private final Map<String, ResourceSnapshot> snapshots = new ConcurrentHashMap<>();
    private final Sinks.Many<ResourceSnapshot> updates = Sinks.many().multicast().directBestEffort();
    private final Object lock = new Object();

    @Override
    public void register(OrchestratedResource resource) {
        synchronized (lock) {
            if (resources.putIfAbsent(resource.name(), resource) == null) {
                ResourceSnapshot initial = ResourceSnapshot.initial(resource);
                snapshots.put(resource.name(), initial);
                emit(initial);
            }
        }
    }

    @Override
    public ResourceSnapshot publish(String resourceName, UnaryOperator<ResourceSnapshot> transform) {
        synchronized (lock) {
            ResourceSnapshot current = snapshots.get(resourceName);
            if (current == null) {
                throw new UnknownResourceException(resourceName);
            }
            ResourceSnapshot next = transform.apply(current);
            snapshots.put(resourceName, next);
            if (current.state() != next.state()) {
                log.debug("Resource {} {} -> {}", resourceName, current.state(), next.state());
            }
            emit(next);
            return next;
        }
    }

    @Override
    public Optional<OrchestratedResource> resource(String resourceName) {
        return Optional.ofNullable(resources.get(resourceName));
    }

    @Override
    public Optional<ResourceSnapshot> snapshot(String resourceName) {
        return Optional.ofNullable(snapshots.get(resourceName));
    }

    @Override
    public List<ResourceSnapshot> snapshots() {
        return List.copyOf(snapshots.values());
    }

    @Override
    public List<OrchestratedResource> children(String parentName) {
        return resources.values().stream()
                .filter(resource -> parentName.equals(resource.parentName()))
                .toList();
    }

    @Override
    public Flux<ResourceSnapshot> watch() {
        return Flux.<ResourceSnapshot>create(sink -> {
            Disposable subscription;
            synchronized (lock) {
                snapshots.values().forEach(sink::next);
                subscription = updates.asFlux().subscribe(sink::next, sink::error, sink::complete);
            }
            sink.onDispose(subscription);
        }).publishOn(Schedulers.boundedElastic());
    }

    private void emit(ResourceSnapshot snapshot) {
        Sinks.EmitResult result = updates.tryEmitNext(snapshot);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Dropped state update of {}: {}", snapshot.name(), result);
        }
    }
}

package com.cbcluster.orchestrator.orchestration;

import com.cbcluster.common.model.BucketDefinition;
import com.cbcluster.common.model.ClusterTopology;
import com.cbcluster.common.model.ServerGroup;
import com.cbcluster.common.model.ServerNode;
import com.cbcluster.orchestrator.bucket.BucketProvisioner;
import com.cbcluster.orchestrator.client.ManagementApiClient;
import com.cbcluster.orchestrator.cluster.CertificateTrustBootstrapper;
import com.cbcluster.orchestrator.cluster.ClusterBootstrapper;
import com.cbcluster.orchestrator.cluster.JoinResult;
import com.cbcluster.orchestrator.cluster.NodeJoinCoordinator;
import com.cbcluster.orchestrator.cluster.RebalanceController;
import com.cbcluster.orchestrator.config.OrchestratorProperties;
import com.cbcluster.orchestrator.exception.UnknownResourceException;
import com.cbcluster.orchestrator.health.ClusterHealthService;
import com.cbcluster.orchestrator.health.NodeCountHealthRequirement;
import com.cbcluster.orchestrator.state.OrchestratedResource;
import com.cbcluster.orchestrator.state.OrchestratedResource.BucketResource;
import com.cbcluster.orchestrator.state.OrchestratedResource.ClusterResource;
import com.cbcluster.orchestrator.state.OrchestratedResource.ServerGroupResource;
import com.cbcluster.orchestrator.state.OrchestratedResource.ServerResource;
import com.cbcluster.orchestrator.state.ResourceKind;
import com.cbcluster.orchestrator.state.ResourceSnapshot;
import com.cbcluster.orchestrator.state.ResourceState;
import com.cbcluster.orchestrator.state.ResourceStateRegistry;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Drives the cluster through its lifecycle.
 *
 * <p>Once the primary node runs, the cluster is bootstrapped: certificate trust, cluster init,
 * alternate addresses, join of the other nodes and, when a node was added, a rebalance. The
 * cluster is then published as running and every declared bucket is provisioned on its own.
 * Cluster transitions are published to the server groups and buckets of the cluster as well.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrchestratorStateMachine {

    public static final String CONNECTION_STRING_PROPERTY = "connectionString";
    static final String INITIALIZING_DETAIL = "Initializing";
    static final String REBALANCING_DETAIL = "Rebalancing";

    private static final Set<ResourceState> STOP_STATES =
            Set.copyOf(EnumSet.of(ResourceState.STOPPING, ResourceState.FAILED_TO_START, ResourceState.EXITED));

    private final ClusterTopology topology;
    private final ResourceStateRegistry resourceStateRegistry;
    private final ManagementApiClient managementApiClient;
    private final ClusterBootstrapper clusterBootstrapper;
    private final CertificateTrustBootstrapper certificateTrustBootstrapper;
    private final NodeJoinCoordinator nodeJoinCoordinator;
    private final RebalanceController rebalanceController;
    private final BucketProvisioner bucketProvisioner;
    private final NodeCommandDispatcher nodeCommandDispatcher;
    private final ClusterHealthService clusterHealthService;
    private final OrchestratorProperties orchestratorProperties;
    private final Scheduler orchestrationScheduler;

    private final Map<String, Disposable> tasks = new ConcurrentHashMap<>();
    private volatile Disposable primaryWatch;

    /**
     * Registers every resource of the topology and, unless the cluster waits for an explicit
     * start, starts the cluster as soon as the primary node runs.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        registerResources();
        if (topology.explicitStart()) {
            log.info("Cluster {} waits for an explicit start", topology.resourceName());
            return;
        }
        String primaryName = topology.primaryNode().name();
        primaryWatch = resourceStateRegistry.watch()
                .filter(snapshot -> snapshot.name().equals(primaryName) && snapshot.state() == ResourceState.RUNNING)
                .subscribe(snapshot -> startCluster(false),
                        error -> log.error("Watch of primary node {} failed", primaryName, error));
    }

    /**
     * Cancels every task in flight.
     */
    @PreDestroy
    public void shutdown() {
        Disposable watch = primaryWatch;
        if (watch != null) {
            watch.dispose();
        }
        tasks.values().forEach(Disposable::dispose);
        tasks.clear();
    }

    public List<ResourceSnapshot> resources() {
        return resourceStateRegistry.snapshots();
    }

    public ResourceSnapshot resource(String name) {
        return resourceStateRegistry.snapshot(name).orElseThrow(() -> new UnknownResourceException(name));
    }

    /**
     * Explicit start of the cluster or of a bucket.
     *
     * @return whether the start was issued; {@code false} when the resource is already running or starting
     */
    public boolean start(String name) {
        OrchestratedResource resource = lookup(name);
        if (resource instanceof ClusterResource) {
            return startCluster(true);
        }
        if (resource instanceof BucketResource bucketResource) {
            return startBucket(bucketResource.bucket());
        }
        throw new IllegalArgumentException("Resource '" + name + "' of kind " + resource.kind() + " cannot be started");
    }

    /**
     * Explicit stop of the cluster or of a bucket.
     *
     * @return whether the stop was issued; {@code false} when the resource is already stopping or stopped
     */
    public boolean stop(String name) {
        OrchestratedResource resource = lookup(name);
        if (resource instanceof ClusterResource) {
            return stopCluster();
        }
        if (resource instanceof BucketResource bucketResource) {
            return stopBucket(bucketResource.bucket());
        }
        throw new IllegalArgumentException("Resource '" + name + "' of kind " + resource.kind() + " cannot be stopped");
    }

    public Mono<Void> flushBucket(String name) {
        return Mono.defer(() -> {
            if (!(lookup(name) instanceof BucketResource bucketResource)) {
                return Mono.error(new IllegalArgumentException("Resource '" + name + "' is not a bucket"));
            }
            if (resource(name).state() != ResourceState.RUNNING) {
                return Mono.error(new IllegalStateException("Bucket '" + name + "' is not running"));
            }
            return bucketProvisioner.flush(bucketResource.bucket());
        });
    }

    synchronized boolean startCluster(boolean explicit) {
        String name = topology.resourceName();
        ResourceState state = resource(name).state();
        if (state == ResourceState.RUNNING || state == ResourceState.STARTING) {
            if (explicit) {
                log.warn("Cluster {} is already {}", name, state);
            }
            return false;
        }
        publishHierarchy(snapshot -> snapshot.starting(INITIALIZING_DETAIL), snapshot -> snapshot.starting(null));

        Mono<Void> startNodes = explicit ? startStoppedNodes() : Mono.empty();
        track(name, startNodes
                .then(Mono.defer(this::bootstrap))
                .subscribeOn(orchestrationScheduler)
                .subscribe(null, this::clusterFailed, this::clusterStarted));
        return true;
    }

    synchronized boolean stopCluster() {
        String name = topology.resourceName();
        ResourceSnapshot current = resource(name);
        if (current.isTerminal() || current.state() == ResourceState.STOPPING) {
            log.warn("Cluster {} is already {}", name, current.state());
            return false;
        }
        log.info("Stopping cluster {}", name);
        cancel(name);
        topology.buckets().forEach(bucket -> cancel(bucket.resourceName()));
        publishHierarchy(ResourceSnapshot::stopping, ResourceSnapshot::stopping);

        List<ServerNode> nodes = topology.servers();
        track(name, Flux.fromIterable(nodes)
                .flatMap(nodeCommandDispatcher::stop)
                .thenMany(Flux.fromIterable(nodes)
                        .flatMap(node -> resourceStateRegistry.waitFor(node.name(), ResourceState.TERMINAL)))
                .then()
                .subscribeOn(orchestrationScheduler)
                .subscribe(null,
                        error -> {
                            log.error("Failed to stop cluster {}", name, error);
                            publishHierarchy(snapshot -> snapshot.stopped(1), snapshot -> snapshot.stopped(0));
                        },
                        () -> {
                            log.info("Cluster {} stopped", name);
                            publishHierarchy(snapshot -> snapshot.stopped(0), snapshot -> snapshot.stopped(0));
                            tasks.remove(name);
                        }));
        return true;
    }

    synchronized boolean startBucket(BucketDefinition bucket) {
        ResourceState state = resource(bucket.resourceName()).state();
        if (state == ResourceState.RUNNING || state == ResourceState.STARTING) {
            log.warn("Bucket {} is already {}", bucket.resourceName(), state);
            return false;
        }
        provisionBucket(bucket);
        return true;
    }

    synchronized boolean stopBucket(BucketDefinition bucket) {
        String name = bucket.resourceName();
        ResourceSnapshot current = resource(name);
        if (current.isTerminal() || current.state() == ResourceState.STOPPING) {
            log.warn("Bucket {} is already {}", name, current.state());
            return false;
        }
        log.info("Stopping bucket {}", name);
        resourceStateRegistry.publish(name, ResourceSnapshot::stopping);
        cancel(name);
        resourceStateRegistry.publish(name, snapshot -> snapshot.stopped(0));
        return true;
    }

    private Mono<Void> bootstrap() {
        ServerNode primary = topology.primaryNode();
        return resourceStateRegistry.waitFor(primary.name(), Set.of(ResourceState.RUNNING))
                .doOnSubscribe(subscription -> log.info("Waiting for primary node {}", primary.name()))
                .then(Mono.defer(() -> certificateTrustBootstrapper.loadAndTrust(primary)))
                .then(Mono.defer(() -> clusterBootstrapper.ensureInitialized(primary)))
                .then(Mono.defer(() -> nodeJoinCoordinator.setAlternateAddresses(primary)))
                .then(Mono.defer(() -> joinOtherNodes(primary)));
    }

    private Mono<Void> joinOtherNodes(ServerNode primary) {
        List<ServerNode> nodes = topology.servers();
        if (nodes.size() < 2) {
            return Mono.empty();
        }
        return managementApiClient.listNodes(primary)
                .flatMap(existing -> nodeJoinCoordinator.joinAll(primary, nodes, existing)
                        .flatMap(results -> rebalanceIfAdded(primary, existing, results)));
    }

    private Mono<Void> rebalanceIfAdded(ServerNode primary, Collection<String> existing, List<JoinResult> results) {
        if (results.stream().noneMatch(JoinResult::added)) {
            log.info("No node was added to cluster {}, skipping rebalance", topology.resourceName());
            return Mono.empty();
        }
        Set<String> failed = results.stream()
                .filter(result -> !result.succeeded())
                .map(result -> result.node().name())
                .collect(Collectors.toSet());
        List<String> knownNodes = topology.servers().stream()
                .filter(node -> !failed.contains(node.name()) || existing.contains(node.clusterAddress()))
                .map(ServerNode::hostname)
                .toList();
        resourceStateRegistry.publish(topology.resourceName(), snapshot -> snapshot.withStateDetail(REBALANCING_DETAIL));
        return rebalanceController.rebalance(primary, knownNodes);
    }

    private Mono<Void> startStoppedNodes() {
        return Flux.fromIterable(topology.servers())
                .filter(node -> {
                    ResourceState state = resource(node.name()).state();
                    return state.isTerminal() || state == ResourceState.NOT_STARTED;
                })
                .flatMap(nodeCommandDispatcher::start)
                .then();
    }

    private void clusterStarted() {
        String name = topology.resourceName();
        tasks.remove(name);
        String connectionString = ClusterEndpoints.connectionString(topology);
        List<String> urls = ClusterEndpoints.managementUrls(topology);
        resourceStateRegistry.publish(name, snapshot -> snapshot.running()
                .withProperty(CONNECTION_STRING_PROPERTY, connectionString)
                .withUrls(urls));
        resourceStateRegistry.children(name).stream()
                .filter(child -> child.kind() == ResourceKind.SERVER_GROUP)
                .forEach(group -> resourceStateRegistry.publish(group.name(), ResourceSnapshot::running));
        OrchestratorProperties.Health health = orchestratorProperties.getHealth();
        clusterHealthService.register(
                new NodeCountHealthRequirement(health.getMinimumHealthyNodes(), health.getMaximumUnhealthyNodes()));
        log.info("Cluster {} is running at {}", name, connectionString);

        topology.buckets().forEach(this::provisionBucket);
    }

    private void clusterFailed(Throwable error) {
        String name = topology.resourceName();
        tasks.remove(name);
        log.error("Failed to start cluster {}", name, error);
        publishHierarchy(snapshot -> snapshot.stopped(1), snapshot -> snapshot.stopped(0));
    }

    private void provisionBucket(BucketDefinition bucket) {
        String name = bucket.resourceName();
        resourceStateRegistry.publish(name, snapshot ->
                snapshot.state() == ResourceState.STARTING ? snapshot : snapshot.starting(null));

        Mono<Boolean> provisioned = resourceStateRegistry.waitFor(topology.resourceName(), Set.of(ResourceState.RUNNING))
                .then(Mono.defer(() -> bucketProvisioner.provision(bucket)))
                .thenReturn(true)
                .takeUntilOther(resourceStateRegistry.waitFor(name, STOP_STATES));

        track(name, provisioned
                .subscribeOn(orchestrationScheduler)
                .subscribe(done -> bucketStarted(bucket), error -> bucketFailed(bucket, error)));
    }

    private void bucketStarted(BucketDefinition bucket) {
        tasks.remove(bucket.resourceName());
        String connectionString = ClusterEndpoints.connectionString(topology, bucket.bucketName());
        resourceStateRegistry.publish(bucket.resourceName(), snapshot -> snapshot.running()
                .withProperty(CONNECTION_STRING_PROPERTY, connectionString));
        log.info("Bucket {} is running", bucket.resourceName());
    }

    private void bucketFailed(BucketDefinition bucket, Throwable error) {
        tasks.remove(bucket.resourceName());
        log.error("Failed to provision bucket {}", bucket.resourceName(), error);
        resourceStateRegistry.publish(bucket.resourceName(), snapshot -> snapshot.stopped(1));
    }

    private void publishHierarchy(UnaryOperator<ResourceSnapshot> clusterTransform,
                                  UnaryOperator<ResourceSnapshot> childTransform) {
        String name = topology.resourceName();
        resourceStateRegistry.publish(name, clusterTransform);
        resourceStateRegistry.children(name)
                .forEach(child -> resourceStateRegistry.publish(child.name(), childTransform));
    }

    private void registerResources() {
        String clusterName = topology.resourceName();
        resourceStateRegistry.register(new ClusterResource(topology));
        for (ServerGroup group : topology.serverGroups()) {
            resourceStateRegistry.register(new ServerGroupResource(group, clusterName));
        }
        for (ServerNode node : topology.servers()) {
            resourceStateRegistry.register(new ServerResource(node));
        }
        for (BucketDefinition bucket : topology.buckets()) {
            resourceStateRegistry.register(new BucketResource(bucket, clusterName));
        }
    }

    private OrchestratedResource lookup(String name) {
        return resourceStateRegistry.resource(name).orElseThrow(() -> new UnknownResourceException(name));
    }

    private void track(String name, Disposable task) {
        Disposable previous = tasks.put(name, task);
        if (previous != null && previous != task) {
            previous.dispose();
        }
    }

    private void cancel(String name) {
        Disposable task = tasks.remove(name);
        if (task != null) {
            task.dispose();
        }
    }
}

package com.cbcluster.orchestrator.state;

import com.cbcluster.common.model.BucketDefinition;
import com.cbcluster.common.model.BucketSettings;
import com.cbcluster.common.model.ClusterTopology;
import com.cbcluster.orchestrator.exception.UnknownResourceException;
import com.cbcluster.orchestrator.state.OrchestratedResource.BucketResource;
import com.cbcluster.orchestrator.state.OrchestratedResource.ClusterResource;
import com.cbcluster.orchestrator.state.OrchestratedResource.ServerGroupResource;
import com.cbcluster.orchestrator.state.OrchestratedResource.ServerResource;
import com.cbcluster.orchestrator.support.TestTopologies;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryResourceStateRegistryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private InMemoryResourceStateRegistry registry;
    private ClusterTopology topology;

    @BeforeEach
    void setUp() {
        registry = new InMemoryResourceStateRegistry();
        topology = TestTopologies.builder("localhost", 8091, 2)
                .addBucket(BucketDefinition.standard("default", BucketSettings.defaults()))
                .build();
        registry.register(new ClusterResource(topology));
        registry.register(new ServerGroupResource(topology.serverGroups().get(0), "couchbase"));
        topology.servers().forEach(node -> registry.register(new ServerResource(node)));
        registry.register(new BucketResource(topology.buckets().get(0), "couchbase"));
    }

    @Test
    void registeredResourcesStartNotStarted() {
        assertThat(registry.snapshots())
                .hasSize(5)
                .allSatisfy(snapshot -> assertThat(snapshot.state()).isEqualTo(ResourceState.NOT_STARTED));
        assertThat(registry.snapshot("default")).get()
                .extracting(ResourceSnapshot::kind, ResourceSnapshot::parentName)
                .containsExactly(ResourceKind.BUCKET, "couchbase");
    }

    @Test
    void registeringTwiceKeepsCurrentState() {
        registry.publish("couchbase", snapshot -> snapshot.starting("Initializing"));

        registry.register(new ClusterResource(topology));

        assertThat(registry.snapshot("couchbase")).get()
                .extracting(ResourceSnapshot::state)
                .isEqualTo(ResourceState.STARTING);
    }

    @Test
    void childrenAreResolvedByParentName() {
        assertThat(registry.children("couchbase"))
                .extracting(OrchestratedResource::name)
                .containsExactlyInAnyOrder("servers", "default");
        assertThat(registry.children("node-0")).isEmpty();
    }

    @Test
    void publishingToUnknownResourceFails() {
        assertThatThrownBy(() -> registry.publish("missing", ResourceSnapshot::running))
                .isInstanceOf(UnknownResourceException.class);
    }

    @Test
    void stoppingWhileStartingWithErrorIsFailedStart() {
        registry.publish("node-1", snapshot -> snapshot.starting(null));

        ResourceSnapshot failed = registry.publish("node-1", snapshot -> snapshot.stopped(1));

        assertThat(failed.state()).isEqualTo(ResourceState.FAILED_TO_START);
        assertThat(failed.exitCode()).isEqualTo(1);
        assertThat(failed.isTerminal()).isTrue();
    }

    @Test
    void stoppingRunningResourceClearsUrls() {
        registry.publish("couchbase", snapshot -> snapshot.running()
                .withProperty("connectionString", "couchbase://localhost:11210")
                .withUrls(List.of("http://localhost:8091")));

        ResourceSnapshot stopped = registry.publish("couchbase", snapshot -> snapshot.stopping().stopped(0));

        assertThat(stopped.state()).isEqualTo(ResourceState.EXITED);
        assertThat(stopped.urls()).isEmpty();
        assertThat(stopped.properties()).containsEntry("connectionString", "couchbase://localhost:11210");
        assertThat(stopped.stoppedAt()).isNotNull();
    }

    @Test
    void watchReplaysCurrentStateThenUpdates() {
        StepVerifier.create(registry.watch().filter(snapshot -> snapshot.name().equals("node-0")).take(3))
                .assertNext(snapshot -> assertThat(snapshot.state()).isEqualTo(ResourceState.NOT_STARTED))
                .then(() -> registry.publish("node-0", snapshot -> snapshot.starting("Waiting for node")))
                .assertNext(snapshot -> assertThat(snapshot.stateDetail()).isEqualTo("Waiting for node"))
                .then(() -> registry.publish("node-0", ResourceSnapshot::running))
                .assertNext(snapshot -> assertThat(snapshot.state()).isEqualTo(ResourceState.RUNNING))
                .expectComplete()
                .verify(TIMEOUT);
    }

    @Test
    void waitForCompletesOnCurrentMatchingState() {
        registry.publish("node-0", ResourceSnapshot::running);

        ResourceSnapshot snapshot = registry.waitFor("node-0", Set.of(ResourceState.RUNNING)).block(TIMEOUT);

        assertThat(snapshot).isNotNull();
        assertThat(snapshot.state()).isEqualTo(ResourceState.RUNNING);
    }

    @Test
    void waitForCompletesOnLaterState() {
        Mono<ResourceSnapshot> waiting = registry.waitFor("node-1", ResourceState.TERMINAL);

        StepVerifier.create(waiting)
                .then(() -> registry.publish("node-1", ResourceSnapshot::running))
                .then(() -> registry.publish("node-1", snapshot -> snapshot.stopping().stopped(0)))
                .assertNext(snapshot -> assertThat(snapshot.state()).isEqualTo(ResourceState.EXITED))
                .verifyComplete();
    }

    @Test
    void watcherMayPublishInReaction() {
        registry.watch()
                .filter(snapshot -> snapshot.name().equals("node-0") && snapshot.state() == ResourceState.RUNNING)
                .take(1)
                .subscribe(snapshot -> registry.publish("servers", ResourceSnapshot::running));

        registry.publish("node-0", ResourceSnapshot::running);

        ResourceSnapshot group = registry.waitFor("servers", Set.of(ResourceState.RUNNING)).block(TIMEOUT);
        assertThat(group).isNotNull();
    }
}

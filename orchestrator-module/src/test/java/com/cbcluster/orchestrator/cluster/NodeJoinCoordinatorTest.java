package com.cbcluster.orchestrator.cluster;

import com.cbcluster.common.model.ClusterTopology;
import com.cbcluster.common.model.EndpointNames;
import com.cbcluster.common.model.ServerNode;
import com.cbcluster.orchestrator.client.ManagementApiClient;
import com.cbcluster.orchestrator.exception.ManagementApiException;
import com.cbcluster.orchestrator.state.OrchestratedResource.ServerResource;
import com.cbcluster.orchestrator.state.ResourceSnapshot;
import com.cbcluster.orchestrator.state.ResourceStateRegistry;
import com.cbcluster.orchestrator.support.TestTopologies;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.util.MultiValueMap;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NodeJoinCoordinatorTest {

    @Mock
    private ManagementApiClient managementApiClient;

    @Mock
    private CertificateTrustBootstrapper certificateTrustBootstrapper;

    @Mock
    private ResourceStateRegistry resourceStateRegistry;

    private NodeJoinCoordinator coordinator;
    private ClusterTopology topology;
    private ServerNode primary;
    private ServerNode second;
    private ServerNode third;

    @BeforeEach
    void setUp() {
        topology = TestTopologies.topology("localhost", 8091, 3);
        primary = topology.primaryNode();
        second = topology.server("node-1").orElseThrow();
        third = topology.server("node-2").orElseThrow();
        coordinator = new NodeJoinCoordinator(managementApiClient, certificateTrustBootstrapper, resourceStateRegistry);

        lenient().when(resourceStateRegistry.waitFor(anyString(), anyCollection()))
                .thenReturn(Mono.just(ResourceSnapshot.initial(new ServerResource(second)).running()));
        lenient().when(certificateTrustBootstrapper.loadAndTrust(any())).thenReturn(Mono.empty());
        lenient().when(managementApiClient.setAlternateAddresses(any(), any())).thenReturn(Mono.empty());
    }

    @Test
    @DisplayName("Every node but the primary is added, after its certificates are trusted")
    void joinsEveryOtherNode() {
        when(managementApiClient.addNode(eq(primary), any())).thenReturn(Mono.empty());

        List<JoinResult> results = coordinator.joinAll(primary, topology.servers(),
                List.of(primary.clusterAddress())).block();

        assertThat(results).extracting(result -> result.node().name())
                .containsExactlyInAnyOrder("node-1", "node-2");
        assertThat(results).allMatch(JoinResult::added);
        verify(managementApiClient, never()).addNode(primary, primary);
        InOrder order = inOrder(certificateTrustBootstrapper, managementApiClient);
        order.verify(certificateTrustBootstrapper).loadAndTrust(second);
        order.verify(managementApiClient).addNode(primary, second);
        order.verify(managementApiClient).setAlternateAddresses(eq(second), any());
    }

    @Test
    @DisplayName("A node already in the cluster is not added again but gets its alternate addresses")
    void memberNodeIsSkipped() {
        when(managementApiClient.addNode(primary, third)).thenReturn(Mono.empty());

        List<JoinResult> results = coordinator.joinAll(primary, topology.servers(),
                List.of(primary.clusterAddress(), "node-1.dev.internal:8091")).block();

        assertThat(results).anySatisfy(result -> {
            assertThat(result.node()).isEqualTo(second);
            assertThat(result.added()).isFalse();
            assertThat(result.succeeded()).isTrue();
        });
        verify(managementApiClient, never()).addNode(primary, second);
        verify(certificateTrustBootstrapper, never()).loadAndTrust(second);
        verify(managementApiClient).setAlternateAddresses(eq(second), any());
    }

    @Test
    @DisplayName("Nothing added when every node is a member already")
    void nothingAddedWhenAllMembers() {
        List<JoinResult> results = coordinator.joinAll(primary, topology.servers(), List.of(
                primary.clusterAddress(), second.clusterAddress(), third.clusterAddress())).block();

        assertThat(results).hasSize(2).noneMatch(JoinResult::added);
        verify(managementApiClient, never()).addNode(any(), any());
    }

    @Test
    @DisplayName("A failed join does not stop the other joins")
    void failedJoinIsIsolated() {
        when(managementApiClient.addNode(primary, second))
                .thenReturn(Mono.error(new ManagementApiException(400, "Prepare join failed.")));
        when(managementApiClient.addNode(primary, third)).thenReturn(Mono.empty());

        List<JoinResult> results = coordinator.joinAll(primary, topology.servers(), List.of()).block();

        assertThat(results).anySatisfy(result -> {
            assertThat(result.node()).isEqualTo(second);
            assertThat(result.succeeded()).isFalse();
            assertThat(result.failure()).hasMessage("400: Prepare join failed.");
        });
        assertThat(results).anySatisfy(result -> {
            assertThat(result.node()).isEqualTo(third);
            assertThat(result.added()).isTrue();
        });
        verify(managementApiClient, never()).setAlternateAddresses(eq(second), any());
    }

    @Test
    @DisplayName("Nodes join concurrently, a slow join does not hold back the others")
    void joinsRunConcurrently() throws Exception {
        Sinks.Empty<Void> slowJoin = Sinks.empty();
        when(managementApiClient.addNode(primary, second)).thenReturn(slowJoin.asMono());
        when(managementApiClient.addNode(primary, third)).thenReturn(Mono.empty());

        CompletableFuture<List<JoinResult>> joining = coordinator.joinAll(primary, topology.servers(), List.of())
                .toFuture();

        verify(managementApiClient).addNode(primary, third);
        verify(managementApiClient).setAlternateAddresses(eq(third), any());
        assertThat(joining).isNotDone();

        slowJoin.tryEmitEmpty();

        assertThat(joining.get(5, TimeUnit.SECONDS))
                .hasSize(2)
                .allMatch(JoinResult::added);
    }

    @Test
    @DisplayName("Alternate addresses map published endpoints to service port keys")
    void alternateAddressForm() {
        ServerNode node = new ServerNode("node-5", null, "db.example.com", null, null, Map.of(
                EndpointNames.MANAGEMENT, 18091,
                EndpointNames.DATA_SECURE, 21207,
                EndpointNames.EVENTING_DEBUG, 19140,
                "metrics", 9102), false);

        MultiValueMap<String, String> form = NodeJoinCoordinator.alternateAddressForm(node);

        assertThat(form.getFirst("hostname")).isEqualTo("db.example.com");
        assertThat(form.getFirst("mgmt")).isEqualTo("18091");
        assertThat(form.getFirst("kvSSL")).isEqualTo("21207");
        assertThat(form.getFirst("eventingDebug")).isEqualTo("19140");
        assertThat(form).hasSize(4);
    }
}

package com.cbcluster.orchestrator.cluster;

import com.cbcluster.common.model.ClusterSettings;
import com.cbcluster.common.model.ClusterTopology;
import com.cbcluster.common.model.CouchbaseEdition;
import com.cbcluster.common.model.IndexStorageMode;
import com.cbcluster.common.model.MemoryQuotas;
import com.cbcluster.common.model.ServerNode;
import com.cbcluster.orchestrator.client.ManagementApiClient;
import com.cbcluster.orchestrator.config.ClusterSettingsProvider;
import com.cbcluster.orchestrator.support.TestTopologies;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.util.MultiValueMap;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ClusterBootstrapperTest {

    @Mock
    private ManagementApiClient managementApiClient;

    private final AtomicInteger settingsRequests = new AtomicInteger();
    private ClusterSettings settings = ClusterSettings.defaults();
    private ClusterTopology topology;
    private ServerNode primary;
    private ClusterBootstrapper bootstrapper;

    @BeforeEach
    void setUp() {
        topology = TestTopologies.builder("localhost", 8091, 1).clusterName("dev-cluster").build();
        primary = topology.primaryNode();
        ClusterSettingsProvider provider = () -> {
            settingsRequests.incrementAndGet();
            return settings;
        };
        bootstrapper = new ClusterBootstrapper(managementApiClient, topology, provider);
    }

    @Test
    @DisplayName("Initialized node is left alone")
    void initializedNodeIsNotInitializedAgain() {
        when(managementApiClient.isPoolInitialized(primary)).thenReturn(Mono.just(true));

        assertThat(bootstrapper.ensureInitialized(primary).block()).isFalse();

        verify(managementApiClient, never()).initializeCluster(any(), any());
        assertThat(settingsRequests.get()).isZero();
    }

    @Test
    @DisplayName("Uninitialized node is initialized once, with settings read at that moment")
    void uninitializedNodeIsInitialized() {
        when(managementApiClient.isPoolInitialized(primary)).thenReturn(Mono.just(false));
        when(managementApiClient.initializeCluster(any(), any())).thenReturn(Mono.empty());

        assertThat(bootstrapper.ensureInitialized(primary).block()).isTrue();

        verify(managementApiClient, times(1)).initializeCluster(any(), any());
        assertThat(settingsRequests.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Check without init keeps answering uninitialized")
    void repeatedCheckIsStable() {
        when(managementApiClient.isPoolInitialized(primary)).thenReturn(Mono.just(false));

        assertThat(bootstrapper.isInitialized(primary).block()).isFalse();
        assertThat(bootstrapper.isInitialized(primary).block()).isFalse();

        verify(managementApiClient, never()).initializeCluster(any(), any());
    }

    @Test
    @DisplayName("Enterprise init carries analytics, eventing and node encryption")
    void enterpriseInitForm() {
        settings = ClusterSettings.builder()
                .edition(CouchbaseEdition.ENTERPRISE)
                .memoryQuotas(MemoryQuotas.defaults().toBuilder().dataServiceMegabytes(2048).build())
                .indexStorageMode(IndexStorageMode.MEMORY_OPTIMIZED)
                .build();
        when(managementApiClient.isPoolInitialized(primary)).thenReturn(Mono.just(false));
        when(managementApiClient.initializeCluster(any(), any())).thenReturn(Mono.empty());

        bootstrapper.ensureInitialized(primary).block();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<MultiValueMap<String, String>> form = ArgumentCaptor.forClass(MultiValueMap.class);
        verify(managementApiClient).initializeCluster(any(), form.capture());
        MultiValueMap<String, String> sent = form.getValue();
        assertThat(sent.getFirst("username")).isEqualTo("Administrator");
        assertThat(sent.getFirst("password")).isEqualTo("password");
        assertThat(sent.getFirst("clusterName")).isEqualTo("dev-cluster");
        assertThat(sent.getFirst("hostname")).isEqualTo("node-0.dev.internal");
        assertThat(sent.getFirst("memoryQuota")).isEqualTo("2048");
        assertThat(sent.getFirst("queryMemoryQuota")).isEqualTo("1024");
        assertThat(sent.getFirst("cbasMemoryQuota")).isEqualTo("1024");
        assertThat(sent.getFirst("eventingMemoryQuota")).isEqualTo("1024");
        assertThat(sent.getFirst("nodeEncryption")).isEqualTo("on");
        assertThat(sent.getFirst("indexerStorageMode")).isEqualTo("memory_optimized");
        assertThat(sent.getFirst("services")).isEqualTo("kv,n1ql,index,fts");
        assertThat(sent.getFirst("port")).isEqualTo("SAME");
    }

    @Test
    @DisplayName("Community init leaves the enterprise fields out")
    void communityInitForm() {
        MultiValueMap<String, String> form = bootstrapper.initForm(primary,
                ClusterSettings.builder().edition(CouchbaseEdition.COMMUNITY).managementPort(9091).build());

        assertThat(form).doesNotContainKeys("cbasMemoryQuota", "eventingMemoryQuota", "nodeEncryption");
        assertThat(form.getFirst("ftsMemoryQuota")).isEqualTo("1024");
        assertThat(form.getFirst("port")).isEqualTo("9091");
    }
}

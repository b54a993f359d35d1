package com.cbcluster.orchestrator.config;

import com.cbcluster.common.model.BucketDefinition;
import com.cbcluster.common.model.BucketSettings;
import com.cbcluster.common.model.ClusterCredentials;
import com.cbcluster.common.model.ClusterSettings;
import com.cbcluster.common.model.ClusterTopology;
import com.cbcluster.common.model.ScopeDefinition;
import com.cbcluster.common.model.ServerNode;
import com.cbcluster.orchestrator.certificate.CertificateProvider;
import com.cbcluster.orchestrator.certificate.PemCertificateProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;

/**
 * Builds the {@link ClusterTopology} from {@link TopologyProperties}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({TopologyProperties.class, PollingProperties.class})
public class TopologyConfig {

    @Bean
    @ConditionalOnMissingBean
    public CertificateProvider certificateProvider(TopologyProperties properties, ResourceLoader resourceLoader) {
        return new PemCertificateProvider(properties.getCertificateAuthority(), resourceLoader);
    }

    @Bean
    @ConditionalOnMissingBean
    public ClusterSettingsProvider clusterSettingsProvider(TopologyProperties properties) {
        return () -> ClusterSettings.builder()
                .edition(properties.getEdition())
                .managementPort(properties.getManagementPort())
                .memoryQuotas(properties.getMemoryQuotas().toMemoryQuotas())
                .indexStorageMode(properties.getIndexStorageMode())
                .build();
    }

    @Bean
    public ClusterTopology clusterTopology(TopologyProperties properties, CertificateProvider certificateProvider) {
        ClusterTopology.Builder builder = ClusterTopology.builder(properties.getName(),
                        new ClusterCredentials(properties.getUsername(), properties.getPassword()))
                .clusterName(properties.getClusterName())
                .nodePrefix(properties.getNodePrefix())
                .explicitStart(properties.isExplicitStart())
                .certificateAuthority(certificateProvider.certificateAuthority().orElse(null));

        for (TopologyProperties.ServerGroup group : properties.getServerGroups()) {
            List<ServerNode> nodes = group.getNodes().stream()
                    .map(node -> new ServerNode(node.getName(), node.getHostname(), node.getExternalHostname(),
                            group.getName(), null, node.getEndpoints(), false))
                    .toList();
            builder.addServerGroup(group.getName(),
                    group.getServices().isEmpty() ? null : new HashSet<>(EnumSet.copyOf(group.getServices())),
                    nodes);
        }
        for (TopologyProperties.Bucket bucket : properties.getBuckets()) {
            builder.addBucket(toBucketDefinition(bucket));
        }

        ClusterTopology topology = builder.build();
        log.info("Declared {} with primary node {}", topology, topology.primaryNode().name());
        return topology;
    }

    static BucketDefinition toBucketDefinition(TopologyProperties.Bucket bucket) {
        BucketSettings settings = BucketSettings.builder()
                .bucketType(bucket.getBucketType())
                .memoryQuotaMegabytes(bucket.getMemoryQuota())
                .replicas(bucket.getReplicas())
                .flushEnabled(bucket.getFlushEnabled())
                .storageBackend(bucket.getStorageBackend())
                .compressionMode(bucket.getCompressionMode())
                .conflictResolutionType(bucket.getConflictResolutionType())
                .minimumDurabilityLevel(bucket.getMinimumDurabilityLevel())
                .evictionPolicy(bucket.getEvictionPolicy())
                .maximumTimeToLiveSeconds(bucket.getMaxTtl())
                .build();
        List<ScopeDefinition> scopes = bucket.getScopes().stream()
                .map(scope -> new ScopeDefinition(scope.getName(), scope.getCollections()))
                .toList();
        return new BucketDefinition(bucket.getName(), bucket.getBucketName(), bucket.getKind(), settings, scopes);
    }
}

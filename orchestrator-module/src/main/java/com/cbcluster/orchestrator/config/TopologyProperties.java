package com.cbcluster.orchestrator.config;

import com.cbcluster.common.model.BucketKind;
import com.cbcluster.common.model.BucketType;
import com.cbcluster.common.model.CompressionMode;
import com.cbcluster.common.model.ConflictResolutionType;
import com.cbcluster.common.model.CouchbaseEdition;
import com.cbcluster.common.model.CouchbaseService;
import com.cbcluster.common.model.DurabilityLevel;
import com.cbcluster.common.model.EvictionPolicy;
import com.cbcluster.common.model.IndexStorageMode;
import com.cbcluster.common.model.MemoryQuotas;
import com.cbcluster.common.model.StorageBackend;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declared cluster: credentials, settings, server groups and buckets.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "orchestrator.cluster")
public class TopologyProperties {

    /**
     * Resource name of the cluster.
     */
    @NotBlank
    private String name = "couchbase";

    /**
     * Name the cluster is initialized with. Defaults to the resource name.
     */
    private String clusterName;

    @NotBlank
    private String username = "Administrator";

    @NotBlank
    private String password;

    @NotNull
    private CouchbaseEdition edition = CouchbaseEdition.ENTERPRISE;

    @NotNull
    private IndexStorageMode indexStorageMode = IndexStorageMode.PLASMA;

    /**
     * Prefix of the node names the cluster uses internally, e.g. ns_1@node-0.dev.internal.
     */
    @NotBlank
    private String nodePrefix = "ns_1@";

    /**
     * When set the cluster only starts on an explicit start command.
     */
    private boolean explicitStart;

    /**
     * Management port the primary is initialized with; the port it already listens on when unset.
     */
    private Integer managementPort;

    @Valid
    @NotNull
    private Quotas memoryQuotas = new Quotas();

    @Valid
    private CertificateAuthority certificateAuthority;

    @Valid
    private List<ServerGroup> serverGroups = new ArrayList<>();

    @Valid
    private List<Bucket> buckets = new ArrayList<>();

    @Data
    public static class Quotas {
        @Positive
        private int data = MemoryQuotas.DEFAULT_QUOTA_MEGABYTES;
        @Positive
        private int query = MemoryQuotas.DEFAULT_QUOTA_MEGABYTES;
        @Positive
        private int index = MemoryQuotas.DEFAULT_QUOTA_MEGABYTES;
        @Positive
        private int fts = MemoryQuotas.DEFAULT_QUOTA_MEGABYTES;
        @Positive
        private int analytics = MemoryQuotas.DEFAULT_QUOTA_MEGABYTES;
        @Positive
        private int eventing = MemoryQuotas.DEFAULT_QUOTA_MEGABYTES;

        public MemoryQuotas toMemoryQuotas() {
            return new MemoryQuotas(data, query, index, fts, analytics, eventing);
        }
    }

    @Data
    public static class CertificateAuthority {
        /**
         * PEM file of the root CA, e.g. file:/certs/ca.pem or classpath:ca.pem.
         */
        @NotBlank
        private String certificatePath;

        /**
         * PEM files of the chain; the root CA alone when empty.
         */
        private List<String> chainPaths = new ArrayList<>();

        private boolean trustCertificate = true;
    }

    @Data
    public static class ServerGroup {
        @NotBlank
        private String name;

        private List<CouchbaseService> services = new ArrayList<>();

        @Valid
        private List<Node> nodes = new ArrayList<>();
    }

    @Data
    public static class Node {
        @NotBlank
        private String name;

        /**
         * Hostname inside the node network. Defaults to {name}.dev.internal.
         */
        private String hostname;

        private String externalHostname;

        /**
         * Externally published port per endpoint name (management, managements, data, ...).
         */
        private Map<String, Integer> endpoints = new LinkedHashMap<>();
    }

    @Data
    public static class Bucket {
        @NotBlank
        private String name;

        private String bucketName;

        private BucketKind kind = BucketKind.STANDARD;

        private BucketType bucketType;
        private Integer memoryQuota;
        private Integer replicas;
        private Boolean flushEnabled;
        private StorageBackend storageBackend;
        private CompressionMode compressionMode;
        private ConflictResolutionType conflictResolutionType;
        private DurabilityLevel minimumDurabilityLevel;
        private EvictionPolicy evictionPolicy;
        private Integer maxTtl;

        @Valid
        private List<Scope> scopes = new ArrayList<>();
    }

    @Data
    public static class Scope {
        @NotBlank
        private String name;

        private List<String> collections = new ArrayList<>();
    }
}

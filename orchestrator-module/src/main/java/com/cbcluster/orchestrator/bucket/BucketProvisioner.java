package com.cbcluster.orchestrator.bucket;

import com.cbcluster.common.model.BucketDefinition;
import com.cbcluster.common.model.BucketSettings;
import com.cbcluster.common.model.ClusterTopology;
import com.cbcluster.common.model.ScopeDefinition;
import com.cbcluster.common.model.ServerNode;
import com.cbcluster.common.model.WireValue;
import com.cbcluster.orchestrator.client.ManagementApiClient;
import com.cbcluster.orchestrator.client.Polling;
import com.cbcluster.orchestrator.client.dto.BucketInfo;
import com.cbcluster.orchestrator.client.dto.ClusterTask;
import com.cbcluster.orchestrator.client.dto.ScopesResponse;
import com.cbcluster.orchestrator.config.PollingProperties;
import com.cbcluster.orchestrator.state.ResourceStateRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Creates the declared buckets, loads sample buckets and creates their scopes and collections.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BucketProvisioner {

    public static final String LOADING_DETAIL = "Loading";

    private final ManagementApiClient managementApiClient;
    private final ClusterTopology topology;
    private final PollingProperties pollingProperties;
    private final ResourceStateRegistry resourceStateRegistry;

    /**
     * Makes the bucket exist, then makes its declared scopes and collections exist.
     */
    public Mono<Void> provision(BucketDefinition bucket) {
        Mono<Void> created = bucket.isSample() ? createOrGetSample(bucket) : createOrGet(bucket);
        return created.then(ensureScopes(bucket));
    }

    /**
     * Creates a standard bucket unless one with the same name exists, and waits for it to be healthy.
     */
    public Mono<Void> createOrGet(BucketDefinition bucket) {
        ServerNode primary = topology.primaryNode();
        return managementApiClient.getBucket(primary, bucket.bucketName())
                .hasElement()
                .flatMap(exists -> {
                    if (exists) {
                        log.info("Bucket {} already exists", bucket.bucketName());
                        return Mono.empty();
                    }
                    log.info("Creating bucket {}", bucket.bucketName());
                    return managementApiClient.createBucket(primary, createForm(bucket))
                            .then(awaitHealthy(bucket))
                            .doOnSuccess(ignored -> log.info("Bucket {} created", bucket.bucketName()));
                });
    }

    /**
     * Installs a sample bucket unless one with the same name exists, and waits for its load task to go away.
     */
    public Mono<Void> createOrGetSample(BucketDefinition bucket) {
        ServerNode primary = topology.primaryNode();
        return managementApiClient.getBucket(primary, bucket.bucketName())
                .hasElement()
                .flatMap(exists -> {
                    if (exists) {
                        log.info("Sample bucket {} already exists", bucket.bucketName());
                        return Mono.empty();
                    }
                    log.info("Installing sample bucket {}", bucket.bucketName());
                    return managementApiClient.installSampleBucket(primary, bucket.bucketName())
                            .flatMap(response -> response.firstTaskId()
                                    .map(taskId -> awaitTaskGone(bucket, taskId))
                                    .orElseGet(Mono::empty));
                });
    }

    /**
     * Polls the bucket until every node hosting it reports it healthy. A bucket not visible yet is polled again.
     */
    public Mono<Void> awaitHealthy(BucketDefinition bucket) {
        ServerNode primary = topology.primaryNode();
        return Polling.until(
                        () -> managementApiClient.getBucket(primary, bucket.bucketName())
                                .map(Optional::of)
                                .defaultIfEmpty(Optional.empty()),
                        info -> info.map(BucketInfo::isHealthy).orElse(false),
                        pollingProperties.getBucketHealthInterval())
                .doOnSuccess(info -> log.debug("Bucket {} is healthy", bucket.bucketName()))
                .then();
    }

    /**
     * Empties the bucket and waits for it to be healthy again.
     *
     * @throws IllegalArgumentException through the returned {@link Mono} when flush is not enabled
     */
    public Mono<Void> flush(BucketDefinition bucket) {
        if (!bucket.isFlushEnabled()) {
            return Mono.error(new IllegalArgumentException(
                    "Flush is not enabled for bucket '" + bucket.bucketName() + "'"));
        }
        return Mono.defer(() -> {
            log.info("Flushing bucket {}", bucket.bucketName());
            return managementApiClient.flushBucket(topology.primaryNode(), bucket.bucketName())
                    .then(awaitHealthy(bucket));
        });
    }

    private Mono<Void> awaitTaskGone(BucketDefinition bucket, String taskId) {
        ServerNode primary = topology.primaryNode();
        resourceStateRegistry.publish(bucket.resourceName(), snapshot -> snapshot.withStateDetail(LOADING_DETAIL));
        return Polling.until(
                        () -> managementApiClient.listTasks(primary),
                        tasks -> tasks.stream().map(ClusterTask::taskId).noneMatch(taskId::equals),
                        pollingProperties.getSampleTaskInterval())
                .doOnSuccess(tasks -> log.info("Sample bucket {} loaded", bucket.bucketName()))
                .then();
    }

    private Mono<Void> ensureScopes(BucketDefinition bucket) {
        if (bucket.scopes().isEmpty()) {
            return Mono.empty();
        }
        ServerNode primary = topology.primaryNode();
        return managementApiClient.listScopes(primary, bucket.bucketName())
                .flatMap(existing -> Flux.fromIterable(bucket.scopes())
                        .concatMap(scope -> ensureScope(primary, bucket, scope, existing))
                        .then());
    }

    private Mono<Void> ensureScope(ServerNode primary, BucketDefinition bucket, ScopeDefinition scope,
                                   ScopesResponse existing) {
        Optional<ScopesResponse.Scope> current = existing.scope(scope.name());
        Mono<Void> created = current.isPresent()
                ? Mono.empty()
                : Mono.defer(() -> {
                    log.info("Creating scope {} in bucket {}", scope.name(), bucket.bucketName());
                    return managementApiClient.createScope(primary, bucket.bucketName(), scope.name());
                });
        List<String> missing = scope.collections().stream()
                .filter(collection -> current.map(s -> !s.hasCollection(collection)).orElse(true))
                .toList();
        return created.thenMany(Flux.fromIterable(missing)
                        .concatMap(collection -> {
                            log.info("Creating collection {}.{} in bucket {}", scope.name(), collection,
                                    bucket.bucketName());
                            return managementApiClient.createCollection(primary, bucket.bucketName(),
                                    scope.name(), collection);
                        }))
                .then();
    }

    static MultiValueMap<String, String> createForm(BucketDefinition bucket) {
        BucketSettings settings = bucket.settings();
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("name", bucket.bucketName());
        form.add("bucketType", settings.bucketType().wireValue());
        form.add("ramQuota", Integer.toString(settings.effectiveMemoryQuotaMegabytes()));
        addIfSet(form, "replicaNumber", settings.replicas());
        if (settings.flushEnabled() != null) {
            form.add("flushEnabled", settings.flushEnabled() ? "1" : "0");
        }
        addIfSet(form, "storageBackend", settings.storageBackend());
        addIfSet(form, "compressionMode", settings.compressionMode());
        addIfSet(form, "conflictResolutionType", settings.conflictResolutionType());
        addIfSet(form, "durabilityMinLevel", settings.minimumDurabilityLevel());
        addIfSet(form, "evictionPolicy", settings.evictionPolicy());
        addIfSet(form, "maxTTL", settings.maximumTimeToLiveSeconds());
        return form;
    }

    private static void addIfSet(MultiValueMap<String, String> form, String field, Integer value) {
        if (value != null) {
            form.add(field, value.toString());
        }
    }

    private static void addIfSet(MultiValueMap<String, String> form, String field, WireValue value) {
        if (value != null) {
            form.add(field, value.wireValue());
        }
    }
}

package com.cbcluster.orchestrator.client;

import com.cbcluster.common.model.ClusterCredentials;
import com.cbcluster.common.model.CouchbaseService;
import com.cbcluster.common.model.ServerNode;
import com.cbcluster.orchestrator.client.dto.BucketInfo;
import com.cbcluster.orchestrator.client.dto.ClusterTask;
import com.cbcluster.orchestrator.client.dto.NodeServices;
import com.cbcluster.orchestrator.client.dto.Pool;
import com.cbcluster.orchestrator.client.dto.RebalanceStatus;
import com.cbcluster.orchestrator.client.dto.SampleBucketResponse;
import com.cbcluster.orchestrator.client.dto.ScopesResponse;
import com.cbcluster.orchestrator.exception.ManagementApiException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Suppliers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.reactive.ClientHttpRequest;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Client for the management REST API of the cluster nodes.
 *
 * <p>Every call is addressed to one node and goes to its secure management endpoint when the
 * cluster has a certificate authority, unless the call prefers the insecure one. Transient
 * failures are retried with a fixed backoff; what is left of a failure surfaces as
 * {@link ManagementApiException}.
 */
@Slf4j
public class ManagementApiClient {

    private static final TypeReference<List<ClusterTask>> CLUSTER_TASKS = new TypeReference<>() {
    };

    private final WebClient webClient;
    private final ClusterCredentials credentials;
    private final boolean secure;
    private final int maxAttempts;
    private final Duration backoff;
    private final ObjectMapper objectMapper;
    private final Supplier<String> authorizationHeader;

    public ManagementApiClient(WebClient webClient,
                               ClusterCredentials credentials,
                               boolean secure,
                               int maxAttempts,
                               Duration backoff,
                               ObjectMapper objectMapper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("At least one attempt is required");
        }
        this.webClient = webClient;
        this.credentials = credentials;
        this.secure = secure;
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.objectMapper = objectMapper;
        this.authorizationHeader = Suppliers.memoize(() -> "Basic " + Base64.getEncoder().encodeToString(
                (credentials.username() + ":" + credentials.password()).getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Management endpoint of a node: secure when a certificate authority is configured and
     * the caller does not prefer the insecure endpoint.
     */
    public URI endpoint(ServerNode node, boolean preferInsecure) {
        return node.managementUri(secure && !preferInsecure);
    }

    /**
     * Sends one request. The returned response may carry any status; callers that only accept
     * success pass it through {@link #throwOnFailure(ManagementResponse)}.
     *
     * @param body          request body, {@code null} for none
     * @param authenticated whether to attach the administrator Basic credentials
     * @param autoRetry     whether to retry transient statuses and transport errors
     */
    public Mono<ManagementResponse> sendRequest(URI endpoint,
                                                HttpMethod method,
                                                String path,
                                                BodyInserter<?, ? super ClientHttpRequest> body,
                                                boolean authenticated,
                                                boolean autoRetry) {
        URI uri = UriComponentsBuilder.fromUri(endpoint).path(path).build().encode().toUri();

        Mono<ManagementResponse> attempt = Mono.defer(() -> {
            log.debug("{} {}", method, uri);
            WebClient.RequestBodySpec request = webClient.method(method).uri(uri);
            if (authenticated) {
                request.header(HttpHeaders.AUTHORIZATION, authorizationHeader.get());
            }
            WebClient.RequestHeadersSpec<?> spec = body == null ? request : request.body(body);
            return spec.exchangeToMono(response -> response.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .map(content -> new ManagementResponse(response.statusCode().value(), content)));
        });

        if (!autoRetry) {
            return attempt.onErrorMap(ManagementApiClient::isTransportFailure,
                    error -> new ManagementApiException(method + " " + uri + " failed: " + error.getMessage(), error));
        }

        return attempt
                .flatMap(response -> response.isTransient()
                        ? Mono.error(new TransientResponseException(response))
                        : Mono.just(response))
                .retryWhen(Retry.fixedDelay(maxAttempts - 1L, backoff)
                        .filter(error -> error instanceof TransientResponseException || isTransportFailure(error))
                        .doBeforeRetry(signal -> log.debug("Retrying {} {} (attempt {}): {}", method, uri,
                                signal.totalRetries() + 2, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> exhausted(method, uri, signal.failure())));
    }

    /**
     * @throws ManagementApiException carrying the body, or the status code when the body is empty
     */
    public static ManagementResponse throwOnFailure(ManagementResponse response) {
        if (!response.isSuccess()) {
            throw new ManagementApiException(response.statusCode(), response.body());
        }
        return response;
    }

    /**
     * Whether the node was already initialized into a cluster: {@code true} on 200,
     * {@code false} on 404, an error for any other status.
     */
    public Mono<Boolean> isPoolInitialized(ServerNode node) {
        return sendRequest(endpoint(node, true), HttpMethod.GET, "/pools/default", null, true, true)
                .map(response -> {
                    if (response.isNotFound()) {
                        return false;
                    }
                    throwOnFailure(response);
                    return true;
                });
    }

    public Mono<Void> initializeCluster(ServerNode node, MultiValueMap<String, String> form) {
        return sendForm(node, HttpMethod.POST, "/clusterInit", form, false);
    }

    /**
     * Hostnames, with management port, of the nodes the cluster already knows.
     */
    public Mono<List<String>> listNodes(ServerNode primary) {
        return get(primary, "/pools/nodes", Pool.class).map(Pool::hostnames);
    }

    public Mono<Void> addNode(ServerNode primary, ServerNode joining) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("user", credentials.username());
        form.add("password", credentials.password());
        form.add("hostname", joining.hostname());
        form.add("services", CouchbaseService.toServicesParameter(joining.services()));
        return sendForm(primary, HttpMethod.POST, "/controller/addNode", form, true);
    }

    /**
     * Service ports of the node the request is sent to.
     */
    public Mono<NodeServices> getNodeServices(ServerNode node) {
        return get(node, "/pools/default/nodeServices", NodeServices.Response.class)
                .flatMap(response -> Mono.justOrEmpty(response.nodesExt() == null ? null
                        : response.nodesExt().stream().filter(NodeServices::thisNode).findFirst().orElse(null)));
    }

    public Mono<Void> setAlternateAddresses(ServerNode node, MultiValueMap<String, String> form) {
        return sendForm(node, HttpMethod.PUT, "/node/controller/setupAlternateAddresses/external", form, true);
    }

    public Mono<Void> loadTrustedCAs(ServerNode node) {
        return sendRequest(endpoint(node, true), HttpMethod.POST, "/node/controller/loadTrustedCAs", null, false, true)
                .map(ManagementApiClient::throwOnFailure)
                .then();
    }

    public Mono<Void> reloadCertificate(ServerNode node) {
        return sendRequest(endpoint(node, true), HttpMethod.POST, "/node/controller/reloadCertificate", null, false, true)
                .map(ManagementApiClient::throwOnFailure)
                .then();
    }

    /**
     * @param knownNodes every node that should be part of the cluster, prefixed with the node prefix
     */
    public Mono<Void> rebalance(ServerNode primary, List<String> knownNodes) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("knownNodes", String.join(",", knownNodes));
        return sendForm(primary, HttpMethod.POST, "/controller/rebalance", form, true);
    }

    public Mono<RebalanceStatus> getRebalanceProgress(ServerNode primary) {
        return get(primary, "/pools/default/rebalanceProgress", RebalanceStatus.class);
    }

    /**
     * The bucket, or empty when the cluster has no bucket by that name.
     */
    public Mono<BucketInfo> getBucket(ServerNode primary, String bucketName) {
        return sendRequest(endpoint(primary, false), HttpMethod.GET, "/pools/default/buckets/" + bucketName,
                null, true, true)
                .flatMap(response -> response.isNotFound()
                        ? Mono.empty()
                        : Mono.just(read(throwOnFailure(response), BucketInfo.class)));
    }

    public Mono<Void> createBucket(ServerNode primary, MultiValueMap<String, String> form) {
        return sendForm(primary, HttpMethod.POST, "/pools/default/buckets", form, true);
    }

    public Mono<SampleBucketResponse> installSampleBucket(ServerNode primary, String bucketName) {
        return sendRequest(endpoint(primary, false), HttpMethod.POST, "/sampleBuckets/install",
                BodyInserters.fromValue(List.of(bucketName)), true, true)
                .map(response -> read(throwOnFailure(response), SampleBucketResponse.class));
    }

    public Mono<Void> flushBucket(ServerNode primary, String bucketName) {
        return sendRequest(endpoint(primary, false), HttpMethod.POST,
                "/pools/default/buckets/" + bucketName + "/controller/doFlush", null, true, true)
                .map(ManagementApiClient::throwOnFailure)
                .then();
    }

    public Mono<ScopesResponse> listScopes(ServerNode primary, String bucketName) {
        return get(primary, "/pools/default/buckets/" + bucketName + "/scopes", ScopesResponse.class);
    }

    public Mono<Void> createScope(ServerNode primary, String bucketName, String scopeName) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("name", scopeName);
        return sendForm(primary, HttpMethod.POST, "/pools/default/buckets/" + bucketName + "/scopes", form, true);
    }

    public Mono<Void> createCollection(ServerNode primary, String bucketName, String scopeName, String collectionName) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("name", collectionName);
        return sendForm(primary, HttpMethod.POST,
                "/pools/default/buckets/" + bucketName + "/scopes/" + scopeName + "/collections", form, true);
    }

    public Mono<List<ClusterTask>> listTasks(ServerNode primary) {
        return sendRequest(endpoint(primary, false), HttpMethod.GET, "/pools/default/tasks", null, true, true)
                .map(response -> read(throwOnFailure(response), CLUSTER_TASKS));
    }

    /**
     * Single unauthenticated probe of the insecure endpoint; any failure counts as not reachable.
     */
    public Mono<Boolean> isReachable(ServerNode node) {
        return sendRequest(endpoint(node, true), HttpMethod.GET, "/pools", null, false, false)
                .map(ManagementResponse::isSuccess)
                .onErrorResume(ManagementApiException.class, error -> {
                    log.trace("Node {} not reachable: {}", node.name(), error.getMessage());
                    return Mono.just(false);
                });
    }

    private Mono<Void> sendForm(ServerNode node, HttpMethod method, String path,
                                MultiValueMap<String, String> form, boolean authenticated) {
        return sendRequest(endpoint(node, false), method, path, BodyInserters.fromFormData(form), authenticated, true)
                .map(ManagementApiClient::throwOnFailure)
                .then();
    }

    private <T> Mono<T> get(ServerNode node, String path, Class<T> type) {
        return sendRequest(endpoint(node, false), HttpMethod.GET, path, null, true, true)
                .map(response -> read(throwOnFailure(response), type));
    }

    private <T> T read(ManagementResponse response, Class<T> type) {
        try {
            return objectMapper.readValue(response.body(), type);
        } catch (JsonProcessingException e) {
            throw new ManagementApiException("Unreadable " + type.getSimpleName() + " response: " + e.getOriginalMessage(), e);
        }
    }

    private <T> T read(ManagementResponse response, TypeReference<T> type) {
        try {
            return objectMapper.readValue(response.body(), type);
        } catch (JsonProcessingException e) {
            throw new ManagementApiException("Unreadable response: " + e.getOriginalMessage(), e);
        }
    }

    private static boolean isTransportFailure(Throwable error) {
        return error instanceof WebClientRequestException || error instanceof TimeoutException;
    }

    private static ManagementApiException exhausted(HttpMethod method, URI uri, Throwable lastFailure) {
        if (lastFailure instanceof TransientResponseException transientFailure) {
            ManagementResponse response = transientFailure.getResponse();
            return new ManagementApiException(response.statusCode(), response.body());
        }
        if (lastFailure instanceof ManagementApiException apiException) {
            return apiException;
        }
        return new ManagementApiException(method + " " + uri + " failed: " + lastFailure.getMessage(), lastFailure);
    }

    private static final class TransientResponseException extends RuntimeException {

        private final transient ManagementResponse response;

        TransientResponseException(ManagementResponse response) {
            super("Transient status " + response.statusCode(), null, false, false);
            this.response = response;
        }

        ManagementResponse getResponse() {
            return response;
        }
    }
}

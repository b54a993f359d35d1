package com.cbcluster.orchestrator.client;

import com.cbcluster.common.model.ClusterTopology;
import com.cbcluster.common.model.EndpointNames;
import com.cbcluster.common.model.ServerNode;
import com.cbcluster.orchestrator.client.dto.BucketInfo;
import com.cbcluster.orchestrator.client.dto.ClusterTask;
import com.cbcluster.orchestrator.client.dto.NodeServices;
import com.cbcluster.orchestrator.client.dto.SampleBucketResponse;
import com.cbcluster.orchestrator.exception.ManagementApiException;
import com.cbcluster.orchestrator.support.TestTopologies;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ManagementApiClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private MockWebServer mockServer;
    private ManagementApiClient client;
    private ServerNode primary;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();
        ClusterTopology topology = TestTopologies.topology(mockServer.getHostName(), mockServer.getPort(), 2);
        primary = topology.primaryNode();
        client = new ManagementApiClient(WebClient.builder().build(), TestTopologies.CREDENTIALS, false,
                3, Duration.ofMillis(10), new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    @Test
    @DisplayName("Pool check answers false on 404 and true on 200")
    void poolCheckTreatsNotFoundAsUninitialized() throws InterruptedException {
        mockServer.enqueue(new MockResponse().setResponseCode(404));
        mockServer.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));

        assertThat(client.isPoolInitialized(primary).block(TIMEOUT)).isFalse();
        assertThat(client.isPoolInitialized(primary).block(TIMEOUT)).isTrue();

        RecordedRequest request = mockServer.takeRequest();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getPath()).isEqualTo("/pools/default");
        assertThat(request.getHeader(HttpHeaders.AUTHORIZATION)).isEqualTo(TestTopologies.BASIC_AUTH);
    }

    @Test
    @DisplayName("Pool check fails on any other status")
    void poolCheckFailsOnUnexpectedStatus() {
        mockServer.enqueue(new MockResponse().setResponseCode(401).setBody("Unauthorized"));

        assertThatThrownBy(() -> client.isPoolInitialized(primary).block(TIMEOUT))
                .isInstanceOf(ManagementApiException.class)
                .hasMessage("401: Unauthorized");
    }

    @Test
    @DisplayName("Failure without body reports the status code")
    void failureWithoutBodyReportsStatus() {
        mockServer.enqueue(new MockResponse().setResponseCode(400));

        assertThatThrownBy(() -> client.rebalance(primary, List.of("ns_1@node-0.dev.internal")).block(TIMEOUT))
                .isInstanceOf(ManagementApiException.class)
                .hasMessage("Request failed with status code 400.");
        assertThat(mockServer.getRequestCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Transient statuses are retried until a success")
    void retriesTransientStatuses() {
        mockServer.enqueue(new MockResponse().setResponseCode(503));
        mockServer.enqueue(new MockResponse().setResponseCode(429));
        mockServer.enqueue(new MockResponse().setResponseCode(200).setBody("{\"status\":\"none\"}"));

        assertThat(client.getRebalanceProgress(primary).block(TIMEOUT).isIdle()).isTrue();
        assertThat(mockServer.getRequestCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Exhausted retries fail with the last response")
    void exhaustedRetriesCarryLastResponse() {
        mockServer.enqueue(new MockResponse().setResponseCode(500));
        mockServer.enqueue(new MockResponse().setResponseCode(502));
        mockServer.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));

        assertThatThrownBy(() -> client.listNodes(primary).block(TIMEOUT))
                .isInstanceOfSatisfying(ManagementApiException.class,
                        e -> assertThat(e.getStatusCode()).isEqualTo(503))
                .hasMessage("503: busy");
        assertThat(mockServer.getRequestCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Add node posts the joining node with its services")
    void addNodeSendsForm() throws InterruptedException {
        mockServer.enqueue(new MockResponse().setResponseCode(200));
        ServerNode joining = TestTopologies.node("node-1", "localhost", 8091);

        client.addNode(primary, joining).block(TIMEOUT);

        RecordedRequest request = mockServer.takeRequest();
        assertThat(request.getPath()).isEqualTo("/controller/addNode");
        String form = URLDecoder.decode(request.getBody().readUtf8(), StandardCharsets.UTF_8);
        assertThat(form).contains("user=Administrator", "password=password",
                "hostname=node-1.dev.internal", "services=kv,n1ql,index,fts");
    }

    @Test
    @DisplayName("Cluster initialization posts its form without credentials")
    void clusterInitIsUnauthenticated() throws InterruptedException {
        mockServer.enqueue(new MockResponse().setResponseCode(200));
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("username", "Administrator");
        form.add("password", "password");

        client.initializeCluster(primary, form).block(TIMEOUT);

        RecordedRequest request = mockServer.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/clusterInit");
        assertThat(request.getHeader(HttpHeaders.AUTHORIZATION)).isNull();
        String body = URLDecoder.decode(request.getBody().readUtf8(), StandardCharsets.UTF_8);
        assertThat(body).contains("username=Administrator", "password=password");
    }

    @Test
    @DisplayName("Certificate calls go unauthenticated")
    void certificateCallsAreUnauthenticated() throws InterruptedException {
        mockServer.enqueue(new MockResponse().setResponseCode(200));
        mockServer.enqueue(new MockResponse().setResponseCode(200));

        client.loadTrustedCAs(primary).then(client.reloadCertificate(primary)).block(TIMEOUT);

        RecordedRequest load = mockServer.takeRequest();
        RecordedRequest reload = mockServer.takeRequest();
        assertThat(load.getPath()).isEqualTo("/node/controller/loadTrustedCAs");
        assertThat(reload.getPath()).isEqualTo("/node/controller/reloadCertificate");
        assertThat(load.getHeader(HttpHeaders.AUTHORIZATION)).isNull();
        assertThat(reload.getHeader(HttpHeaders.AUTHORIZATION)).isNull();
    }

    @Test
    @DisplayName("Missing bucket is an empty result")
    void missingBucketIsEmpty() {
        mockServer.enqueue(new MockResponse().setResponseCode(404).setBody("Requested resource not found."));

        assertThat(client.getBucket(primary, "default").blockOptional(TIMEOUT)).isEmpty();
    }

    @Test
    @DisplayName("Bucket is healthy only when every node is")
    void bucketHealthIsReadFromNodes() {
        mockServer.enqueue(new MockResponse().setResponseCode(200).setBody("""
                {"name":"default","nodes":[{"hostname":"a:8091","status":"healthy"},{"hostname":"b:8091","status":"warmup"}]}
                """));

        BucketInfo bucket = client.getBucket(primary, "default").block(TIMEOUT);

        assertThat(bucket.name()).isEqualTo("default");
        assertThat(bucket.isHealthy()).isFalse();
    }

    @Test
    @DisplayName("Sample install posts a JSON array and returns the task id")
    void sampleInstallReturnsTask() throws InterruptedException {
        mockServer.enqueue(new MockResponse().setResponseCode(202)
                .setHeader("Content-Type", "application/json")
                .setBody("{\"tasks\":[{\"taskId\":\"ignored\",\"task_id\":\"t-1\",\"sample\":\"travel-sample\"}]}"));

        SampleBucketResponse response = client.installSampleBucket(primary, "travel-sample").block(TIMEOUT);

        assertThat(response.firstTaskId()).contains("t-1");
        RecordedRequest request = mockServer.takeRequest();
        assertThat(request.getPath()).isEqualTo("/sampleBuckets/install");
        assertThat(request.getBody().readUtf8()).isEqualTo("[\"travel-sample\"]");
    }

    @Test
    @DisplayName("Cluster tasks are read from the task list")
    void listsTasks() {
        mockServer.enqueue(new MockResponse().setResponseCode(200)
                .setBody("[{\"type\":\"rebalance\",\"status\":\"notRunning\"},{\"task_id\":\"t-1\",\"type\":\"loadingSampleBucket\",\"status\":\"running\"}]"));

        List<ClusterTask> tasks = client.listTasks(primary).block(TIMEOUT);

        assertThat(tasks).extracting(ClusterTask::taskId).containsExactly(null, "t-1");
    }

    @Test
    @DisplayName("Unreachable node is reported without retrying")
    void unreachableNodeIsNotReachable() throws IOException {
        MockWebServer stopped = new MockWebServer();
        stopped.start();
        ServerNode node = TestTopologies.node("node-9", stopped.getHostName(), stopped.getPort());
        stopped.shutdown();

        assertThat(client.isReachable(node).block(TIMEOUT)).isFalse();
    }

    @Test
    @DisplayName("Reachability is checked on the pools endpoint without credentials")
    void reachabilityIsCheckedUnauthenticated() throws InterruptedException {
        mockServer.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));

        assertThat(client.isReachable(primary).block(TIMEOUT)).isTrue();

        RecordedRequest request = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getPath()).isEqualTo("/pools");
        assertThat(request.getHeader(HttpHeaders.AUTHORIZATION)).isNull();
    }

    @Test
    @DisplayName("Secure endpoint is used unless the call prefers the insecure one")
    void selectsSecureEndpointWhenCertificateAuthorityIsConfigured() {
        ServerNode node = new ServerNode("node-0", null, "db.example.com", null, null,
                Map.of(EndpointNames.MANAGEMENT, 8091, EndpointNames.MANAGEMENT_SECURE, 18091), true);
        ManagementApiClient secureClient = new ManagementApiClient(WebClient.builder().build(),
                TestTopologies.CREDENTIALS, true, 1, Duration.ZERO, new ObjectMapper());

        assertThat(secureClient.endpoint(node, false)).isEqualTo(URI.create("https://db.example.com:18091"));
        assertThat(secureClient.endpoint(node, true)).isEqualTo(URI.create("http://db.example.com:8091"));
        assertThat(client.endpoint(node, false)).isEqualTo(URI.create("http://db.example.com:8091"));
    }

    @Test
    @DisplayName("Node services lookup returns the entry of the node asked")
    void nodeServicesReturnsThisNode() {
        mockServer.enqueue(new MockResponse().setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setBody("{\"nodesExt\":["
                        + "{\"hostname\":\"node-1.dev.internal\",\"services\":{\"mgmt\":8091}},"
                        + "{\"hostname\":\"node-0.dev.internal\",\"services\":{\"mgmt\":8091,\"kv\":11210},"
                        + "\"thisNode\":true}]}"));

        NodeServices services = client.getNodeServices(primary).block(TIMEOUT);

        assertThat(services).isNotNull();
        assertThat(services.hostname()).isEqualTo("node-0.dev.internal");
        assertThat(services.services()).containsEntry("kv", 11210);
    }
}

package com.cbcluster.orchestrator.client;

import com.cbcluster.common.model.ClusterTopology;
import com.cbcluster.orchestrator.config.ManagementClientConfig.ManagementClientProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

@Component
@RequiredArgsConstructor
public class ManagementApiClientFactory {

    private final WebClient.Builder managementWebClientBuilder;
    private final ManagementClientProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Client bound to the credentials of the cluster, preferring secure endpoints when it has a CA.
     */
    public ManagementApiClient create(ClusterTopology topology) {
        WebClient client = managementWebClientBuilder.clone().build();
        return new ManagementApiClient(
                client,
                topology.credentials(),
                topology.isSecure(),
                properties.getRetry().getMaxAttempts(),
                properties.getRetry().getBackoff(),
                objectMapper);
    }
}

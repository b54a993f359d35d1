package com.cbcluster.orchestrator.config;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Intervals of the loops that wait for the cluster to converge.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "orchestrator.polling")
public class PollingProperties {

    @NotNull
    private Duration rebalanceInterval = Duration.ofSeconds(1);

    @NotNull
    private Duration bucketHealthInterval = Duration.ofMillis(250);

    @NotNull
    private Duration sampleTaskInterval = Duration.ofMillis(500);

    /**
     * Interval between reachability probes of the nodes.
     */
    @NotNull
    private Duration nodeReadinessInterval = Duration.ofSeconds(2);
}

package com.cbcluster.orchestrator.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Worker pool of the orchestration tasks and the health requirement of the cluster.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {

    @Valid
    @NotNull
    private Executor executor = new Executor();

    @Valid
    @NotNull
    private Health health = new Health();

    @Data
    public static class Executor {
        @Min(1)
        private int corePoolSize = 4;
        @Min(1)
        private int maxPoolSize = 32;
        @Min(1)
        private int queueCapacity = 1000;
    }

    @Data
    public static class Health {
        /**
         * Fewest running nodes for the cluster to count as healthy.
         */
        @Min(0)
        private int minimumHealthyNodes = 1;

        /**
         * Most nodes that may be down for the cluster to count as healthy.
         */
        @Min(0)
        private int maximumUnhealthyNodes = Integer.MAX_VALUE;
    }
}

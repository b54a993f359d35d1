package com.cbcluster.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RebalanceStatus(
        @JsonProperty("status")
        String status
) {

    public static final String STATUS_NONE = "none";

    /**
     * No rebalance is running.
     */
    public boolean isIdle() {
        return STATUS_NONE.equals(status);
    }
}

package com.cbcluster.orchestrator.controller;

import com.cbcluster.orchestrator.health.ClusterHealth;
import com.cbcluster.orchestrator.health.ClusterHealthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
@Tag(name = "Health Check", description = "Health check endpoints for monitoring")
public class HealthController {

    private final ClusterHealthService clusterHealthService;

    @GetMapping
    @Operation(summary = "Health check",
               description = "Check whether the cluster runs with enough healthy nodes")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Cluster is healthy"),
        @ApiResponse(responseCode = "503", description = "Cluster is unhealthy or not running yet")
    })
    public ResponseEntity<ClusterHealth> getHealth() {
        log.debug("Health check requested");
        ClusterHealth health = clusterHealthService.health();
        return ResponseEntity.status(health.isUp() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(health);
    }
}

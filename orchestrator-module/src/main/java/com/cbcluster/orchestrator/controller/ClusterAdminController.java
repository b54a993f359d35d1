package com.cbcluster.orchestrator.controller;

import com.cbcluster.orchestrator.orchestration.OrchestratorStateMachine;
import com.cbcluster.orchestrator.state.ResourceSnapshot;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Admin controller exposing resource states and explicit lifecycle commands.
 */
@Slf4j
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Tag(name = "Cluster Administration", description = "Resource states and lifecycle commands of the cluster and its buckets")
public class ClusterAdminController {

    private final OrchestratorStateMachine orchestratorStateMachine;

    @GetMapping("/resources")
    @Operation(summary = "List resources",
               description = "Current state of the cluster, its server groups, nodes and buckets")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Successfully retrieved resource states")
    })
    public ResponseEntity<List<ResourceSnapshot>> getResources() {
        log.debug("Received request to list resources");
        return ResponseEntity.ok(orchestratorStateMachine.resources());
    }

    @GetMapping("/resources/{name}")
    @Operation(summary = "Get resource", description = "Current state of one resource")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Successfully retrieved resource state"),
        @ApiResponse(responseCode = "404", description = "Unknown resource")
    })
    public ResponseEntity<ResourceSnapshot> getResource(@PathVariable String name) {
        return ResponseEntity.ok(orchestratorStateMachine.resource(name));
    }

    @PostMapping("/resources/{name}/start")
    @Operation(summary = "Start resource",
               description = "Start the cluster, including stopped nodes, or provision a bucket")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "202", description = "Start issued, or resource already running or starting"),
        @ApiResponse(responseCode = "400", description = "Resource cannot be started"),
        @ApiResponse(responseCode = "404", description = "Unknown resource")
    })
    public ResponseEntity<CommandResponse> start(@PathVariable String name) {
        log.info("Received request to start {}", name);
        boolean accepted = orchestratorStateMachine.start(name);
        return ResponseEntity.accepted().body(new CommandResponse(name, "start", accepted));
    }

    @PostMapping("/resources/{name}/stop")
    @Operation(summary = "Stop resource", description = "Stop the cluster and all of its nodes, or a bucket")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "202", description = "Stop issued, or resource already stopping or stopped"),
        @ApiResponse(responseCode = "400", description = "Resource cannot be stopped"),
        @ApiResponse(responseCode = "404", description = "Unknown resource")
    })
    public ResponseEntity<CommandResponse> stop(@PathVariable String name) {
        log.info("Received request to stop {}", name);
        boolean accepted = orchestratorStateMachine.stop(name);
        return ResponseEntity.accepted().body(new CommandResponse(name, "stop", accepted));
    }

    @PostMapping("/buckets/{name}/flush")
    @Operation(summary = "Flush bucket", description = "Remove every document of the bucket and wait until it is healthy")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Bucket flushed"),
        @ApiResponse(responseCode = "400", description = "Not a bucket, or flush not enabled"),
        @ApiResponse(responseCode = "409", description = "Bucket is not running"),
        @ApiResponse(responseCode = "502", description = "Cluster rejected the flush")
    })
    public Mono<ResponseEntity<CommandResponse>> flush(@PathVariable String name) {
        log.info("Received request to flush bucket {}", name);
        return orchestratorStateMachine.flushBucket(name)
                .thenReturn(ResponseEntity.ok(new CommandResponse(name, "flush", true)));
    }
}

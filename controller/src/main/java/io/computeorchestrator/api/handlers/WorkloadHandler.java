package io.computeorchestrator.api.handlers;

import io.computeorchestrator.ComputeOrchestrator;
import io.computeorchestrator.api.models.requests.PlacementApiRequest;
import io.computeorchestrator.api.models.requests.WorkloadStateRequest;
import io.computeorchestrator.api.models.responses.AcknowledgedResponse;
import io.computeorchestrator.api.models.responses.ErrorResponse;
import io.computeorchestrator.api.models.responses.PlacementResponse;
import io.computeorchestrator.enums.PlacementStrategyType;
import io.computeorchestrator.enums.WorkloadState;
import io.computeorchestrator.errors.OrchestratorException;
import io.computeorchestrator.models.AffinityConstraints;
import io.computeorchestrator.placement.PlacementDecision;
import io.computeorchestrator.placement.PlacementRequest;
import io.computeorchestrator.placement.strategies.PlacementStrategies;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API handler for workload placement and lifecycle.
 *
 * Supported operations:
 * - POST /workloads/placement - Choose a node and reserve resources
 * - GET /workloads - List workloads
 * - GET /workloads/{workloadId} - Get one workload
 * - PUT /workloads/{workloadId}/state - Record a lifecycle change
 * - DELETE /workloads/{workloadId} - Delete and release resources
 */
@Slf4j
@RestController
@RequestMapping("/workloads")
public class WorkloadHandler {

    private final ComputeOrchestrator orchestrator;

    public WorkloadHandler(ComputeOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/placement")
    public ResponseEntity<Object> placeWorkload(@RequestBody PlacementApiRequest request) {
        try {
            log.info("Placing workload '{}' with strategy {}", request.getWorkloadId(), request.getStrategy());
            PlacementStrategyType strategy = request.getStrategy() != null
                ? PlacementStrategies.forName(request.getStrategy()).getType()
                : null;
            PlacementDecision decision = orchestrator.placeWorkload(PlacementRequest.builder()
                .workloadId(request.getWorkloadId())
                .resources(request.getResources())
                .constraints(request.getConstraints() != null ? request.getConstraints() : AffinityConstraints.none())
                .strategy(strategy)
                .build());
            return ResponseEntity.ok(PlacementResponse.from(decision));
        } catch (OrchestratorException e) {
            log.error("Placement of workload '{}' failed: {}", request.getWorkloadId(), e.getMessage());
            return ErrorResponse.toResponseEntity(e);
        } catch (Exception e) {
            log.error("Error placing workload '{}': {}", request.getWorkloadId(), e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @GetMapping
    public ResponseEntity<Object> listWorkloads() {
        try {
            return ResponseEntity.ok(orchestrator.listWorkloads());
        } catch (Exception e) {
            log.error("Error listing workloads: {}", e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @GetMapping("/{workloadId}")
    public ResponseEntity<Object> getWorkload(@PathVariable String workloadId) {
        try {
            return ResponseEntity.ok(orchestrator.getWorkload(workloadId));
        } catch (OrchestratorException e) {
            return ErrorResponse.toResponseEntity(e);
        } catch (Exception e) {
            log.error("Error getting workload '{}': {}", workloadId, e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @PutMapping("/{workloadId}/state")
    public ResponseEntity<Object> updateState(@PathVariable String workloadId, @RequestBody WorkloadStateRequest request) {
        WorkloadState state;
        try {
            state = WorkloadState.valueOf(String.valueOf(request.getState()).trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.badRequest("Unknown workload state: " + request.getState()));
        }
        try {
            log.info("Setting state of workload '{}' to {}", workloadId, state);
            return ResponseEntity.ok(orchestrator.updateWorkloadState(workloadId, state));
        } catch (OrchestratorException e) {
            log.error("Cannot set state of workload '{}': {}", workloadId, e.getMessage());
            return ErrorResponse.toResponseEntity(e);
        } catch (Exception e) {
            log.error("Error setting state of workload '{}': {}", workloadId, e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @DeleteMapping("/{workloadId}")
    public ResponseEntity<Object> deleteWorkload(@PathVariable String workloadId) {
        try {
            log.info("Deleting workload '{}'", workloadId);
            orchestrator.deleteWorkload(workloadId);
            return ResponseEntity.ok(AcknowledgedResponse.success());
        } catch (OrchestratorException e) {
            log.error("Cannot delete workload '{}': {}", workloadId, e.getMessage());
            return ErrorResponse.toResponseEntity(e);
        } catch (Exception e) {
            log.error("Error deleting workload '{}': {}", workloadId, e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }
}

package io.computeorchestrator.api.handlers;

import io.computeorchestrator.ComputeOrchestrator;
import io.computeorchestrator.api.models.requests.MigrationRequest;
import io.computeorchestrator.api.models.responses.ErrorResponse;
import io.computeorchestrator.api.models.responses.MigrationResponse;
import io.computeorchestrator.enums.MigrationMode;
import io.computeorchestrator.errors.OrchestratorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API handler for workload migrations.
 *
 * Supported operations:
 * - POST /migrations - Start a migration, returns the job id (202)
 * - GET /migrations - List migration jobs, most recent first
 * - GET /migrations/{jobId} - Status of one job
 * - GET /migrations/_check?workload_id=&target_node_id= - Whether a migration could start now
 */
@Slf4j
@RestController
@RequestMapping("/migrations")
public class MigrationHandler {

    private final ComputeOrchestrator orchestrator;

    public MigrationHandler(ComputeOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    public ResponseEntity<Object> startMigration(@RequestBody MigrationRequest request) {
        MigrationMode mode = MigrationMode.fromString(request.getMode());
        if (request.getMode() != null && !request.getMode().isBlank() && mode == null) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.badRequest("Unknown migration mode: " + request.getMode()));
        }
        try {
            log.info("Migrating workload '{}' to node '{}' ({})", request.getWorkloadId(), request.getTargetNodeId(), mode);
            String jobId = orchestrator.migrateWorkload(request.getWorkloadId(), request.getTargetNodeId(), mode);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(MigrationResponse.accepted(jobId));
        } catch (OrchestratorException e) {
            log.error("Migration of workload '{}' rejected: {}", request.getWorkloadId(), e.getMessage());
            return ErrorResponse.toResponseEntity(e);
        } catch (Exception e) {
            log.error("Error starting migration of workload '{}': {}", request.getWorkloadId(), e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @GetMapping
    public ResponseEntity<Object> listMigrations() {
        try {
            return ResponseEntity.ok(orchestrator.listMigrations());
        } catch (Exception e) {
            log.error("Error listing migrations: {}", e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @GetMapping("/_check")
    public ResponseEntity<Object> canMigrate(
            @RequestParam("workload_id") String workloadId,
            @RequestParam("target_node_id") String targetNodeId) {
        try {
            return ResponseEntity.ok(orchestrator.canMigrate(workloadId, targetNodeId));
        } catch (Exception e) {
            log.error("Error checking migration of '{}' to '{}': {}", workloadId, targetNodeId, e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<Object> getMigrationStatus(@PathVariable String jobId) {
        try {
            return ResponseEntity.ok(orchestrator.getMigrationStatus(jobId));
        } catch (OrchestratorException e) {
            return ErrorResponse.toResponseEntity(e);
        } catch (Exception e) {
            log.error("Error getting migration '{}': {}", jobId, e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }
}

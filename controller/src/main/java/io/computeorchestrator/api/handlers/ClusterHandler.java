package io.computeorchestrator.api.handlers;

import io.computeorchestrator.ComputeOrchestrator;
import io.computeorchestrator.api.models.responses.ErrorResponse;
import io.computeorchestrator.errors.OrchestratorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API handler for pool-wide operations.
 *
 * - GET /cluster/health - Node, workload and utilization summary; status "healthy" or "degraded"
 * - POST /cluster/rebalance?dry_run=true|false - Plan (and optionally execute) rebalancing moves
 */
@Slf4j
@RestController
@RequestMapping("/cluster")
public class ClusterHandler {

    private final ComputeOrchestrator orchestrator;

    public ClusterHandler(ComputeOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping("/health")
    public ResponseEntity<Object> getClusterHealth() {
        try {
            log.info("Getting health of node pool '{}'", orchestrator.getClusterId());
            return ResponseEntity.ok(orchestrator.getClusterHealth());
        } catch (Exception e) {
            log.error("Error getting health of node pool '{}': {}", orchestrator.getClusterId(), e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @PostMapping("/rebalance")
    public ResponseEntity<Object> rebalance(@RequestParam(value = "dry_run", defaultValue = "true") boolean dryRun) {
        try {
            log.info("Rebalancing node pool '{}' (dry run: {})", orchestrator.getClusterId(), dryRun);
            return ResponseEntity.ok(orchestrator.rebalanceCluster(dryRun));
        } catch (OrchestratorException e) {
            return ErrorResponse.toResponseEntity(e);
        } catch (Exception e) {
            log.error("Error rebalancing node pool '{}': {}", orchestrator.getClusterId(), e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }
}

package io.computeorchestrator.api.handlers;

import io.computeorchestrator.ComputeOrchestrator;
import io.computeorchestrator.api.models.requests.MaintenanceRequest;
import io.computeorchestrator.api.models.responses.AcknowledgedResponse;
import io.computeorchestrator.api.models.responses.ErrorResponse;
import io.computeorchestrator.cluster.EvacuationReport;
import io.computeorchestrator.errors.OrchestratorException;
import io.computeorchestrator.models.ComputeNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API handler for compute node administration.
 *
 * Supported operations:
 * - POST /nodes - Register or update a node
 * - GET /nodes - List registered nodes
 * - DELETE /nodes/{nodeId} - Remove an empty node
 * - PUT /nodes/{nodeId}/maintenance - Enter or leave maintenance
 * - POST /nodes/{nodeId}/evacuate - Move every workload off the node
 */
@Slf4j
@RestController
@RequestMapping("/nodes")
public class NodeHandler {

    private final ComputeOrchestrator orchestrator;

    public NodeHandler(ComputeOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    public ResponseEntity<Object> registerNode(@RequestBody ComputeNode node) {
        try {
            log.info("Registering node '{}'", node.getId());
            return ResponseEntity.ok(orchestrator.registerNode(node));
        } catch (OrchestratorException e) {
            log.error("Invalid node registration '{}': {}", node.getId(), e.getMessage());
            return ErrorResponse.toResponseEntity(e);
        } catch (Exception e) {
            log.error("Error registering node '{}': {}", node.getId(), e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @GetMapping
    public ResponseEntity<Object> listNodes() {
        try {
            List<ComputeNode> nodes = orchestrator.listNodes();
            return ResponseEntity.ok(nodes);
        } catch (Exception e) {
            log.error("Error listing nodes: {}", e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @DeleteMapping("/{nodeId}")
    public ResponseEntity<Object> removeNode(@PathVariable String nodeId) {
        try {
            log.info("Removing node '{}'", nodeId);
            orchestrator.removeNode(nodeId);
            return ResponseEntity.ok(AcknowledgedResponse.success());
        } catch (OrchestratorException e) {
            log.error("Cannot remove node '{}': {}", nodeId, e.getMessage());
            return ErrorResponse.toResponseEntity(e);
        } catch (Exception e) {
            log.error("Error removing node '{}': {}", nodeId, e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @PutMapping("/{nodeId}/maintenance")
    public ResponseEntity<Object> setMaintenance(@PathVariable String nodeId, @RequestBody MaintenanceRequest request) {
        try {
            log.info("Setting maintenance of node '{}' to {}", nodeId, request.isMaintenance());
            return ResponseEntity.ok(orchestrator.setMaintenance(nodeId, request.isMaintenance()));
        } catch (OrchestratorException e) {
            log.error("Cannot change maintenance of node '{}': {}", nodeId, e.getMessage());
            return ErrorResponse.toResponseEntity(e);
        } catch (Exception e) {
            log.error("Error changing maintenance of node '{}': {}", nodeId, e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    /**
     * Blocks until the evacuation finishes; the report lists the outcome per workload.
     */
    @PostMapping("/{nodeId}/evacuate")
    public ResponseEntity<Object> evacuateNode(@PathVariable String nodeId) {
        try {
            log.info("Evacuating node '{}'", nodeId);
            EvacuationReport report = orchestrator.evacuateNode(nodeId);
            return ResponseEntity.ok(report);
        } catch (OrchestratorException e) {
            log.error("Cannot evacuate node '{}': {}", nodeId, e.getMessage());
            return ErrorResponse.toResponseEntity(e);
        } catch (Exception e) {
            log.error("Error evacuating node '{}': {}", nodeId, e.getMessage());
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }
}

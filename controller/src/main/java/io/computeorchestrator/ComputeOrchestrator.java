package io.computeorchestrator;

import io.computeorchestrator.cluster.CancellationToken;
import io.computeorchestrator.cluster.ClusterManager;
import io.computeorchestrator.cluster.EvacuationReport;
import io.computeorchestrator.cluster.RebalanceReport;
import io.computeorchestrator.enums.ErrorKind;
import io.computeorchestrator.enums.MigrationMode;
import io.computeorchestrator.enums.PlacementStrategyType;
import io.computeorchestrator.enums.WorkloadState;
import io.computeorchestrator.errors.OrchestratorException;
import io.computeorchestrator.health.ClusterHealthManager;
import io.computeorchestrator.health.HealthMonitor;
import io.computeorchestrator.ledger.ResourceLedger;
import io.computeorchestrator.migration.MigrationCheck;
import io.computeorchestrator.migration.MigrationOrchestrator;
import io.computeorchestrator.models.AffinityConstraints;
import io.computeorchestrator.models.ClusterHealthInfo;
import io.computeorchestrator.models.ComputeNode;
import io.computeorchestrator.models.MigrationJob;
import io.computeorchestrator.models.Resources;
import io.computeorchestrator.models.Versioned;
import io.computeorchestrator.models.Workload;
import io.computeorchestrator.placement.PlacementDecision;
import io.computeorchestrator.placement.PlacementEngine;
import io.computeorchestrator.placement.PlacementRequest;
import io.computeorchestrator.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Service facade of the orchestrator for one node pool. REST handlers and embedding code talk to
 * this class only; it validates input and delegates to the ledger, placement engine, health
 * monitor, cluster manager and migration orchestrator.
 */
@Slf4j
public class ComputeOrchestrator {

    private final MetadataStore metadataStore;
    private final String clusterId;
    private final ResourceLedger resourceLedger;
    private final PlacementEngine placementEngine;
    private final HealthMonitor healthMonitor;
    private final ClusterHealthManager clusterHealthManager;
    private final MigrationOrchestrator migrationOrchestrator;
    private final ClusterManager clusterManager;

    public ComputeOrchestrator(MetadataStore metadataStore, String clusterId, ResourceLedger resourceLedger,
                               PlacementEngine placementEngine, HealthMonitor healthMonitor,
                               ClusterHealthManager clusterHealthManager, MigrationOrchestrator migrationOrchestrator,
                               ClusterManager clusterManager) {
        this.metadataStore = metadataStore;
        this.clusterId = clusterId;
        this.resourceLedger = resourceLedger;
        this.placementEngine = placementEngine;
        this.healthMonitor = healthMonitor;
        this.clusterHealthManager = clusterHealthManager;
        this.migrationOrchestrator = migrationOrchestrator;
        this.clusterManager = clusterManager;
    }

    public String getClusterId() {
        return clusterId;
    }

    // =================================================================
    // NODES
    // =================================================================

    /**
     * Register a node or update the hardware description of an existing one. Health and
     * maintenance of an existing node are kept; its capacity may not drop below what is reserved.
     */
    public ComputeNode registerNode(ComputeNode node) throws Exception {
        validateNode(node);
        return healthMonitor.saveNode(node);
    }

    /**
     * Remove a node that no longer owns any workload and holds no reservation.
     */
    public void removeNode(String nodeId) throws Exception {
        metadataStore.getNode(clusterId, nodeId)
            .orElseThrow(() -> OrchestratorException.notFound("Node " + nodeId));
        List<String> owned = metadataStore.getAllWorkloads(clusterId).stream()
            .filter(workload -> workload.isOwnedBy(nodeId) && workload.getState() != WorkloadState.DELETED)
            .map(Workload::getId)
            .collect(Collectors.toList());
        if (!owned.isEmpty()) {
            throw OrchestratorException.invalid("Node " + nodeId + " still owns workloads " + owned);
        }
        if (!resourceLedger.reservations(nodeId).isEmpty()) {
            throw OrchestratorException.invalid("Node " + nodeId + " still holds reservations for "
                + resourceLedger.reservations(nodeId).keySet());
        }
        metadataStore.deleteAllocation(clusterId, nodeId);
        metadataStore.deleteNode(clusterId, nodeId);
        healthMonitor.forget(nodeId);
        log.info("[Cluster: {}] Removed node {}", clusterId, nodeId);
    }

    public List<ComputeNode> listNodes() throws Exception {
        return metadataStore.getAllNodes(clusterId).stream()
            .sorted(Comparator.comparing(ComputeNode::getId))
            .collect(Collectors.toList());
    }

    public ComputeNode setMaintenance(String nodeId, boolean maintenance) throws Exception {
        return clusterManager.setMaintenance(nodeId, maintenance);
    }

    // =================================================================
    // WORKLOADS
    // =================================================================

    /**
     * Place a new workload: claim its id, choose a node, reserve its resources and record the workload
     * as PROVISIONING on that node.
     *
     * The id is claimed with a conditional create (or a conditional overwrite of a DELETED record)
     * before anything is reserved, so concurrent requests for the same id cannot both reserve.
     */
    public PlacementDecision placeWorkload(PlacementRequest request) throws Exception {
        if (request.getWorkloadId() == null || request.getWorkloadId().isBlank()) {
            throw OrchestratorException.invalid("Workload id is required");
        }
        Versioned<Workload> existing = metadataStore.getVersionedWorkload(clusterId, request.getWorkloadId());
        if (existing.isPresent() && existing.getValue().getState() != WorkloadState.DELETED) {
            throw OrchestratorException.invalid("Workload " + request.getWorkloadId() + " already exists on "
                + existing.getValue().getNodeId());
        }

        OffsetDateTime now = OffsetDateTime.now();
        Workload workload = Workload.builder()
            .id(request.getWorkloadId())
            .name(request.getWorkloadId())
            .resources(request.getResources())
            .state(WorkloadState.PROVISIONING)
            .constraints(request.getConstraints() != null ? request.getConstraints() : AffinityConstraints.none())
            .createdAt(now)
            .updatedAt(now)
            .build();
        if (!metadataStore.compareAndSetWorkload(clusterId, workload, existing.getVersion())) {
            throw OrchestratorException.invalid("Workload " + request.getWorkloadId() + " is already being placed");
        }

        PlacementDecision decision;
        try {
            decision = placementEngine.placeWorkload(request);
        } catch (Exception e) {
            releaseClaim(workload, existing);
            throw e;
        }

        try {
            Versioned<Workload> claimed = metadataStore.getVersionedWorkload(clusterId, workload.getId());
            if (!isClaim(claimed, workload)) {
                throw new OrchestratorException(ErrorKind.RESERVATION_CONFLICT,
                    "Workload " + workload.getId() + " changed while it was being placed");
            }
            workload.setNodeId(decision.getNodeId());
            workload.setUpdatedAt(OffsetDateTime.now());
            if (!metadataStore.compareAndSetWorkload(clusterId, workload, claimed.getVersion())) {
                throw new OrchestratorException(ErrorKind.RESERVATION_CONFLICT,
                    "Workload " + workload.getId() + " changed while it was being placed");
            }
        } catch (Exception e) {
            log.error("[Cluster: {}] Failed to record workload {} after reserving on {}, releasing", clusterId,
                workload.getId(), decision.getNodeId(), e);
            resourceLedger.release(decision.getNodeId(), workload.getId());
            throw e;
        }
        return decision;
    }

    private static boolean isClaim(Versioned<Workload> current, Workload claim) {
        return current.isPresent()
            && current.getValue().getNodeId() == null
            && current.getValue().getState() == WorkloadState.PROVISIONING
            && current.getValue().getCreatedAt() != null
            && claim.getCreatedAt().isEqual(current.getValue().getCreatedAt());
    }

    /**
     * Undo the id claim of a placement that reserved nothing: put back the DELETED record it replaced,
     * or remove the claim.
     */
    private void releaseClaim(Workload claim, Versioned<Workload> replaced) {
        try {
            Versioned<Workload> current = metadataStore.getVersionedWorkload(clusterId, claim.getId());
            if (!isClaim(current, claim)) {
                return;
            }
            if (replaced.isPresent()) {
                metadataStore.compareAndSetWorkload(clusterId, replaced.getValue(), current.getVersion());
            } else {
                metadataStore.deleteWorkload(clusterId, claim.getId());
            }
        } catch (Exception e) {
            log.error("[Cluster: {}] Failed to release placement claim of workload {}: {}", clusterId,
                claim.getId(), e.getMessage(), e);
        }
    }

    /**
     * Convenience form returning only the chosen node id.
     */
    public String placeWorkload(String workloadId, Resources resources, AffinityConstraints constraints,
                                PlacementStrategyType strategy) throws Exception {
        return placeWorkload(PlacementRequest.builder()
            .workloadId(workloadId)
            .resources(resources)
            .constraints(constraints != null ? constraints : AffinityConstraints.none())
            .strategy(strategy)
            .build()).getNodeId();
    }

    public List<Workload> listWorkloads() throws Exception {
        return metadataStore.getAllWorkloads(clusterId).stream()
            .sorted(Comparator.comparing(Workload::getId))
            .collect(Collectors.toList());
    }

    public Workload getWorkload(String workloadId) throws Exception {
        return metadataStore.getWorkload(clusterId, workloadId)
            .orElseThrow(() -> OrchestratorException.notFound("Workload " + workloadId));
    }

    /**
     * Record a lifecycle change reported by provisioning (for example PROVISIONING to RUNNING).
     * MIGRATING and DELETED are set by migration and deletion only.
     */
    public Workload updateWorkloadState(String workloadId, WorkloadState state) throws Exception {
        if (state == null || state == WorkloadState.MIGRATING || state == WorkloadState.DELETED) {
            throw OrchestratorException.invalid("Workload state cannot be set to " + state);
        }
        for (int attempt = 1; attempt <= 5; attempt++) {
            Versioned<Workload> current = metadataStore.getVersionedWorkload(clusterId, workloadId);
            if (!current.isPresent()) {
                throw OrchestratorException.notFound("Workload " + workloadId);
            }
            Workload workload = current.getValue();
            if (workload.getState() == WorkloadState.MIGRATING || workload.getState() == WorkloadState.DELETED) {
                throw new OrchestratorException(ErrorKind.MIGRATION_CONFLICT,
                    "Workload " + workloadId + " is " + workload.getState() + " and cannot change state");
            }
            workload.setState(state);
            workload.setUpdatedAt(OffsetDateTime.now());
            if (metadataStore.compareAndSetWorkload(clusterId, workload, current.getVersion())) {
                log.info("[Cluster: {}] Workload {} is now {}", clusterId, workloadId, state);
                return workload;
            }
        }
        throw new OrchestratorException(ErrorKind.RESERVATION_CONFLICT,
            "Workload record " + workloadId + " kept changing while updating its state");
    }

    /**
     * Mark a workload DELETED and release its reservation. The record is kept for history.
     */
    public void deleteWorkload(String workloadId) throws Exception {
        if (metadataStore.getActiveMigration(clusterId, workloadId).isPresent()) {
            throw new OrchestratorException(ErrorKind.MIGRATION_CONFLICT,
                "Workload " + workloadId + " has an active migration");
        }
        Workload workload = getWorkload(workloadId);
        if (workload.getState() == WorkloadState.DELETED) {
            return;
        }
        String owner = workload.getNodeId();
        workload.setState(WorkloadState.DELETED);
        workload.setUpdatedAt(OffsetDateTime.now());
        metadataStore.upsertWorkload(clusterId, workload);
        if (owner != null) {
            resourceLedger.release(owner, workloadId);
        }
        log.info("[Cluster: {}] Deleted workload {}", clusterId, workloadId);
    }

    // =================================================================
    // MIGRATIONS
    // =================================================================

    /**
     * @return id of the accepted migration job
     */
    public String migrateWorkload(String workloadId, String targetNodeId, MigrationMode mode) throws Exception {
        return migrationOrchestrator.startMigration(workloadId, targetNodeId, mode).getJobId();
    }

    public MigrationJob getMigrationStatus(String jobId) throws Exception {
        return migrationOrchestrator.getMigrationStatus(jobId);
    }

    public List<MigrationJob> listMigrations() throws Exception {
        return migrationOrchestrator.listMigrations();
    }

    public MigrationCheck canMigrate(String workloadId, String targetNodeId) throws Exception {
        return migrationOrchestrator.canMigrate(workloadId, targetNodeId);
    }

    // =================================================================
    // POOL OPERATIONS
    // =================================================================

    public EvacuationReport evacuateNode(String nodeId) throws Exception {
        return clusterManager.evacuateNode(nodeId);
    }

    public EvacuationReport evacuateNode(String nodeId, CancellationToken token) throws Exception {
        return clusterManager.evacuateNode(nodeId, token);
    }

    public RebalanceReport rebalanceCluster(boolean dryRun) throws Exception {
        return clusterManager.rebalanceCluster(dryRun);
    }

    public ClusterHealthInfo getClusterHealth() throws Exception {
        return clusterHealthManager.getClusterHealth();
    }

    private void validateNode(ComputeNode node) throws OrchestratorException {
        if (node == null || node.getId() == null || node.getId().isBlank()) {
            throw OrchestratorException.invalid("Node id is required");
        }
        if (node.getTotalVcpus() <= 0 || node.getTotalMemoryMb() <= 0 || node.getTotalDiskGb() <= 0) {
            throw OrchestratorException.invalid("Node " + node.getId() + " must have positive capacity in every dimension");
        }
        if (node.getCpuOvercommitRatio() < 1.0 || node.getMemoryOvercommitRatio() < 1.0
                || node.getDiskOvercommitRatio() < 1.0) {
            throw OrchestratorException.invalid("Overcommit ratios of node " + node.getId() + " must be at least 1.0");
        }
    }
}

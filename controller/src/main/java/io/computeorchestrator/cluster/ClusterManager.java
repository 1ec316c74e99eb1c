package io.computeorchestrator.cluster;

import io.computeorchestrator.enums.ErrorKind;
import io.computeorchestrator.enums.EvacuationStatus;
import io.computeorchestrator.enums.MigrationMode;
import io.computeorchestrator.enums.MigrationState;
import io.computeorchestrator.enums.WorkloadOutcome;
import io.computeorchestrator.enums.WorkloadState;
import io.computeorchestrator.errors.OrchestratorException;
import io.computeorchestrator.health.HealthMonitor;
import io.computeorchestrator.migration.MigrationOrchestrator;
import io.computeorchestrator.models.AffinityConstraints;
import io.computeorchestrator.models.ComputeNode;
import io.computeorchestrator.models.MigrationJob;
import io.computeorchestrator.models.Workload;
import io.computeorchestrator.placement.CandidateNode;
import io.computeorchestrator.placement.ClusterSnapshot;
import io.computeorchestrator.placement.PlacementDecision;
import io.computeorchestrator.placement.PlacementEngine;
import io.computeorchestrator.placement.PlacementRequest;
import io.computeorchestrator.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Pool-wide operations built on placement and migration: draining a node and evening out
 * utilization across nodes.
 */
@Slf4j
public class ClusterManager {

    private final MetadataStore metadataStore;
    private final String clusterId;
    private final PlacementEngine placementEngine;
    private final MigrationOrchestrator migrationOrchestrator;
    private final HealthMonitor healthMonitor;
    private final double minImprovement;
    private final int maxMoves;

    public ClusterManager(MetadataStore metadataStore, String clusterId, PlacementEngine placementEngine,
                          MigrationOrchestrator migrationOrchestrator, HealthMonitor healthMonitor,
                          double minImprovement, int maxMoves) {
        this.metadataStore = metadataStore;
        this.clusterId = clusterId;
        this.placementEngine = placementEngine;
        this.migrationOrchestrator = migrationOrchestrator;
        this.healthMonitor = healthMonitor;
        this.minImprovement = minImprovement;
        this.maxMoves = maxMoves;
    }

    public ComputeNode setMaintenance(String nodeId, boolean maintenance) throws Exception {
        return healthMonitor.setMaintenance(nodeId, maintenance);
    }

    // =================================================================
    // EVACUATION
    // =================================================================

    public EvacuationReport evacuateNode(String nodeId) throws Exception {
        return evacuateNode(nodeId, CancellationToken.none());
    }

    /**
     * Move every workload off a node.
     *
     * A dry run first places all of them against one accumulating snapshot; a workload that is already
     * migrating or in ERROR counts as having no destination. If any workload has none, nothing is moved.
     * The node's maintenance flag is left as it is. Otherwise workloads are migrated one at a time, each destination
     * re-selected against live state, stopping at the first failure.
     */
    public EvacuationReport evacuateNode(String nodeId, CancellationToken token) throws Exception {
        metadataStore.getNode(clusterId, nodeId)
            .orElseThrow(() -> OrchestratorException.notFound("Node " + nodeId));

        List<Workload> workloads = metadataStore.getAllWorkloads(clusterId).stream()
            .filter(workload -> workload.isOwnedBy(nodeId) && workload.getState() != WorkloadState.DELETED)
            .sorted(Comparator.comparing(Workload::getId))
            .collect(Collectors.toList());
        log.info("[Cluster: {}] Evacuating {} workloads from node {}", clusterId, workloads.size(), nodeId);

        List<EvacuationResult> results = precheck(nodeId, workloads);
        boolean precheckFailed = results.stream().anyMatch(result -> result.getOutcome() == WorkloadOutcome.NO_DESTINATION);
        if (precheckFailed) {
            log.warn("[Cluster: {}] Evacuation of node {} aborted: {} workloads have no destination", clusterId, nodeId,
                results.stream().filter(result -> result.getOutcome() == WorkloadOutcome.NO_DESTINATION).count());
            results.replaceAll(result -> result.getOutcome() == WorkloadOutcome.NO_DESTINATION ? result
                : result.toBuilder().outcome(WorkloadOutcome.NOT_ATTEMPTED).build());
            return report(nodeId, EvacuationStatus.PRECHECK_FAILED, results);
        }

        for (int i = 0; i < workloads.size(); i++) {
            Workload workload = workloads.get(i);
            if (token.isCancelled()) {
                log.info("[Cluster: {}] Evacuation of node {} cancelled after {} workloads", clusterId, nodeId, i);
                markRemaining(results, i, "Evacuation cancelled");
                return report(nodeId, EvacuationStatus.CANCELLED, results);
            }

            EvacuationResult result = evacuateOne(nodeId, workload, results.get(i));
            results.set(i, result);
            if (result.getOutcome() != WorkloadOutcome.MIGRATED) {
                log.warn("[Cluster: {}] Evacuation of node {} stopped at workload {}: {}", clusterId, nodeId,
                    workload.getId(), result.getReason());
                markRemaining(results, i + 1, "Evacuation stopped after failure of " + workload.getId());
                return report(nodeId, EvacuationStatus.PARTIAL_FAILURE, results);
            }
        }

        log.info("[Cluster: {}] Node {} evacuated", clusterId, nodeId);
        return report(nodeId, EvacuationStatus.COMPLETED, results);
    }

    private List<EvacuationResult> precheck(String nodeId, List<Workload> workloads) throws Exception {
        ClusterSnapshot snapshot = placementEngine.snapshot();
        List<EvacuationResult> results = new ArrayList<>();
        for (Workload workload : workloads) {
            Optional<OrchestratorException> blocker = migrationBlocker(workload);
            if (blocker.isPresent()) {
                results.add(EvacuationResult.builder()
                    .workloadId(workload.getId())
                    .outcome(WorkloadOutcome.NO_DESTINATION)
                    .errorKind(blocker.get().getKind())
                    .reason(blocker.get().getMessage())
                    .build());
                continue;
            }
            try {
                PlacementDecision decision = placementEngine.selectNode(evacuationRequest(nodeId, workload), snapshot);
                snapshot = snapshot.withMove(workload.getId(), nodeId, decision.getNodeId(), workload.getResources());
                results.add(EvacuationResult.builder()
                    .workloadId(workload.getId())
                    .outcome(WorkloadOutcome.PLANNED)
                    .targetNodeId(decision.getNodeId())
                    .build());
            } catch (OrchestratorException e) {
                log.debug("[Cluster: {}] No destination for {} during evacuation of {}: {}", clusterId,
                    workload.getId(), nodeId, e.getMessage());
                results.add(EvacuationResult.builder()
                    .workloadId(workload.getId())
                    .outcome(WorkloadOutcome.NO_DESTINATION)
                    .errorKind(e.getKind())
                    .reason(e.getMessage())
                    .build());
            }
        }
        return results;
    }

    /**
     * Why a workload cannot be migrated at all right now, if it cannot.
     */
    private Optional<OrchestratorException> migrationBlocker(Workload workload) throws Exception {
        Optional<String> activeJob = metadataStore.getActiveMigration(clusterId, workload.getId());
        if (activeJob.isPresent() || workload.getState() == WorkloadState.MIGRATING) {
            return Optional.of(new OrchestratorException(ErrorKind.MIGRATION_CONFLICT,
                "Workload " + workload.getId() + " already has an active migration"
                    + activeJob.map(jobId -> " (" + jobId + ")").orElse("")));
        }
        if (workload.getState() == WorkloadState.ERROR) {
            return Optional.of(OrchestratorException.invalid(
                "Workload " + workload.getId() + " is in ERROR and needs operator attention"));
        }
        return Optional.empty();
    }

    private EvacuationResult evacuateOne(String nodeId, Workload workload, EvacuationResult planned) {
        EvacuationResult.EvacuationResultBuilder result = planned.toBuilder();
        try {
            PlacementDecision decision = placementEngine.selectNode(evacuationRequest(nodeId, workload));
            MigrationMode mode = workload.getState() == WorkloadState.RUNNING ? MigrationMode.LIVE : MigrationMode.OFFLINE;
            log.info("[Cluster: {}] Evacuating {} from {} to {} ({})", clusterId, workload.getId(), nodeId,
                decision.getNodeId(), mode);
            MigrationJob job = migrationOrchestrator.migrateAndWait(workload.getId(), decision.getNodeId(), mode);
            result.targetNodeId(decision.getNodeId()).jobId(job.getJobId());
            if (job.getState() == MigrationState.COMPLETED) {
                return result.outcome(WorkloadOutcome.MIGRATED).build();
            }
            return result.outcome(WorkloadOutcome.FAILED)
                .errorKind(job.getFailureKind())
                .reason(job.getFailureReason())
                .build();
        } catch (OrchestratorException e) {
            return result.outcome(WorkloadOutcome.FAILED).errorKind(e.getKind()).reason(e.getMessage()).build();
        } catch (Exception e) {
            log.error("[Cluster: {}] Evacuation of {} failed: {}", clusterId, workload.getId(), e.getMessage(), e);
            return result.outcome(WorkloadOutcome.FAILED).reason(e.getMessage()).build();
        }
    }

    /**
     * The workload's own constraints minus co-location (its partner is being drained too), with the
     * source excluded.
     */
    private PlacementRequest evacuationRequest(String nodeId, Workload workload) {
        AffinityConstraints own = workload.getConstraints() != null ? workload.getConstraints() : AffinityConstraints.none();
        AffinityConstraints constraints = own.excluding(nodeId).toBuilder().coLocateWith(null).build();
        return PlacementRequest.builder()
            .workloadId(workload.getId())
            .resources(workload.getResources())
            .constraints(constraints)
            .build();
    }

    private void markRemaining(List<EvacuationResult> results, int from, String reason) {
        for (int i = from; i < results.size(); i++) {
            results.set(i, results.get(i).toBuilder().outcome(WorkloadOutcome.NOT_ATTEMPTED).reason(reason).build());
        }
    }

    private EvacuationReport report(String nodeId, EvacuationStatus status, List<EvacuationResult> results) {
        return EvacuationReport.builder().nodeId(nodeId).status(status).results(results).build();
    }

    // =================================================================
    // REBALANCE
    // =================================================================

    public RebalanceReport rebalanceCluster(boolean dryRun) throws Exception {
        return rebalanceCluster(dryRun, CancellationToken.none());
    }

    /**
     * Greedily plan live moves that reduce the variance of node utilization, then execute them
     * one by one unless this is a dry run.
     */
    public RebalanceReport rebalanceCluster(boolean dryRun, CancellationToken token) throws Exception {
        ClusterSnapshot snapshot = placementEngine.snapshot();
        List<String> eligibleNodes = snapshot.getNodes().stream()
            .filter(CandidateNode::isAvailable)
            .map(CandidateNode::getNodeId)
            .collect(Collectors.toList());

        RebalanceReport report = RebalanceReport.builder().dryRun(dryRun).build();
        if (eligibleNodes.size() < 2) {
            log.info("[Cluster: {}] Fewer than 2 eligible nodes, nothing to rebalance", clusterId);
            return report;
        }

        List<Workload> candidates = new ArrayList<>();
        for (Workload workload : metadataStore.getAllWorkloads(clusterId)) {
            if (workload.getState() == WorkloadState.RUNNING
                    && eligibleNodes.contains(workload.getNodeId())
                    && metadataStore.getActiveMigration(clusterId, workload.getId()).isEmpty()) {
                candidates.add(workload);
            }
        }
        candidates.sort(Comparator.comparing(Workload::getId));

        double initialVariance = variance(snapshot, eligibleNodes);
        report.setInitialVariance(initialVariance);
        List<RebalanceMove> plan = plan(snapshot, eligibleNodes, candidates, initialVariance);
        report.setMoves(plan);
        report.setPlannedVariance(plan.isEmpty() ? initialVariance
            : initialVariance - plan.stream().mapToDouble(RebalanceMove::getVarianceReduction).sum());
        log.info("[Cluster: {}] Rebalance planned {} moves, variance {} -> {}", clusterId, plan.size(),
            String.format("%.5f", report.getInitialVariance()), String.format("%.5f", report.getPlannedVariance()));

        if (dryRun) {
            return report;
        }

        for (int i = 0; i < plan.size(); i++) {
            if (token.isCancelled()) {
                log.info("[Cluster: {}] Rebalance cancelled after {} moves", clusterId, i);
                report.setCancelled(true);
                for (int j = i; j < plan.size(); j++) {
                    plan.set(j, plan.get(j).toBuilder().outcome(WorkloadOutcome.NOT_ATTEMPTED).reason("Rebalance cancelled").build());
                }
                break;
            }
            plan.set(i, execute(plan.get(i)));
        }
        return report;
    }

    private List<RebalanceMove> plan(ClusterSnapshot snapshot, List<String> eligibleNodes, List<Workload> candidates,
                                     double initialVariance) {
        List<RebalanceMove> moves = new ArrayList<>();
        Set<String> moved = new HashSet<>();
        ClusterSnapshot current = snapshot;
        double currentVariance = initialVariance;

        while (moves.size() < maxMoves) {
            RebalanceMove best = null;
            ClusterSnapshot bestSnapshot = null;
            double bestVariance = currentVariance;

            for (Workload workload : candidates) {
                if (moved.contains(workload.getId())) {
                    continue;
                }
                String from = workload.getNodeId();
                PlacementRequest request = PlacementRequest.builder()
                    .workloadId(workload.getId())
                    .resources(workload.getResources())
                    .constraints(workload.getConstraints() != null ? workload.getConstraints() : AffinityConstraints.none())
                    .build();
                for (String to : eligibleNodes) {
                    if (to.equals(from)) {
                        continue;
                    }
                    CandidateNode target = current.getNode(to).orElse(null);
                    if (target == null || !placementEngine.accepts(request, target, current)) {
                        continue;
                    }
                    ClusterSnapshot next = current.withMove(workload.getId(), from, to, workload.getResources());
                    double nextVariance = variance(next, eligibleNodes);
                    // strict comparison keeps the first candidate in (workload id, node id) order on ties
                    if (nextVariance < bestVariance) {
                        bestVariance = nextVariance;
                        bestSnapshot = next;
                        best = RebalanceMove.builder()
                            .workloadId(workload.getId())
                            .sourceNodeId(from)
                            .targetNodeId(to)
                            .resources(workload.getResources())
                            .varianceReduction(currentVariance - nextVariance)
                            .outcome(WorkloadOutcome.PLANNED)
                            .build();
                    }
                }
            }

            if (best == null || best.getVarianceReduction() < minImprovement) {
                break;
            }
            moves.add(best);
            moved.add(best.getWorkloadId());
            current = bestSnapshot;
            currentVariance = bestVariance;
        }
        return moves;
    }

    private RebalanceMove execute(RebalanceMove move) {
        RebalanceMove.RebalanceMoveBuilder result = move.toBuilder();
        try {
            log.info("[Cluster: {}] Rebalancing {} from {} to {}", clusterId, move.getWorkloadId(),
                move.getSourceNodeId(), move.getTargetNodeId());
            MigrationJob job = migrationOrchestrator.migrateAndWait(move.getWorkloadId(), move.getTargetNodeId(), MigrationMode.LIVE);
            result.jobId(job.getJobId());
            if (job.getState() == MigrationState.COMPLETED) {
                return result.outcome(WorkloadOutcome.MIGRATED).build();
            }
            return result.outcome(WorkloadOutcome.FAILED).reason(job.getFailureReason()).build();
        } catch (OrchestratorException e) {
            log.warn("[Cluster: {}] Rebalance move of {} rejected: {}", clusterId, move.getWorkloadId(), e.getMessage());
            return result.outcome(WorkloadOutcome.FAILED).reason(e.getMessage()).build();
        } catch (Exception e) {
            log.error("[Cluster: {}] Rebalance move of {} failed: {}", clusterId, move.getWorkloadId(), e.getMessage(), e);
            return result.outcome(WorkloadOutcome.FAILED).reason(e.getMessage()).build();
        }
    }

    /**
     * Population variance of utilization over the given nodes.
     */
    static double variance(ClusterSnapshot snapshot, List<String> nodeIds) {
        double[] utilization = nodeIds.stream()
            .map(snapshot::getNode)
            .filter(Optional::isPresent)
            .mapToDouble(node -> node.get().getUtilization())
            .toArray();
        if (utilization.length == 0) {
            return 0.0;
        }
        double mean = 0.0;
        for (double value : utilization) {
            mean += value;
        }
        mean /= utilization.length;
        double sum = 0.0;
        for (double value : utilization) {
            sum += (value - mean) * (value - mean);
        }
        return sum / utilization.length;
    }
}

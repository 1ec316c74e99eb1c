package io.computeorchestrator.placement;

import io.computeorchestrator.enums.Decision;
import io.computeorchestrator.enums.ErrorKind;
import io.computeorchestrator.enums.PlacementStrategyType;
import io.computeorchestrator.enums.WorkloadState;
import io.computeorchestrator.errors.OrchestratorException;
import io.computeorchestrator.health.HealthMonitor;
import io.computeorchestrator.ledger.ResourceLedger;
import io.computeorchestrator.metrics.MetricsProvider;
import io.computeorchestrator.models.AffinityConstraints;
import io.computeorchestrator.models.ComputeNode;
import io.computeorchestrator.models.NodeAllocation;
import io.computeorchestrator.models.Workload;
import io.computeorchestrator.placement.deciders.AffinityDecider;
import io.computeorchestrator.placement.deciders.AvailabilityDecider;
import io.computeorchestrator.placement.deciders.CapacityDecider;
import io.computeorchestrator.placement.deciders.PlacementDecider;
import io.computeorchestrator.placement.strategies.PlacementStrategies;
import io.computeorchestrator.placement.strategies.PlacementStrategy;
import io.computeorchestrator.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;


/**
 * Chooses a destination node for a workload and reserves capacity on it.
 *
 * Selection: build a snapshot of the pool, filter nodes through the deciders, narrow to preferred
 * nodes when any survive, rank with the requested strategy and break ties by node id. Reservation
 * goes through the ledger's compare-and-commit; a lost race re-snapshots and retries a bounded
 * number of times.
 */
@Slf4j
public class PlacementEngine {

    private final MetadataStore metadataStore;
    private final String clusterId;
    private final ResourceLedger resourceLedger;
    private final HealthMonitor healthMonitor;
    private final MetricsProvider metricsProvider;
    private final PlacementStrategyType defaultStrategy;
    private final int maxReservationRetries;

    private final AvailabilityDecider availabilityDecider = new AvailabilityDecider();
    private final AffinityDecider affinityDecider = new AffinityDecider();
    private final CapacityDecider capacityDecider = new CapacityDecider();

    public PlacementEngine(MetadataStore metadataStore, String clusterId, ResourceLedger resourceLedger,
                           HealthMonitor healthMonitor, MetricsProvider metricsProvider,
                           PlacementStrategyType defaultStrategy, int maxReservationRetries) {
        this.metadataStore = metadataStore;
        this.clusterId = clusterId;
        this.resourceLedger = resourceLedger;
        this.healthMonitor = healthMonitor;
        this.metricsProvider = metricsProvider;
        this.defaultStrategy = defaultStrategy != null ? defaultStrategy : PlacementStrategyType.BALANCED;
        this.maxReservationRetries = maxReservationRetries;
    }

    /**
     * Current view of the pool: every registered node with cached health, ledger totals and the
     * owner of every live workload.
     */
    public ClusterSnapshot snapshot() throws Exception {
        Map<String, CandidateNode> candidates = new HashMap<>();
        for (ComputeNode node : metadataStore.getAllNodes(clusterId)) {
            NodeAllocation allocation = metadataStore.getAllocation(clusterId, node.getId()).getValue();
            if (allocation == null) {
                allocation = new NodeAllocation(node.getId());
            }
            candidates.put(node.getId(), CandidateNode.builder()
                .nodeId(node.getId())
                .capacity(node.getCapacity())
                .allocated(allocation.getAllocated())
                .workloadCount(allocation.getWorkloadCount())
                .healthStatus(healthMonitor.getStatus(node.getId()))
                .maintenance(node.isMaintenance())
                .build());
        }

        Map<String, String> owners = new HashMap<>();
        for (Workload workload : metadataStore.getAllWorkloads(clusterId)) {
            if (workload.getNodeId() != null && workload.getState() != WorkloadState.DELETED) {
                owners.put(workload.getId(), workload.getNodeId());
            }
        }
        return new ClusterSnapshot(candidates, owners);
    }

    /**
     * Choose a node against the current pool state without reserving anything.
     */
    public PlacementDecision selectNode(PlacementRequest request) throws Exception {
        return selectNode(request, snapshot());
    }

    /**
     * Choose a node against the given, possibly hypothetical, snapshot.
     */
    public PlacementDecision selectNode(PlacementRequest request, ClusterSnapshot snapshot) throws OrchestratorException {
        validate(request);
        warnOnDanglingReferences(request, snapshot);

        List<CandidateNode> available = new ArrayList<>();
        for (CandidateNode node : snapshot.getNodes()) {
            if (passes(availabilityDecider, request, node, snapshot)) {
                available.add(node);
            }
        }
        if (available.isEmpty()) {
            throw new OrchestratorException(ErrorKind.ALL_NODES_UNAVAILABLE,
                "No healthy node outside maintenance is available for " + request.getWorkloadId());
        }

        boolean anyFitsCapacity = false;
        List<CandidateNode> survivors = new ArrayList<>();
        for (CandidateNode node : available) {
            boolean fits = passes(capacityDecider, request, node, snapshot);
            anyFitsCapacity |= fits;
            if (fits && passes(affinityDecider, request, node, snapshot)) {
                survivors.add(node);
            }
        }
        if (survivors.isEmpty()) {
            if (anyFitsCapacity) {
                throw new OrchestratorException(ErrorKind.AFFINITY_UNSATISFIABLE,
                    "No node with enough capacity satisfies the affinity rules of " + request.getWorkloadId());
            }
            throw new OrchestratorException(ErrorKind.INSUFFICIENT_CAPACITY,
                "No available node can fit " + request.getResources() + " for " + request.getWorkloadId());
        }

        AffinityConstraints constraints = request.getConstraints();
        if (constraints != null && !constraints.getPreferredNodes().isEmpty()) {
            List<CandidateNode> preferred = survivors.stream()
                .filter(node -> constraints.getPreferredNodes().contains(node.getNodeId()))
                .collect(Collectors.toList());
            if (!preferred.isEmpty()) {
                survivors = preferred;
            }
        }

        PlacementStrategy strategy = PlacementStrategies.forType(
            request.getStrategy() != null ? request.getStrategy() : defaultStrategy);
        List<CandidateNode> ranked = strategy.rank(survivors);
        CandidateNode chosen = ranked.get(0);

        log.debug("Placement of {} with strategy {}: ranked {}", request.getWorkloadId(), strategy.getStrategyName(),
            ranked.stream().map(CandidateNode::getNodeId).collect(Collectors.toList()));

        return PlacementDecision.builder()
            .workloadId(request.getWorkloadId())
            .nodeId(chosen.getNodeId())
            .strategy(strategy.getType())
            .score(strategy.score(chosen))
            .rankedCandidates(ranked.stream().map(CandidateNode::getNodeId).collect(Collectors.toList()))
            .build();
    }

    /**
     * Choose a node and reserve the request on it.
     */
    public PlacementDecision placeWorkload(PlacementRequest request) throws Exception {
        PlacementStrategyType strategy = request.getStrategy() != null ? request.getStrategy() : defaultStrategy;
        try {
            for (int attempt = 1; attempt <= maxReservationRetries; attempt++) {
                PlacementDecision decision = selectNode(request);
                if (resourceLedger.tryReserve(decision.getNodeId(), request.getWorkloadId(), request.getResources())) {
                    log.info("Placed workload {} on node {} (strategy {}, attempt {})",
                        request.getWorkloadId(), decision.getNodeId(), decision.getStrategy().getValue(), attempt);
                    metricsProvider.recordPlacement(clusterId, strategy, "success");
                    return decision;
                }
                log.info("Reservation of {} on node {} lost a race (attempt {}/{}), re-evaluating",
                    request.getWorkloadId(), decision.getNodeId(), attempt, maxReservationRetries);
            }
            throw new OrchestratorException(ErrorKind.RESERVATION_CONFLICT,
                "Could not reserve capacity for " + request.getWorkloadId() + " after " + maxReservationRetries + " attempts");
        } catch (OrchestratorException e) {
            log.warn("Placement of {} failed: {} - {}", request.getWorkloadId(), e.getKind(), e.getMessage());
            metricsProvider.recordPlacement(clusterId, strategy, e.getKind().name().toLowerCase());
            throw e;
        }
    }

    /**
     * Whether every enabled decider accepts {@code node} for the request in the given snapshot.
     */
    public boolean accepts(PlacementRequest request, CandidateNode node, ClusterSnapshot snapshot) {
        return getDeciders().stream().allMatch(decider -> passes(decider, request, node, snapshot));
    }

    public List<PlacementDecider> getDeciders() {
        return List.of(availabilityDecider, affinityDecider, capacityDecider);
    }

    private boolean passes(PlacementDecider decider, PlacementRequest request, CandidateNode node, ClusterSnapshot snapshot) {
        if (!decider.isEnabled()) {
            return true;
        }
        return decider.canPlace(request, node, snapshot) == Decision.YES;
    }

    private void validate(PlacementRequest request) throws OrchestratorException {
        if (request.getWorkloadId() == null || request.getWorkloadId().isBlank()) {
            throw OrchestratorException.invalid("Workload id is required");
        }
        if (request.getResources() == null || request.getResources().isNegative()) {
            throw OrchestratorException.invalid("Resource request must be non-negative");
        }
    }

    private void warnOnDanglingReferences(PlacementRequest request, ClusterSnapshot snapshot) {
        AffinityConstraints constraints = request.getConstraints();
        if (constraints == null) {
            return;
        }
        if (constraints.getCoLocateWith() != null && snapshot.ownerOf(constraints.getCoLocateWith()).isEmpty()) {
            log.warn("Workload {} asks to be co-located with {}, which is not placed; ignoring",
                request.getWorkloadId(), constraints.getCoLocateWith());
        }
        if (constraints.getSeparateFrom() != null && snapshot.ownerOf(constraints.getSeparateFrom()).isEmpty()) {
            log.warn("Workload {} asks to be separated from {}, which is not placed; ignoring",
                request.getWorkloadId(), constraints.getSeparateFrom());
        }
    }
}

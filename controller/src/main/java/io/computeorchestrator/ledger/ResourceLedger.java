package io.computeorchestrator.ledger;

import io.computeorchestrator.enums.ErrorKind;
import io.computeorchestrator.errors.OrchestratorException;
import io.computeorchestrator.metrics.MetricsProvider;
import io.computeorchestrator.models.ComputeNode;
import io.computeorchestrator.models.NodeAllocation;
import io.computeorchestrator.models.Resources;
import io.computeorchestrator.models.Versioned;
import io.computeorchestrator.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;


/**
 * Authoritative record of the resources reserved on each compute node.
 *
 * Every mutation is a compare-and-commit on the node's versioned allocation record: read the
 * record and its version, decide, then write only if the version is unchanged. No lock is held
 * across store calls, so two concurrent reservations on the same node cannot both succeed against
 * the same free capacity.
 */
@Slf4j
public class ResourceLedger {

    private final MetadataStore metadataStore;
    private final String clusterId;
    private final int releaseRetries;
    private final MetricsProvider metricsProvider;

    public ResourceLedger(MetadataStore metadataStore, String clusterId, int releaseRetries,
                          MetricsProvider metricsProvider) {
        this.metadataStore = metadataStore;
        this.clusterId = clusterId;
        this.releaseRetries = releaseRetries;
        this.metricsProvider = metricsProvider;
    }

    /**
     * Capacity still free on a node: floor(total x ratio) minus all reservations, never negative.
     */
    public Resources availableCapacity(String nodeId) throws Exception {
        ComputeNode node = requireNode(nodeId);
        return node.getCapacity().minus(currentAllocation(nodeId).getValue().getAllocated());
    }

    public Resources totalCapacity(String nodeId) throws Exception {
        return requireNode(nodeId).getCapacity();
    }

    public Resources allocatedCapacity(String nodeId) throws Exception {
        return currentAllocation(nodeId).getValue().getAllocated();
    }

    public int workloadCount(String nodeId) throws Exception {
        return currentAllocation(nodeId).getValue().getWorkloadCount();
    }

    /**
     * Reservations held on a node, keyed by workload id.
     */
    public Map<String, Resources> reservations(String nodeId) throws Exception {
        return currentAllocation(nodeId).getValue().getReservations();
    }

    /**
     * Single compare-and-commit attempt.
     *
     * @return true if the workload now holds a reservation on the node
     */
    public boolean tryReserve(String nodeId, String workloadId, Resources request) throws Exception {
        return reserve(nodeId, workloadId, request).isHeld();
    }

    /**
     * Single compare-and-commit attempt reporting why it did or did not succeed.
     */
    public ReservationOutcome reserve(String nodeId, String workloadId, Resources request) throws Exception {
        if (request == null || request.isNegative()) {
            throw OrchestratorException.invalid("Reservation request must be non-negative");
        }
        Optional<ComputeNode> node = metadataStore.getNode(clusterId, nodeId);
        if (node.isEmpty()) {
            log.debug("Cannot reserve for {} on unknown node {}", workloadId, nodeId);
            return ReservationOutcome.UNKNOWN_NODE;
        }

        Versioned<NodeAllocation> current = currentAllocation(nodeId);
        NodeAllocation allocation = current.getValue();
        if (allocation.getReservations().containsKey(workloadId)) {
            log.debug("Workload {} already holds a reservation on node {}", workloadId, nodeId);
            return ReservationOutcome.ALREADY_RESERVED;
        }

        Resources available = node.get().getCapacity().minus(allocation.getAllocated());
        if (!available.fits(request)) {
            log.debug("Node {} cannot fit {} for {} (available {})", nodeId, request, workloadId, available);
            return ReservationOutcome.INSUFFICIENT_CAPACITY;
        }

        boolean committed = metadataStore.compareAndSetAllocation(
            clusterId, allocation.withReservation(workloadId, request), current.getVersion());
        if (!committed) {
            log.debug("Allocation record of node {} changed during reservation for {}", nodeId, workloadId);
            metricsProvider.recordReservationConflict(clusterId, nodeId);
            return ReservationOutcome.CONFLICT;
        }

        log.info("Reserved {} on node {} for workload {}", request, nodeId, workloadId);
        return ReservationOutcome.RESERVED;
    }

    /**
     * Drop the reservation of a workload on a node. Releasing an absent reservation is a no-op.
     * Conflicting writers are retried a bounded number of times.
     */
    public void release(String nodeId, String workloadId) throws Exception {
        for (int attempt = 1; attempt <= releaseRetries; attempt++) {
            Versioned<NodeAllocation> current = metadataStore.getAllocation(clusterId, nodeId);
            if (!current.isPresent() || !current.getValue().getReservations().containsKey(workloadId)) {
                log.debug("No reservation of {} on node {} to release", workloadId, nodeId);
                return;
            }
            boolean committed = metadataStore.compareAndSetAllocation(
                clusterId, current.getValue().withoutReservation(workloadId), current.getVersion());
            if (committed) {
                log.info("Released reservation of workload {} on node {}", workloadId, nodeId);
                return;
            }
            log.debug("Release of {} on node {} conflicted (attempt {}/{})", workloadId, nodeId, attempt, releaseRetries);
            metricsProvider.recordReservationConflict(clusterId, nodeId);
        }
        throw new OrchestratorException(ErrorKind.RESERVATION_CONFLICT,
            "Could not release reservation of " + workloadId + " on " + nodeId + " after " + releaseRetries + " attempts");
    }

    private Versioned<NodeAllocation> currentAllocation(String nodeId) throws Exception {
        Versioned<NodeAllocation> current = metadataStore.getAllocation(clusterId, nodeId);
        if (current.isPresent()) {
            return current;
        }
        return new Versioned<>(new NodeAllocation(nodeId), 0L);
    }

    private ComputeNode requireNode(String nodeId) throws Exception {
        return metadataStore.getNode(clusterId, nodeId)
            .orElseThrow(() -> OrchestratorException.notFound("Node " + nodeId));
    }
}

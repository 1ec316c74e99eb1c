package io.computeorchestrator.placement.deciders;

import io.computeorchestrator.enums.Decision;
import io.computeorchestrator.placement.CandidateNode;
import io.computeorchestrator.placement.ClusterSnapshot;
import io.computeorchestrator.placement.PlacementRequest;
import lombok.extern.slf4j.Slf4j;

/**
 * Only nodes that are HEALTHY and not in maintenance can receive workloads.
 */
@Slf4j
public class AvailabilityDecider implements PlacementDecider {
    private boolean enabled = true;

    @Override
    public Decision canPlace(PlacementRequest request, CandidateNode node, ClusterSnapshot snapshot) {
        if (node.isMaintenance()) {
            log.debug("AvailabilityDecider: node {} is in maintenance", node.getNodeId());
            return Decision.NO;
        }
        if (!node.getHealthStatus().isHealthy()) {
            log.debug("AvailabilityDecider: node {} is {}", node.getNodeId(), node.getHealthStatus());
            return Decision.NO;
        }
        return Decision.YES;
    }

    @Override
    public String getName() { return "AvailabilityDecider"; }

    @Override
    public boolean isEnabled() { return enabled; }

    @Override
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
}

package io.computeorchestrator.placement.deciders;

import io.computeorchestrator.enums.Decision;
import io.computeorchestrator.placement.CandidateNode;
import io.computeorchestrator.placement.ClusterSnapshot;
import io.computeorchestrator.placement.PlacementRequest;
import lombok.extern.slf4j.Slf4j;

/**
 * The request must fit the node's free capacity on every dimension.
 */
@Slf4j
public class CapacityDecider implements PlacementDecider {
    private boolean enabled = true;

    @Override
    public Decision canPlace(PlacementRequest request, CandidateNode node, ClusterSnapshot snapshot) {
        if (node.getAvailable().fits(request.getResources())) {
            return Decision.YES;
        }
        log.debug("CapacityDecider: node {} has {} free, request needs {}",
            node.getNodeId(), node.getAvailable(), request.getResources());
        return Decision.NO;
    }

    @Override
    public String getName() { return "CapacityDecider"; }

    @Override
    public boolean isEnabled() { return enabled; }

    @Override
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
}

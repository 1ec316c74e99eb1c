package io.computeorchestrator.placement.deciders;

import io.computeorchestrator.enums.Decision;
import io.computeorchestrator.models.AffinityConstraints;
import io.computeorchestrator.placement.CandidateNode;
import io.computeorchestrator.placement.ClusterSnapshot;
import io.computeorchestrator.placement.PlacementRequest;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Hard affinity rules: excluded nodes, co-location with another workload's owner and
 * separation from another workload's owner.
 *
 * A reference to a workload that has no owner in the snapshot does not restrict placement.
 */
@Slf4j
public class AffinityDecider implements PlacementDecider {
    private boolean enabled = true;

    @Override
    public Decision canPlace(PlacementRequest request, CandidateNode node, ClusterSnapshot snapshot) {
        AffinityConstraints constraints = request.getConstraints();
        if (constraints == null) {
            return Decision.YES;
        }
        String nodeId = node.getNodeId();

        if (constraints.getExcludedNodes().contains(nodeId)) {
            log.debug("AffinityDecider: node {} is excluded for {}", nodeId, request.getWorkloadId());
            return Decision.NO;
        }

        if (constraints.getCoLocateWith() != null) {
            Optional<String> owner = snapshot.ownerOf(constraints.getCoLocateWith());
            if (owner.isPresent() && !owner.get().equals(nodeId)) {
                log.debug("AffinityDecider: {} must be co-located with {} on {}",
                    request.getWorkloadId(), constraints.getCoLocateWith(), owner.get());
                return Decision.NO;
            }
        }

        if (constraints.getSeparateFrom() != null) {
            Optional<String> owner = snapshot.ownerOf(constraints.getSeparateFrom());
            if (owner.isPresent() && owner.get().equals(nodeId)) {
                log.debug("AffinityDecider: {} must be separated from {} on {}",
                    request.getWorkloadId(), constraints.getSeparateFrom(), nodeId);
                return Decision.NO;
            }
        }

        return Decision.YES;
    }

    @Override
    public String getName() { return "AffinityDecider"; }

    @Override
    public boolean isEnabled() { return enabled; }

    @Override
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
}

package io.computeorchestrator.placement.deciders;

import io.computeorchestrator.enums.Decision;
import io.computeorchestrator.placement.CandidateNode;
import io.computeorchestrator.placement.ClusterSnapshot;
import io.computeorchestrator.placement.PlacementRequest;

/**
 * Interface for placement decision making.
 *
 * Each PlacementDecider implements one rule for determining whether a workload
 * can be placed on a particular node.
 */
public interface PlacementDecider {

    /**
     * Determine if the workload described by {@code request} can be placed on {@code node}.
     *
     * @param request the placement request
     * @param node the candidate node
     * @param snapshot the pool view the decision is made against
     * @return placement decision
     */
    Decision canPlace(PlacementRequest request, CandidateNode node, ClusterSnapshot snapshot);

    /**
     * Get the name of this decider.
     */
    String getName();

    /**
     * Check if this decider is enabled.
     */
    boolean isEnabled();

    /**
     * Enable or disable this decider.
     */
    void setEnabled(boolean enabled);
}

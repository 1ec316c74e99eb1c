package io.computeorchestrator.placement.strategies;

import io.computeorchestrator.enums.PlacementStrategyType;
import io.computeorchestrator.placement.CandidateNode;

/**
 * Prefers the node currently holding the fewest workloads.
 */
public class SpreadPlacementStrategy implements PlacementStrategy {

    @Override
    public double score(CandidateNode node) {
        return -node.getWorkloadCount();
    }

    @Override
    public PlacementStrategyType getType() {
        return PlacementStrategyType.SPREAD;
    }
}

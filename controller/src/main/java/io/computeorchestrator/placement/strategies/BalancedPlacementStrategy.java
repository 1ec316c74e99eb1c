package io.computeorchestrator.placement.strategies;

import io.computeorchestrator.enums.PlacementStrategyType;
import io.computeorchestrator.placement.CandidateNode;

/**
 * Prefers the node with the highest mean normalized free capacity (vCPU, memory, disk weighted equally).
 */
public class BalancedPlacementStrategy implements PlacementStrategy {

    @Override
    public double score(CandidateNode node) {
        return node.getFreeRatio();
    }

    @Override
    public PlacementStrategyType getType() {
        return PlacementStrategyType.BALANCED;
    }
}

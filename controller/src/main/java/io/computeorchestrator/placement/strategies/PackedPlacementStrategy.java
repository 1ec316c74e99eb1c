package io.computeorchestrator.placement.strategies;

import io.computeorchestrator.enums.PlacementStrategyType;
import io.computeorchestrator.placement.CandidateNode;

/**
 * Bin-packing: prefers the node with the lowest mean normalized free capacity that still fits.
 */
public class PackedPlacementStrategy implements PlacementStrategy {

    @Override
    public double score(CandidateNode node) {
        return -node.getFreeRatio();
    }

    @Override
    public PlacementStrategyType getType() {
        return PlacementStrategyType.PACKED;
    }
}

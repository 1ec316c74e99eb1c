package io.computeorchestrator.placement.strategies;

import io.computeorchestrator.enums.PlacementStrategyType;
import io.computeorchestrator.placement.CandidateNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Strategy for ordering the nodes that passed every decider.
 *
 * Input: pre-filtered list of eligible nodes
 * Output: the same nodes, best first
 *
 * Implementations:
 * - BalancedPlacementStrategy: most free capacity first
 * - PackedPlacementStrategy: least free capacity first
 * - SpreadPlacementStrategy: fewest workloads first
 */
public interface PlacementStrategy {

    /**
     * Score of a node; higher is better.
     */
    double score(CandidateNode node);

    PlacementStrategyType getType();

    /**
     * Order eligible nodes best first. Equal scores are ordered by node id so the result is deterministic.
     */
    default List<CandidateNode> rank(List<CandidateNode> eligibleNodes) {
        List<CandidateNode> ranked = new ArrayList<>(eligibleNodes);
        ranked.sort(Comparator.<CandidateNode>comparingDouble(this::score).reversed()
            .thenComparing(CandidateNode::getNodeId));
        return ranked;
    }

    /**
     * Get strategy name for logging/debugging.
     */
    default String getStrategyName() {
        return getType().getValue();
    }
}

package io.computeorchestrator.placement;

import io.computeorchestrator.enums.PlacementStrategyType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outcome of node selection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlacementDecision {
    private String workloadId;
    private String nodeId;
    private PlacementStrategyType strategy;
    private double score;
    // nodes that passed every decider, best first
    private List<String> rankedCandidates;
}

package io.computeorchestrator.placement;

import io.computeorchestrator.enums.PlacementStrategyType;
import io.computeorchestrator.models.AffinityConstraints;
import io.computeorchestrator.models.Resources;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What to place and how. A null strategy means the configured default.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PlacementRequest {
    private String workloadId;
    private Resources resources;
    @Builder.Default
    private AffinityConstraints constraints = AffinityConstraints.none();
    private PlacementStrategyType strategy;
}

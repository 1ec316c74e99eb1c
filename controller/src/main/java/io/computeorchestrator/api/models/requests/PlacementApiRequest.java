package io.computeorchestrator.api.models.requests;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.computeorchestrator.models.AffinityConstraints;
import io.computeorchestrator.models.Resources;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of POST /workloads/placement.
 *
 * <pre>
 * {
 *   "workload_id": "vm-42",
 *   "resources": {"vcpus": 4, "memory_mb": 8192, "disk_gb": 80},
 *   "constraints": {"excluded_nodes": ["node-3"], "separate_from": "vm-41"},
 *   "strategy": "spread"
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlacementApiRequest {

    @JsonProperty("workload_id")
    private String workloadId;

    @JsonProperty("resources")
    private Resources resources;

    @JsonProperty("constraints")
    private AffinityConstraints constraints;

    // balanced, packed or spread; absent means the configured default
    @JsonProperty("strategy")
    private String strategy;
}

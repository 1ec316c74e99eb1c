package io.computeorchestrator.cluster;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.computeorchestrator.enums.WorkloadOutcome;
import io.computeorchestrator.models.Resources;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One planned relocation of a rebalance, and its outcome once executed.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RebalanceMove {

    @JsonProperty("workload_id")
    private String workloadId;

    @JsonProperty("source_node_id")
    private String sourceNodeId;

    @JsonProperty("target_node_id")
    private String targetNodeId;

    @JsonProperty("resources")
    private Resources resources;

    // drop in utilization variance the move was planned for
    @JsonProperty("variance_reduction")
    private double varianceReduction;

    @JsonProperty("outcome")
    private WorkloadOutcome outcome;

    @JsonProperty("job_id")
    private String jobId;

    @JsonProperty("reason")
    private String reason;
}

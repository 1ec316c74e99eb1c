package io.computeorchestrator.cluster;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.computeorchestrator.enums.ErrorKind;
import io.computeorchestrator.enums.WorkloadOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EvacuationResult {

    @JsonProperty("workload_id")
    private String workloadId;

    @JsonProperty("outcome")
    private WorkloadOutcome outcome;

    // planned during the dry run, then the node actually used
    @JsonProperty("target_node_id")
    private String targetNodeId;

    @JsonProperty("job_id")
    private String jobId;

    @JsonProperty("error_kind")
    private ErrorKind errorKind;

    @JsonProperty("reason")
    private String reason;
}

package io.computeorchestrator.cluster;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.computeorchestrator.enums.EvacuationStatus;
import io.computeorchestrator.enums.WorkloadOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-workload outcome of draining a node, in the order the workloads were processed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvacuationReport {

    @JsonProperty("node_id")
    private String nodeId;

    @JsonProperty("status")
    private EvacuationStatus status;

    @Builder.Default
    @JsonProperty("results")
    private List<EvacuationResult> results = new ArrayList<>();

    public long count(WorkloadOutcome outcome) {
        return results.stream().filter(result -> result.getOutcome() == outcome).count();
    }
}

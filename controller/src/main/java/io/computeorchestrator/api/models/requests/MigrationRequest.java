package io.computeorchestrator.api.models.requests;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MigrationRequest {

    @JsonProperty("workload_id")
    private String workloadId;

    @JsonProperty("target_node_id")
    private String targetNodeId;

    // "live" or "offline"; absent picks live for running workloads
    @JsonProperty("mode")
    private String mode;
}

package io.computeorchestrator.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.computeorchestrator.enums.WorkloadState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * A VM deployment, the unit of placement. Owned by at most one node at a time.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Workload {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("resources")
    private Resources resources;

    @JsonProperty("node_id")
    private String nodeId;

    @JsonProperty("state")
    private WorkloadState state;

    @Builder.Default
    @JsonProperty("constraints")
    private AffinityConstraints constraints = AffinityConstraints.none();

    @JsonProperty("created_at")
    private OffsetDateTime createdAt;

    @JsonProperty("updated_at")
    private OffsetDateTime updatedAt;

    public boolean isOwnedBy(String candidateNodeId) {
        return nodeId != null && nodeId.equals(candidateNodeId);
    }
}

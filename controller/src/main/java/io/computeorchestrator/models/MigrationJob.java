package io.computeorchestrator.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.computeorchestrator.enums.ErrorKind;
import io.computeorchestrator.enums.MigrationMode;
import io.computeorchestrator.enums.MigrationState;
import io.computeorchestrator.enums.WorkloadState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Tracks one in-flight relocation of a workload from a source to a target node.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MigrationJob {

    @JsonProperty("job_id")
    private String jobId;

    @JsonProperty("workload_id")
    private String workloadId;

    @JsonProperty("source_node_id")
    private String sourceNodeId;

    @JsonProperty("target_node_id")
    private String targetNodeId;

    @JsonProperty("mode")
    private MigrationMode mode;

    @JsonProperty("state")
    private MigrationState state;

    // Workload state before the job started; restored on rollback
    @JsonProperty("previous_workload_state")
    private WorkloadState previousWorkloadState;

    @JsonProperty("started_at")
    private OffsetDateTime startedAt;

    @JsonProperty("completed_at")
    private OffsetDateTime completedAt;

    @JsonProperty("failure_kind")
    private ErrorKind failureKind;

    @JsonProperty("failure_stage")
    private MigrationState failureStage;

    @JsonProperty("failure_reason")
    private String failureReason;

    @JsonProperty("rolled_back")
    private boolean rolledBack;

    @JsonIgnore
    public boolean isActive() {
        return state != null && !state.isTerminal();
    }
}

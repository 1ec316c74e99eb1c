package io.computeorchestrator.health;

import io.computeorchestrator.enums.HealthStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Cached health of one node as seen by the health monitor.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NodeHealthRecord {
    private String nodeId;
    private HealthStatus status = HealthStatus.UNKNOWN;
    private int consecutiveFailures;
    private OffsetDateTime lastProbeAt;
    private String lastError;

    public NodeHealthRecord(String nodeId) {
        this.nodeId = nodeId;
    }
}

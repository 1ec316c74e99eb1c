package io.computeorchestrator.placement;

import io.computeorchestrator.enums.HealthStatus;
import io.computeorchestrator.models.Resources;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time view of one node used while choosing a destination.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CandidateNode {
    private String nodeId;
    private Resources capacity;
    private Resources allocated;
    private HealthStatus healthStatus;
    private boolean maintenance;
    private int workloadCount;

    public Resources getAvailable() {
        return capacity.minus(allocated);
    }

    public boolean isAvailable() {
        return !maintenance && healthStatus == HealthStatus.HEALTHY;
    }

    /**
     * Mean over the three dimensions of free capacity divided by capacity; 0 for an empty node record.
     */
    public double getFreeRatio() {
        Resources available = getAvailable();
        return (ratio(available.getVcpus(), capacity.getVcpus())
            + ratio(available.getMemoryMb(), capacity.getMemoryMb())
            + ratio(available.getDiskGb(), capacity.getDiskGb())) / 3.0;
    }

    public double getUtilization() {
        return 1.0 - getFreeRatio();
    }

    public CandidateNode withReservation(Resources resources) {
        return toBuilder().allocated(allocated.plus(resources)).workloadCount(workloadCount + 1).build();
    }

    public CandidateNode withoutReservation(Resources resources) {
        return toBuilder().allocated(allocated.minus(resources)).workloadCount(Math.max(0, workloadCount - 1)).build();
    }

    private static double ratio(long part, long whole) {
        return whole > 0 ? (double) part / whole : 0.0;
    }
}

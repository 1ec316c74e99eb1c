package io.computeorchestrator.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.computeorchestrator.enums.HealthStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * A physical host offering capacity to workloads.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ComputeNode {

    @JsonProperty("id")
    private String id;

    @JsonProperty("hostname")
    private String hostname;

    @JsonProperty("total_vcpus")
    private int totalVcpus;

    @JsonProperty("total_memory_mb")
    private long totalMemoryMb;

    @JsonProperty("total_disk_gb")
    private long totalDiskGb;

    @Builder.Default
    @JsonProperty("cpu_overcommit_ratio")
    private double cpuOvercommitRatio = 2.0;

    @Builder.Default
    @JsonProperty("memory_overcommit_ratio")
    private double memoryOvercommitRatio = 1.0;

    @Builder.Default
    @JsonProperty("disk_overcommit_ratio")
    private double diskOvercommitRatio = 1.0;

    @JsonProperty("maintenance")
    private boolean maintenance;

    @Builder.Default
    @JsonProperty("health_status")
    private HealthStatus healthStatus = HealthStatus.UNKNOWN;

    @JsonProperty("last_probe_at")
    private OffsetDateTime lastProbeAt;

    @Builder.Default
    @JsonProperty("hypervisor_uri")
    private String hypervisorUri = "qemu:///system";

    // Compared by live-migration preflight
    @JsonProperty("cpu_model")
    private String cpuModel;

    @JsonProperty("hypervisor_version")
    private String hypervisorVersion;

    /**
     * Advertised capacity: physical totals multiplied by the overcommit ratios, rounded down.
     */
    @JsonIgnore
    public Resources getCapacity() {
        return Resources.of(
            (int) Math.floor(totalVcpus * cpuOvercommitRatio),
            (long) Math.floor(totalMemoryMb * memoryOvercommitRatio),
            (long) Math.floor(totalDiskGb * diskOvercommitRatio));
    }
}

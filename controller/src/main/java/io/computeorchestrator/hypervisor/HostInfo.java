package io.computeorchestrator.hypervisor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Host facts reported by the hypervisor of a node.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HostInfo {
    private int cpus;
    private long memoryMb;
    private String cpuModel;
    private String hypervisorVersion;
}

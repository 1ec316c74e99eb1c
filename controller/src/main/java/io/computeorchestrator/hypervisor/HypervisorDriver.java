package io.computeorchestrator.hypervisor;

import io.computeorchestrator.enums.HypervisorState;
import io.computeorchestrator.models.ComputeNode;
import io.computeorchestrator.models.Workload;

import java.util.List;

/**
 * Seam to the virtualization layer of the compute nodes.
 * Implementations talk to the hypervisor at {@link ComputeNode#getHypervisorUri()}.
 */
public interface HypervisorDriver {

    /**
     * Define the workload's VM on a node without starting it
     */
    void createWorkload(ComputeNode node, Workload workload) throws HypervisorException;

    void start(ComputeNode node, String workloadId) throws HypervisorException;

    void stop(ComputeNode node, String workloadId) throws HypervisorException;

    /**
     * Remove the VM and its disk from a node. Deleting an unknown VM is not an error.
     */
    void delete(ComputeNode node, String workloadId) throws HypervisorException;

    HypervisorState queryState(ComputeNode node, String workloadId) throws HypervisorException;

    /**
     * Copy the disk image of a stopped VM from source to target
     */
    void copyDisk(ComputeNode source, ComputeNode target, String workloadId) throws HypervisorException;

    /**
     * Stream memory and device state of a running VM to the target until it converges
     */
    void streamMemoryState(ComputeNode source, ComputeNode target, String workloadId) throws HypervisorException;

    /**
     * Pause the source copy and resume execution on the target
     */
    void switchover(ComputeNode source, ComputeNode target, String workloadId) throws HypervisorException;

    /**
     * Reasons why a live migration from source to target cannot work; empty when compatible.
     */
    List<String> checkCompatibility(ComputeNode source, ComputeNode target) throws HypervisorException;

    HostInfo hostInfo(ComputeNode node) throws HypervisorException;
}

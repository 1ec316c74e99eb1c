package io.computeorchestrator.health;

import io.computeorchestrator.hypervisor.HostInfo;
import io.computeorchestrator.hypervisor.HypervisorDriver;
import io.computeorchestrator.models.ComputeNode;
import lombok.extern.slf4j.Slf4j;

/**
 * Probes a node by asking its hypervisor for host information.
 * The node is healthy when the hypervisor answers and reports at least one CPU.
 */
@Slf4j
public class HypervisorHealthProbe implements HealthProbe {

    private final HypervisorDriver hypervisorDriver;

    public HypervisorHealthProbe(HypervisorDriver hypervisorDriver) {
        this.hypervisorDriver = hypervisorDriver;
    }

    @Override
    public boolean probe(ComputeNode node) throws Exception {
        HostInfo info = hypervisorDriver.hostInfo(node);
        boolean healthy = info != null && info.getCpus() > 0;
        if (!healthy) {
            log.debug("Hypervisor on node {} reported no CPUs", node.getId());
        }
        return healthy;
    }
}

package io.computeorchestrator.health;

import io.computeorchestrator.models.ComputeNode;

/**
 * Checks whether a compute node is able to host workloads.
 */
public interface HealthProbe {

    /**
     * @return true if the node answered and looks usable; an exception counts as a failed probe
     */
    boolean probe(ComputeNode node) throws Exception;
}
